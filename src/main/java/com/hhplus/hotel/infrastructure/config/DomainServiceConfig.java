package com.hhplus.hotel.infrastructure.config;

import com.hhplus.hotel.domain.cart.CartLinePricer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * DomainServiceConfig - Domain Services를 Spring Bean으로 등록
 *
 * Domain Services는 순수 비즈니스 로직만 포함하므로 외부 의존성이 없습니다.
 */
@Configuration
public class DomainServiceConfig {

    @Bean
    public CartLinePricer cartLinePricer() {
        return new CartLinePricer();
    }
}
