package com.hhplus.hotel.infrastructure.config.database;

import com.p6spy.engine.spy.P6SpyOptions;
import jakarta.annotation.PostConstruct;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Configuration;

/**
 * P6Spy 설정 클래스
 *
 * test 프로필에서만 활성화되며, 체크아웃 트랜잭션의 SQL을 바인딩 값과 함께 출력한다.
 * P6Spy는 포매터를 클래스명으로 생성하므로 옵션에 직접 등록한다.
 */
@Configuration
@ConditionalOnProperty(name = "spring.profiles.active", havingValue = "test")
public class P6SpyConfig {

    @PostConstruct
    public void registerMessageFormat() {
        P6SpyOptions.getActiveInstance().setLogMessageFormat(P6SpyPrettySqlFormatter.class.getName());
    }
}
