package com.hhplus.hotel;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableAsync;

/**
 * Hotel Store 애플리케이션 메인 클래스
 *
 * 활성화된 기능:
 * - @EnableAsync: 주문 알림 비동기 발송 지원
 * - @ConfigurationPropertiesScan: hotel.* 설정 바인딩
 */
@EnableAsync
@ConfigurationPropertiesScan
@SpringBootApplication
public class HotelStoreApplication {

    public static void main(String[] args) {
        SpringApplication.run(HotelStoreApplication.class, args);
    }

}
