package com.hhplus.hotel.infrastructure.external.notification;

import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

/**
 * 알림 서비스 호출용 RestTemplate
 * 연결/읽기 타임아웃을 짧게 두어 알림 실행기 스레드가 오래 묶이지 않게 한다.
 */
@Configuration
public class NotificationClientConfig {

    @Bean
    public RestTemplate notificationRestTemplate(RestTemplateBuilder builder, NotificationProperties properties) {
        return builder
                .rootUri(properties.getBaseUrl())
                .connectTimeout(properties.getConnectTimeout())
                .readTimeout(properties.getReadTimeout())
                .build();
    }
}
