package com.hhplus.hotel.infrastructure.external.notification;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * 주문 알림 서비스 설정 (hotel.notification.*)
 */
@Data
@ConfigurationProperties(prefix = "hotel.notification")
public class NotificationProperties {

    /** false면 HTTP 호출 없이 로그만 남긴다 */
    private boolean enabled = true;

    /** 알림 서비스 주소 */
    private String baseUrl = "http://localhost:8001";

    private Duration connectTimeout = Duration.ofSeconds(2);

    private Duration readTimeout = Duration.ofSeconds(3);
}
