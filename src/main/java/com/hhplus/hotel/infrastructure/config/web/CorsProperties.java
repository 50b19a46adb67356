package com.hhplus.hotel.infrastructure.config.web;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 스토어프론트 CORS 설정 (hotel.cors.*)
 */
@Data
@ConfigurationProperties(prefix = "hotel.cors")
public class CorsProperties {

    private String allowedOrigin = "http://localhost:3000";
}
