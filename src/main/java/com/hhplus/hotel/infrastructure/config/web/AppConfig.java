package com.hhplus.hotel.infrastructure.config.web;

import com.hhplus.hotel.presentation.common.auth.CustomerPrincipalArgumentResolver;
import org.springframework.context.annotation.Configuration;
import org.springframework.stereotype.Controller;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.method.support.HandlerMethodArgumentResolver;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.PathMatchConfigurer;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

import java.util.List;

/**
 * AppConfig - API 전역 설정
 *
 * - 모든 컨트롤러 요청에 /api prefix 추가
 * - @CurrentCustomer 파라미터 해석기 등록 (X-USER-ID)
 * - 스토어프론트 CORS 허용
 */
@Configuration
public class AppConfig implements WebMvcConfigurer {

    public static final String API_PREFIX = "/api";

    private final CorsProperties corsProperties;

    public AppConfig(CorsProperties corsProperties) {
        this.corsProperties = corsProperties;
    }

    @Override
    public void configurePathMatch(PathMatchConfigurer configurer) {
        configurer.addPathPrefix(API_PREFIX, c -> c.isAnnotationPresent(RestController.class) ||
                c.isAnnotationPresent(Controller.class));
    }

    @Override
    public void addArgumentResolvers(List<HandlerMethodArgumentResolver> resolvers) {
        resolvers.add(new CustomerPrincipalArgumentResolver());
    }

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        registry.addMapping(API_PREFIX + "/**")
                .allowedOrigins(corsProperties.getAllowedOrigin())
                .allowedMethods("GET", "POST", "PUT", "DELETE", "OPTIONS")
                .allowedHeaders("Origin", "Content-Type", "Accept", "Authorization",
                        CustomerPrincipalArgumentResolver.USER_ID_HEADER)
                .allowCredentials(true);
    }
}
