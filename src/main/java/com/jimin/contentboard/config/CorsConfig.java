package com.jimin.contentboard.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.lang.NonNull;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * 전역 CORS 설정
 *
 * Why: 브라우저 프론트엔드가 다른 origin에서 API를 호출하면
 *      OPTIONS preflight를 먼저 보내고, 응답에 CORS 헤더가 있어야 실제 요청을 보냄
 *
 * 허용 origin은 contentboard.cors.allowed-origins (쉼표 구분)
 */
@Configuration
public class CorsConfig implements WebMvcConfigurer {

    private static final String[] ALLOWED_METHODS = {"GET", "POST", "PUT", "DELETE", "OPTIONS"};

    @Value("${contentboard.cors.allowed-origins}")
    private String[] allowedOrigins;

    @Override
    public void addCorsMappings(@NonNull CorsRegistry registry) {
        registry.addMapping("/boards/**")
                .allowedOrigins(allowedOrigins)
                .allowedMethods(ALLOWED_METHODS)
                .allowedHeaders("*")
                .maxAge(3600);

        registry.addMapping("/posts/**")
                .allowedOrigins(allowedOrigins)
                .allowedMethods(ALLOWED_METHODS)
                .allowedHeaders("*")
                .maxAge(3600);
    }
}
