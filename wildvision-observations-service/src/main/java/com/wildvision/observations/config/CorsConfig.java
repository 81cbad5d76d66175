package com.wildvision.observations.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

import static com.wildvision.observations.config.ApiKeyInterceptor.API_KEY_HEADER;

@Configuration
public class CorsConfig implements WebMvcConfigurer {

    @Value("${wildvision.cors.allowed-origin:https://www.wildvisionhunt.com}")
    private String allowedOrigin;

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        registry.addMapping("/**")
                .allowedOrigins(allowedOrigin)
                .allowedMethods("GET", "POST", "DELETE", "OPTIONS")
                .allowedHeaders(API_KEY_HEADER, "Content-Type");
    }
}
