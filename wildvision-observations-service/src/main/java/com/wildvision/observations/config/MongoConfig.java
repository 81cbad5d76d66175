package com.wildvision.observations.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.mongodb.autoconfigure.MongoClientSettingsBuilderCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.TimeUnit;

/**
 * Bounds every store call so an unreachable database fails the request instead of hanging it.
 */
@Configuration
public class MongoConfig {

    @Value("${wildvision.mongo.connect-timeout-ms:5000}")
    private int connectTimeoutMs;

    @Value("${wildvision.mongo.socket-timeout-ms:10000}")
    private int socketTimeoutMs;

    @Value("${wildvision.mongo.server-selection-timeout-ms:5000}")
    private int serverSelectionTimeoutMs;

    @Bean
    public MongoClientSettingsBuilderCustomizer observationStoreTimeouts() {
        return settings -> settings
                .applyToSocketSettings(socket -> socket
                        .connectTimeout(connectTimeoutMs, TimeUnit.MILLISECONDS)
                        .readTimeout(socketTimeoutMs, TimeUnit.MILLISECONDS))
                .applyToClusterSettings(cluster -> cluster
                        .serverSelectionTimeout(serverSelectionTimeoutMs, TimeUnit.MILLISECONDS));
    }
}
