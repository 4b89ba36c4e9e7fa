package com.shomee.spices.config;

import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.mongo.MongoClientSettingsBuilderCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class MongoConfig {

    private static final Logger log = LoggerFactory.getLogger(MongoConfig.class);

    @Bean
    MongoClientSettingsBuilderCustomizer serverSelectionTimeoutCustomizer(AppConfig config) {
        long timeoutMs = config.store().serverSelectionTimeout().toMillis();
        log.info("MongoDB server selection timeout: {} ms", timeoutMs);
        return builder -> builder.applyToClusterSettings(
            cluster -> cluster.serverSelectionTimeout(timeoutMs, TimeUnit.MILLISECONDS));
    }
}
