package com.shomee.spices.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
public class CorsConfig implements WebMvcConfigurer {

    private static final Logger log = LoggerFactory.getLogger(CorsConfig.class);

    private final AppConfig config;

    public CorsConfig(AppConfig config) {
        this.config = config;
    }

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        var cors = config.cors();
        // allowCredentials rejects a literal "*" origin, so patterns are used instead
        registry.addMapping("/**")
            .allowedOriginPatterns(cors.allowedOriginPatterns().toArray(new String[0]))
            .allowedMethods(cors.allowedMethods().toArray(new String[0]))
            .allowedHeaders(cors.allowedHeaders().toArray(new String[0]))
            .allowCredentials(cors.allowCredentials());
        log.info("CORS origins={}, methods={}, headers={}, credentials={}",
            cors.allowedOriginPatterns(), cors.allowedMethods(),
            cors.allowedHeaders(), cors.allowCredentials());
    }
}
