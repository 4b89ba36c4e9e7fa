package com.shomee.spices.config;

import java.time.Duration;
import java.util.List;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Application settings bound from the {@code app.*} properties.
 *
 * <p>{@code store.url} and {@code store.name} hold the raw environment values
 * ({@code DATABASE_URL}, {@code DATABASE_NAME}); they are only ever reported
 * as present or absent, never echoed back.
 */
@ConfigurationProperties(prefix = "app")
public record AppConfig(
    @DefaultValue Store store,
    @DefaultValue Cors cors
) {

    public record Store(
        String url,
        String name,
        @DefaultValue("5s") Duration serverSelectionTimeout
    ) {
        public boolean urlConfigured() {
            return url != null && !url.isBlank();
        }

        public boolean nameConfigured() {
            return name != null && !name.isBlank();
        }
    }

    /**
     * Cross-origin policy. Defaults are fully permissive: any origin, method
     * and header, with credentials.
     */
    public record Cors(
        @DefaultValue("*") List<String> allowedOriginPatterns,
        @DefaultValue("*") List<String> allowedMethods,
        @DefaultValue("*") List<String> allowedHeaders,
        @DefaultValue("true") boolean allowCredentials
    ) {}
}
