package com.shomee.spices.telemetry;

import org.springframework.stereotype.Component;

import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.Meter;
import jakarta.annotation.PostConstruct;

@Component
public class CatalogTelemetry {

    private LongCounter productsCreated;
    private LongCounter leadsCreated;

    @PostConstruct
    void init() {
        Meter meter = GlobalOpenTelemetry.getMeter("shomee-spices-api");

        productsCreated = meter.counterBuilder("products.created")
                .setDescription("Total number of products created")
                .build();

        leadsCreated = meter.counterBuilder("leads.created")
                .setDescription("Total number of leads captured")
                .build();
    }

    public void incrementProductsCreated() {
        productsCreated.add(1);
    }

    public void incrementLeadsCreated() {
        leadsCreated.add(1);
    }
}
