package com.shomee.spices.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.shomee.spices.dto.LeadDto.CreateLeadRequest;
import com.shomee.spices.model.Lead;
import com.shomee.spices.store.DocumentStore;
import com.shomee.spices.telemetry.CatalogTelemetry;
import com.shomee.spices.validation.PayloadValidator;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.instrumentation.annotations.WithSpan;

@Service
public class LeadService {

    private static final Logger logger = LoggerFactory.getLogger(LeadService.class);

    private final DocumentStore documentStore;
    private final PayloadValidator validator;
    private final CatalogTelemetry telemetry;

    public LeadService(DocumentStore documentStore, PayloadValidator validator, CatalogTelemetry telemetry) {
        this.documentStore = documentStore;
        this.validator = validator;
        this.telemetry = telemetry;
    }

    @WithSpan("lead.create")
    public String create(CreateLeadRequest request) {
        Span span = Span.current();

        validator.requireValid(request);
        Lead lead = request.toLead();
        validator.requireValid(lead);

        String id = documentStore.createDocument(Lead.COLLECTION, lead.toDocument());

        telemetry.incrementLeadsCreated();
        span.setStatus(StatusCode.OK, "lead captured");
        logger.atInfo().log("Lead captured: {} from {}", id, lead.source());
        return id;
    }
}
