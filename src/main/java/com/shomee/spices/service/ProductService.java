package com.shomee.spices.service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.shomee.spices.dto.ProductDto.CreateProductRequest;
import com.shomee.spices.model.Product;
import com.shomee.spices.store.DocumentStore;
import com.shomee.spices.telemetry.CatalogTelemetry;
import com.shomee.spices.validation.PayloadValidator;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.instrumentation.annotations.WithSpan;

@Service
public class ProductService {

    private static final Logger logger = LoggerFactory.getLogger(ProductService.class);

    public static final int DEFAULT_LIMIT = 50;

    private final DocumentStore documentStore;
    private final PayloadValidator validator;
    private final CatalogTelemetry telemetry;

    public ProductService(DocumentStore documentStore, PayloadValidator validator, CatalogTelemetry telemetry) {
        this.documentStore = documentStore;
        this.validator = validator;
        this.telemetry = telemetry;
    }

    /**
     * Lists products matching every given filter. Null filters, and a blank
     * category, are left out.
     */
    @WithSpan("product.list")
    public List<Document> list(String category, Boolean featured, int limit) {
        Map<String, Object> filter = new LinkedHashMap<>();
        if (category != null && !category.isBlank()) {
            filter.put("category", category);
        }
        if (featured != null) {
            filter.put("featured", featured);
        }
        List<Document> products = documentStore.listDocuments(Product.COLLECTION, filter, limit);
        Span.current().setStatus(StatusCode.OK, "products listed");
        return products;
    }

    @WithSpan("product.create")
    public String create(CreateProductRequest request) {
        Span span = Span.current();

        validator.requireValid(request);
        Product product = request.toProduct();
        validator.requireValid(product);

        String id = documentStore.createDocument(Product.COLLECTION, product.toDocument());

        telemetry.incrementProductsCreated();
        span.setStatus(StatusCode.OK, "product created");
        logger.atInfo().log("Product created: {} ({})", id, product.title());
        return id;
    }
}
