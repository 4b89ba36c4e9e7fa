package com.shomee.spices.service;

import java.util.LinkedHashMap;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.github.victools.jsonschema.generator.FieldScope;
import com.github.victools.jsonschema.generator.OptionPreset;
import com.github.victools.jsonschema.generator.SchemaGenerator;
import com.github.victools.jsonschema.generator.SchemaGeneratorConfigBuilder;
import com.github.victools.jsonschema.generator.SchemaVersion;
import com.github.victools.jsonschema.module.jackson.JacksonModule;
import com.github.victools.jsonschema.module.jakarta.validation.JakartaValidationModule;
import com.github.victools.jsonschema.module.jakarta.validation.JakartaValidationOption;
import com.shomee.spices.error.InternalException;
import com.shomee.spices.model.Lead;
import com.shomee.spices.model.Product;
import com.shomee.spices.model.User;

import io.opentelemetry.instrumentation.annotations.WithSpan;

/**
 * Publishes JSON Schemas of the stored entity shapes, keyed by collection
 * name.
 */
@Service
public class SchemaService {

    private static final Logger logger = LoggerFactory.getLogger(SchemaService.class);

    private static final Map<String, Class<?>> ENTITIES = entities();

    private final SchemaGenerator generator;

    public SchemaService() {
        this(defaultGenerator());
    }

    SchemaService(SchemaGenerator generator) {
        this.generator = generator;
    }

    @WithSpan("schema.describe")
    public Map<String, ObjectNode> describeAll() {
        Map<String, ObjectNode> schemas = new LinkedHashMap<>();
        ENTITIES.forEach((name, type) -> schemas.put(name, describe(type)));
        return schemas;
    }

    private ObjectNode describe(Class<?> type) {
        try {
            ObjectNode schema = generator.generateSchema(type);
            schema.put("title", type.getSimpleName());
            return schema;
        } catch (RuntimeException e) {
            logger.atError().setCause(e).log("Schema generation failed for {}", type.getSimpleName());
            throw new InternalException("schema generation failed for " + type.getSimpleName(), e);
        }
    }

    static SchemaGenerator defaultGenerator() {
        var builder = new SchemaGeneratorConfigBuilder(SchemaVersion.DRAFT_2020_12, OptionPreset.PLAIN_JSON)
            .with(new JacksonModule())
            .with(new JakartaValidationModule(JakartaValidationOption.NOT_NULLABLE_FIELD_IS_REQUIRED));
        builder.forFields().withDefaultResolver(SchemaService::defaultValue);
        return new SchemaGenerator(builder.build());
    }

    /**
     * Publishes {@link JsonProperty#defaultValue()} as the schema default,
     * typed after the field.
     */
    static Object defaultValue(FieldScope field) {
        JsonProperty property = field.getAnnotationConsideringFieldAndGetter(JsonProperty.class);
        if (property == null || property.defaultValue().isEmpty()) {
            return null;
        }
        Class<?> type = field.getType().getErasedType();
        if (type == Boolean.class || type == boolean.class) {
            return Boolean.valueOf(property.defaultValue());
        }
        return property.defaultValue();
    }

    private static Map<String, Class<?>> entities() {
        Map<String, Class<?>> entities = new LinkedHashMap<>();
        entities.put(User.COLLECTION, User.class);
        entities.put(Product.COLLECTION, Product.class);
        entities.put(Lead.COLLECTION, Lead.class);
        return entities;
    }
}
