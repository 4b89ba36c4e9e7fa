package com.shomee.spices.service;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.github.victools.jsonschema.generator.SchemaGenerator;
import com.shomee.spices.error.InternalException;

class SchemaServiceTest {

    private final SchemaService service = new SchemaService();

    static List<String> names(JsonNode array) {
        List<String> names = new ArrayList<>();
        array.forEach(node -> names.add(node.asText()));
        return names;
    }

    @Test
    void describesExactlyUserProductLead() {
        Map<String, ObjectNode> schemas = service.describeAll();

        assertEquals(List.of("user", "product", "lead"), new ArrayList<>(schemas.keySet()));
    }

    @Test
    void productSchemaUsesWireNamesAndRequiredFields() {
        ObjectNode product = service.describeAll().get("product");
        JsonNode properties = product.get("properties");

        assertEquals("Product", product.get("title").asText());
        assertEquals("object", product.get("type").asText());
        assertTrue(properties.has("in_stock"));
        assertTrue(properties.has("image_url"));
        assertTrue(properties.has("buy_url"));
        assertFalse(properties.has("inStock"));
        assertEquals("array", properties.get("tags").get("type").asText());
        assertEquals("number", properties.get("price").get("type").asText());

        List<String> required = names(product.get("required"));
        assertTrue(required.containsAll(List.of("title", "price", "category")));
        assertFalse(required.contains("in_stock"));
        assertFalse(required.contains("description"));
    }

    @Test
    void leadAndUserSchemasRequireNameAndEmail() {
        Map<String, ObjectNode> schemas = service.describeAll();

        assertTrue(names(schemas.get("lead").get("required")).containsAll(List.of("name", "email")));
        assertTrue(names(schemas.get("user").get("required")).containsAll(List.of("name", "email")));
        assertTrue(schemas.get("user").get("properties").has("is_active"));
    }

    @Test
    void defaultedFieldsPublishTheirDefaults() {
        Map<String, ObjectNode> schemas = service.describeAll();
        JsonNode product = schemas.get("product").get("properties");

        assertTrue(product.get("in_stock").get("default").isBoolean());
        assertTrue(product.get("in_stock").get("default").asBoolean());
        assertFalse(product.get("featured").get("default").asBoolean());
        assertFalse(product.get("title").has("default"));
        assertEquals("website", schemas.get("lead").get("properties").get("source").get("default").asText());
        assertTrue(schemas.get("user").get("properties").get("is_active").get("default").asBoolean());
    }

    @Test
    void generatorFailureBecomesInternalException() {
        SchemaGenerator generator = mock(SchemaGenerator.class, invocation -> {
            throw new IllegalArgumentException("boom");
        });

        var failing = new SchemaService(generator);

        InternalException e = assertThrows(InternalException.class, failing::describeAll);
        assertEquals(500, e.getStatusCode());
    }
}
