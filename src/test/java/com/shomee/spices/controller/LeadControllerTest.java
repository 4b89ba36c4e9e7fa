package com.shomee.spices.controller;

import static org.hamcrest.Matchers.containsInAnyOrder;
import static org.hamcrest.Matchers.not;
import static org.hamcrest.Matchers.emptyString;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.util.List;

import org.bson.Document;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import com.shomee.spices.model.Lead;
import com.shomee.spices.config.JacksonConfig;
import com.shomee.spices.service.LeadService;
import com.shomee.spices.service.ProductService;
import com.shomee.spices.store.InMemoryDocumentStore;
import com.shomee.spices.telemetry.CatalogTelemetry;
import com.shomee.spices.validation.PayloadValidator;

@WebMvcTest(controllers = {ProductController.class, LeadController.class})
@Import({ProductService.class, LeadService.class, PayloadValidator.class, CatalogTelemetry.class,
    InMemoryDocumentStore.class, JacksonConfig.class})
class LeadControllerTest {

    @Autowired
    MockMvc mvc;

    @Autowired
    InMemoryDocumentStore store;

    @BeforeEach
    void resetStore() {
        store.reset();
    }

    @Test
    void capturesLeadWithDefaultSource() throws Exception {
        mvc.perform(post("/lead").contentType(MediaType.APPLICATION_JSON)
                .content("{\"name\": \"Ann\", \"email\": \"ann@example.com\"}"))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.id", not(emptyString())))
            .andExpect(jsonPath("$.message").value("Thanks for reaching out!"));

        List<Document> leads = store.stored(Lead.COLLECTION);
        assertEquals(1, leads.size());
        assertEquals("Ann", leads.get(0).getString("name"));
        assertEquals("website", leads.get(0).getString("source"));
        assertNull(leads.get(0).getString("message"));
    }

    @Test
    void keepsExplicitSource() throws Exception {
        mvc.perform(post("/lead").contentType(MediaType.APPLICATION_JSON)
                .content("{\"name\": \"Raj\", \"email\": \"raj@example.com\", \"message\": \"Bulk order?\", \"source\": \"instagram\"}"))
            .andExpect(status().isCreated());

        Document lead = store.stored(Lead.COLLECTION).get(0);
        assertEquals("instagram", lead.getString("source"));
        assertEquals("Bulk order?", lead.getString("message"));
    }

    @Test
    void missingNameAndEmailAreRejected() throws Exception {
        mvc.perform(post("/lead").contentType(MediaType.APPLICATION_JSON).content("{\"message\": \"hi\"}"))
            .andExpect(status().isUnprocessableEntity())
            .andExpect(jsonPath("$.errors[*].field", containsInAnyOrder("email", "name")));

        assertEquals(0, store.writes());
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
        "{\"name\": 42, \"email\": \"ann@example.com\"}                  | name",
        "{\"name\": \"Ann\", \"email\": 7}                               | email",
        "{\"name\": \"Ann\", \"email\": \"ann@example.com\", \"source\": true} | source",
    })
    void nonTextualValuesAreRejected(String body, String field) throws Exception {
        mvc.perform(post("/lead").contentType(MediaType.APPLICATION_JSON).content(body))
            .andExpect(status().isUnprocessableEntity())
            .andExpect(jsonPath("$.errors[0].field").value(field));

        assertEquals(0, store.writes());
    }

    @Test
    void unavailableStoreFailsWith500() throws Exception {
        store.setUnavailable(true);

        mvc.perform(post("/lead").contentType(MediaType.APPLICATION_JSON)
                .content("{\"name\": \"Ann\", \"email\": \"ann@example.com\"}"))
            .andExpect(status().isInternalServerError());
    }
}
