package com.shomee.spices.model;

import org.bson.Document;

import com.fasterxml.jackson.annotation.JsonProperty;

import jakarta.validation.constraints.NotNull;

/**
 * An inbound contact captured from the website form.
 */
public record Lead(
    @NotNull String name,
    @NotNull String email,
    String message,
    @JsonProperty(defaultValue = Lead.DEFAULT_SOURCE) String source
) {

    public static final String COLLECTION = "lead";
    public static final String DEFAULT_SOURCE = "website";

    public Document toDocument() {
        return new Document()
            .append("name", name)
            .append("email", email)
            .append("message", message)
            .append("source", source);
    }
}
