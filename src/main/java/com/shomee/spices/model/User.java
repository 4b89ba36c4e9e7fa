package com.shomee.spices.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;

/**
 * Shop user. Only published through {@code GET /schema}; no endpoint reads or
 * writes it.
 */
public record User(
    @NotNull String name,
    @NotNull String email,
    String address,
    @Min(0) @Max(120) Integer age,
    @JsonProperty(value = "is_active", defaultValue = "true") Boolean isActive
) {

    public static final String COLLECTION = "user";
}
