package com.shomee.spices.model;

import java.util.List;

import org.bson.Document;

import com.fasterxml.jackson.annotation.JsonProperty;

import jakarta.validation.constraints.NotNull;

/**
 * A catalog entry, stored in the {@value #COLLECTION} collection.
 */
public record Product(
    @NotNull String title,
    String description,
    @NotNull Double price,
    @NotNull String category,
    @JsonProperty(value = "in_stock", defaultValue = "true") Boolean inStock,
    @JsonProperty("image_url") String imageUrl,
    @JsonProperty("buy_url") String buyUrl,
    @JsonProperty(defaultValue = "false") Boolean featured,
    List<String> tags
) {

    public static final String COLLECTION = "product";

    public Document toDocument() {
        return new Document()
            .append("title", title)
            .append("description", description)
            .append("price", price)
            .append("category", category)
            .append("in_stock", inStock)
            .append("image_url", imageUrl)
            .append("buy_url", buyUrl)
            .append("featured", featured)
            .append("tags", tags);
    }
}
