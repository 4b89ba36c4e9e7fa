package com.shomee.spices.dto;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.shomee.spices.model.Product;

import jakarta.validation.constraints.NotNull;

public class ProductDto {

    public record CreateProductRequest(
        @NotNull String title,
        String description,
        @NotNull Double price,
        @NotNull String category,
        @JsonProperty("in_stock") Boolean inStock,
        @JsonProperty("image_url") String imageUrl,
        @JsonProperty("buy_url") String buyUrl,
        Boolean featured,
        List<String> tags
    ) {
        public Product toProduct() {
            return new Product(
                title,
                description,
                price,
                category,
                inStock != null ? inStock : Boolean.TRUE,
                imageUrl,
                buyUrl,
                featured != null ? featured : Boolean.FALSE,
                tags
            );
        }
    }

    public record ProductCreatedResponse(String id) {}
}
