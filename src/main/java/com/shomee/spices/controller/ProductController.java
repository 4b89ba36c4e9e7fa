package com.shomee.spices.controller;

import java.util.List;

import org.bson.Document;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import com.shomee.spices.dto.ProductDto.CreateProductRequest;
import com.shomee.spices.dto.ProductDto.ProductCreatedResponse;
import com.shomee.spices.service.ProductService;

@RestController
@RequestMapping("/products")
public class ProductController {

    private final ProductService productService;

    public ProductController(ProductService productService) {
        this.productService = productService;
    }

    @GetMapping
    public List<Document> list(
            @RequestParam(required = false) String category,
            @RequestParam(required = false) Boolean featured,
            @RequestParam(defaultValue = "" + ProductService.DEFAULT_LIMIT) int limit) {
        return productService.list(category, featured, limit);
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public ProductCreatedResponse create(@RequestBody CreateProductRequest request) {
        return new ProductCreatedResponse(productService.create(request));
    }
}
