package com.shomee.spices.dto;

public record MessageResponse(String message) {}
