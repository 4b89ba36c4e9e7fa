package com.shomee.spices.validation;

/**
 * One offending field of a rejected payload. {@code field} is the JSON
 * property path, e.g. {@code price} or {@code tags[1]}.
 */
public record FieldViolation(String field, String message) {}
