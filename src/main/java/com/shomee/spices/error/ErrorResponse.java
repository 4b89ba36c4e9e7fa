package com.shomee.spices.error;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.shomee.spices.validation.FieldViolation;

@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record ErrorResponse(String error, List<FieldViolation> errors, String traceId) {}
