package com.shomee.spices.error;

import java.util.List;
import java.util.stream.Collectors;

import com.shomee.spices.validation.FieldViolation;

public class ValidationException extends ApiException {

    public static final int STATUS = 422;

    private final List<FieldViolation> violations;

    public ValidationException(List<FieldViolation> violations) {
        super(describe(violations), STATUS);
        this.violations = List.copyOf(violations);
    }

    public List<FieldViolation> getViolations() {
        return violations;
    }

    private static String describe(List<FieldViolation> violations) {
        return violations.stream()
            .map(v -> v.field() + ": " + v.message())
            .collect(Collectors.joining("; ", "validation failed: ", ""));
    }
}
