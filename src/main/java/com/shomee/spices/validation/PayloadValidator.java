package com.shomee.spices.validation;

import java.util.Comparator;
import java.util.List;

import org.springframework.stereotype.Component;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.shomee.spices.error.ValidationException;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.Path;
import jakarta.validation.Validator;

/**
 * Checks request payloads against their declared constraints and reports
 * every violation at once.
 */
@Component
public class PayloadValidator {

    private final Validator validator;

    public PayloadValidator(Validator validator) {
        this.validator = validator;
    }

    public List<FieldViolation> validate(Object payload) {
        if (payload == null) {
            return List.of(new FieldViolation("body", "must not be null"));
        }
        return validator.validate(payload).stream()
            .map(v -> new FieldViolation(jsonPath(v), v.getMessage()))
            .sorted(Comparator.comparing(FieldViolation::field)
                .thenComparing(FieldViolation::message))
            .toList();
    }

    public void requireValid(Object payload) {
        List<FieldViolation> violations = validate(payload);
        if (!violations.isEmpty()) {
            throw new ValidationException(violations);
        }
    }

    // Bean Validation reports Java component names; clients send JSON names.
    private static String jsonPath(ConstraintViolation<?> violation) {
        Class<?> type = violation.getRootBeanClass();
        StringBuilder path = new StringBuilder();
        for (Path.Node node : violation.getPropertyPath()) {
            if (node.getName() == null) {
                continue;
            }
            if (!path.isEmpty()) {
                path.append('.');
            }
            path.append(jsonName(type, node.getName()));
            if (node.getIndex() != null) {
                path.append('[').append(node.getIndex()).append(']');
            }
        }
        return path.toString();
    }

    private static String jsonName(Class<?> type, String component) {
        if (!type.isRecord()) {
            return component;
        }
        for (var recordComponent : type.getRecordComponents()) {
            if (recordComponent.getName().equals(component)) {
                JsonProperty property = recordComponent.getAnnotation(JsonProperty.class);
                return property != null && !property.value().isEmpty() ? property.value() : component;
            }
        }
        return component;
    }
}
