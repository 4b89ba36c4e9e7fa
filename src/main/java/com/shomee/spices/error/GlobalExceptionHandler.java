package com.shomee.spices.error;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.TypeMismatchException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.WebRequest;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.mvc.method.annotation.ResponseEntityExceptionHandler;

import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.exc.MismatchedInputException;
import com.shomee.spices.validation.FieldViolation;

import io.opentelemetry.api.trace.Span;

/**
 * Turns request failures into {@link ErrorResponse} bodies. Binding failures
 * (unreadable JSON, wrong primitive types, bad query parameters) are reported
 * as 422 like any other validation failure.
 */
@RestControllerAdvice
public class GlobalExceptionHandler extends ResponseEntityExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(ApiException.class)
    public ResponseEntity<ErrorResponse> handleApiException(ApiException e) {
        List<FieldViolation> violations = List.of();
        if (e instanceof ValidationException validation) {
            violations = validation.getViolations();
        }
        if (e.getStatusCode() >= 500) {
            log.error("Request failed: {}", e.getMessage(), e);
        } else {
            log.warn("Request rejected: {}", e.getMessage());
        }
        return errorResponse(e.getStatusCode(), e.getMessage(), violations);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(Exception e) {
        log.error("Unexpected failure", e);
        return errorResponse(500, "internal server error", List.of());
    }

    @Override
    protected ResponseEntity<Object> handleHttpMessageNotReadable(
            HttpMessageNotReadableException ex, HttpHeaders headers, HttpStatusCode status, WebRequest request) {
        FieldViolation violation;
        if (ex.getCause() instanceof MismatchedInputException mismatch && !mismatch.getPath().isEmpty()) {
            violation = new FieldViolation(jsonPath(mismatch.getPath()), "invalid value for type "
                + (mismatch.getTargetType() != null ? mismatch.getTargetType().getSimpleName() : "unknown"));
        } else {
            violation = new FieldViolation("body", "malformed or missing JSON body");
        }
        log.warn("Unreadable request body: {}", ex.getMessage());
        return asObject(errorResponse(ValidationException.STATUS, "validation failed", List.of(violation)));
    }

    @Override
    protected ResponseEntity<Object> handleTypeMismatch(
            TypeMismatchException ex, HttpHeaders headers, HttpStatusCode status, WebRequest request) {
        String name = ex instanceof MethodArgumentTypeMismatchException argument
            ? argument.getName()
            : ex.getPropertyName();
        String expected = ex.getRequiredType() != null ? ex.getRequiredType().getSimpleName() : "unknown";
        var violation = new FieldViolation(name, "invalid value '" + ex.getValue() + "' for type " + expected);
        log.warn("Rejected parameter {}: {}", name, ex.getValue());
        return asObject(errorResponse(ValidationException.STATUS, "validation failed", List.of(violation)));
    }

    private static String jsonPath(List<JsonMappingException.Reference> path) {
        var sb = new StringBuilder();
        for (var ref : path) {
            if (ref.getFieldName() != null) {
                if (!sb.isEmpty()) {
                    sb.append('.');
                }
                sb.append(ref.getFieldName());
            } else if (ref.getIndex() >= 0) {
                sb.append('[').append(ref.getIndex()).append(']');
            }
        }
        return sb.toString();
    }

    private static ResponseEntity<ErrorResponse> errorResponse(int status, String message,
                                                               List<FieldViolation> violations) {
        String traceId = Span.current().getSpanContext().getTraceId();
        return ResponseEntity.status(status).body(new ErrorResponse(message, violations, traceId));
    }

    private static ResponseEntity<Object> asObject(ResponseEntity<ErrorResponse> response) {
        return ResponseEntity.status(response.getStatusCode()).body(response.getBody());
    }
}
