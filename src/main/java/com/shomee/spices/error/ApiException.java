package com.shomee.spices.error;

/**
 * Base of the failures a request can end with. Carries the HTTP status the
 * failure is answered with.
 */
public abstract class ApiException extends RuntimeException {

    private final int statusCode;

    protected ApiException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    protected ApiException(String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
