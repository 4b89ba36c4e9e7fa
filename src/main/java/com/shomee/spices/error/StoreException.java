package com.shomee.spices.error;

/**
 * A document store operation failed. Always answered with 500.
 */
public abstract class StoreException extends ApiException {

    protected StoreException(String message, Throwable cause) {
        super(message, 500, cause);
    }
}
