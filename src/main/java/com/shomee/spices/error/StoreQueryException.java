package com.shomee.spices.error;

public class StoreQueryException extends StoreException {

    public StoreQueryException(String message, Throwable cause) {
        super(message, cause);
    }
}
