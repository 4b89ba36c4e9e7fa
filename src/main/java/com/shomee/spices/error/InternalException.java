package com.shomee.spices.error;

public class InternalException extends ApiException {

    public InternalException(String message, Throwable cause) {
        super(message, 500, cause);
    }
}
