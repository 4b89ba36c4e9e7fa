package com.shomee.spices.error;

public class StoreWriteException extends StoreException {

    public StoreWriteException(String message, Throwable cause) {
        super(message, cause);
    }
}
