package com.pocketapps.automation.store;

/**
 * A read or write against the backing database failed.
 */
public class StoreException extends RuntimeException {

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
