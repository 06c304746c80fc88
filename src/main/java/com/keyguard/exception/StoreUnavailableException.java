package com.keyguard.exception;

/**
 * Exception thrown when the database cannot be reached or a transaction
 * cannot complete.
 */
public class StoreUnavailableException extends RuntimeException {

    public static final String MESSAGE = "Service temporarily unavailable";

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
