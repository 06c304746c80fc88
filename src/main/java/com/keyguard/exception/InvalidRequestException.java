package com.keyguard.exception;

import java.util.Map;

/**
 * Exception thrown when input passes schema validation but is still unusable,
 * e.g. a name that is blank after trimming.
 */
public class InvalidRequestException extends RuntimeException {

    private final Map<String, String> fieldErrors;

    public InvalidRequestException(String field, String message) {
        super(field + ": " + message);
        this.fieldErrors = Map.of(field, message);
    }

    public Map<String, String> getFieldErrors() {
        return fieldErrors;
    }
}
