package com.keyguard.exception;

import java.util.UUID;

/**
 * Thrown when an item or key id does not resolve to a stored record.
 */
public class ResourceNotFoundException extends RuntimeException {

    public ResourceNotFoundException(String resource, UUID id) {
        super(String.format("%s not found: %s", resource, id));
    }
}
