package com.keyguard.exception;

/**
 * Single outward signal for every failed API key validation.
 *
 * The message never varies. The reason is for internal logging and tests
 * and must not reach a response.
 */
public class InvalidApiKeyException extends RuntimeException {

    public static final String MESSAGE = "Invalid API key";

    private final RejectionReason reason;

    public InvalidApiKeyException(RejectionReason reason) {
        super(MESSAGE, null, false, false);
        this.reason = reason;
    }

    public RejectionReason getReason() {
        return reason;
    }

    /**
     * Step of the validation at which the key was rejected.
     */
    public enum RejectionReason {
        MISSING,
        TOO_SHORT,
        NOT_FOUND,
        HASH_MISMATCH,
        EXPIRED
    }
}
