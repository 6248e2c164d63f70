package com.tribe.matching.exceptions;

/**
 * Failure reported by an advisory client. Always caught by the advisory gateway.
 */
public class AdvisoryUnavailableException extends RuntimeException {

    public AdvisoryUnavailableException(String message) {
        super(message);
    }

    public AdvisoryUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
