package com.tribe.matching.exceptions;

/**
 * Exception thrown when a matching request cannot be processed as given.
 * <p>
 * Used for malformed inputs that cannot be repaired, such as a missing reference user id.
 * Out-of-range tuning values are repaired instead of rejected.
 * </p>
 */
public class BadRequestException extends RuntimeException {

    /**
     * Constructs a new BadRequestException with the specified detail message.
     *
     * @param message the detail message which explains the cause of the exception.
     */
    public BadRequestException(String message) {
        super(message);
    }
}
