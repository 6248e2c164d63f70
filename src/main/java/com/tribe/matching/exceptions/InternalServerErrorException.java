package com.tribe.matching.exceptions;

/**
 * Exception thrown when an internal error occurs.
 * <p>
 * This exception indicates a fault inside the matching engine that is not caused by
 * the caller's input.
 * </p>
 */
public class InternalServerErrorException extends RuntimeException {

    /**
     * Constructs a new {@link InternalServerErrorException} with the specified error message.
     *
     * @param m the detail message explaining the error.
     */
    public InternalServerErrorException(String m) {
        super(m);
    }

    public InternalServerErrorException(String m, Throwable cause) {
        super(m, cause);
    }
}
