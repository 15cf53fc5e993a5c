package com.flow.x.exceptions;

/**
 * Exception thrown when reading or writing network data fails for reasons unrelated to the
 * caller's input, typically an underlying {@link java.io.IOException}.
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
