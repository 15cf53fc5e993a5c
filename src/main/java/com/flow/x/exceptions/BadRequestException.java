package com.flow.x.exceptions;

/**
 * Thrown when a caller hands the engine a malformed network.
 * <p>
 * Raised at the construction boundary only: out-of-range node ids, negative capacities,
 * unparseable input text or a request that breaks the configured size limits.
 * The push-relabel loop itself never sees this exception.
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
