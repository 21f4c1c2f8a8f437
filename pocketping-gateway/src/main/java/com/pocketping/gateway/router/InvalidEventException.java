package com.pocketping.gateway.router;

/**
 * An inbound event that cannot be processed: not JSON, unknown type, or a
 * payload missing what its type requires. Maps to HTTP 400.
 */
public class InvalidEventException extends RuntimeException {

    public InvalidEventException(String message) {
        super(message);
    }

    public InvalidEventException(String message, Throwable cause) {
        super(message, cause);
    }
}
