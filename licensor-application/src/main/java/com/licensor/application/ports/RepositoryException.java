package com.licensor.application.ports;

/**
 * Opaque storage failure. Adapters wrap their own exception types in this one;
 * the core never inspects the cause.
 */
public class RepositoryException extends RuntimeException {

    public RepositoryException(String message, Throwable cause) {
        super(message, cause);
    }

    public RepositoryException(String message) {
        super(message);
    }
}
