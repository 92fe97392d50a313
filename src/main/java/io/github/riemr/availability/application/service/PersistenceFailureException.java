package io.github.riemr.availability.application.service;

/**
 * Opaque failure from the record store during a delete or insert.
 */
public class PersistenceFailureException extends RuntimeException {

    public PersistenceFailureException(String message) {
        super(message);
    }

    public PersistenceFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
