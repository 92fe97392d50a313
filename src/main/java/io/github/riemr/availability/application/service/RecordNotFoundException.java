package io.github.riemr.availability.application.service;

/**
 * Thrown when an edit or delete names a record the provider does not own.
 */
public class RecordNotFoundException extends RuntimeException {

    public RecordNotFoundException(String message) {
        super(message);
    }
}
