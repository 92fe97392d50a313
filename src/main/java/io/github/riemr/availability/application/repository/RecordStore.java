package io.github.riemr.availability.application.repository;

/**
 * Write side of a record store. Each call is independent: callers that need an
 * order (delete before insert) issue the calls in that order and wait for each.
 */
public interface RecordStore<T> {

    /** Inserts the record and returns it with its generated id. */
    T insert(T record);

    void delete(Long id);
}
