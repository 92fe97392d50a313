package io.github.riemr.availability.domain.timeline;

/**
 * Structural problems with a proposed write, reported before any I/O.
 */
public enum WriteValidationError {
    /** End is not after start, or a bound falls outside 00:00-24:00. */
    INVALID_INTERVAL,
    /** No usable weekday, date or ordered date range was supplied. */
    MISSING_SCOPE
}
