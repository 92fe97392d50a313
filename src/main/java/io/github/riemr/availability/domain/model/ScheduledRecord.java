package io.github.riemr.availability.domain.model;

/**
 * Common view over persisted interval records (availability slots, time-off)
 * used by overlap detection and replace/merge planning.
 *
 * @param <T> the concrete record type
 */
public interface ScheduledRecord<T extends ScheduledRecord<T>> {

    Long getId();

    Scope getScope();

    /** The interval this record occupies on any day it applies to. */
    TimeRange range();

    /**
     * Unsaved copy of this record spanning {@code merged}. {@code firstOverlap}
     * is the existing record the merge was computed against.
     */
    T mergedWith(TimeRange merged, T firstOverlap);
}
