package io.github.riemr.availability.domain.model;

import java.time.LocalDate;

/**
 * Where a schedule record applies: every week on one day, on one calendar date,
 * or across an inclusive range of dates.
 */
public interface Scope {

    boolean isRecurring();

    /**
     * Read-path day match: does a record with this scope apply on {@code date}?
     */
    boolean appliesOn(LocalDate date);
}
