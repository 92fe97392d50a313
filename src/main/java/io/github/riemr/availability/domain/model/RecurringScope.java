package io.github.riemr.availability.domain.model;

import java.time.LocalDate;

/**
 * Weekly recurrence on a fixed day. {@code dayOfWeek} is 0..6 with 0 = Sunday.
 */
public record RecurringScope(int dayOfWeek) implements Scope {

    public RecurringScope {
        if (dayOfWeek < 0 || dayOfWeek > 6) {
            throw new IllegalArgumentException("dayOfWeek must be 0..6: " + dayOfWeek);
        }
    }

    /** 0 = Sunday ... 6 = Saturday. */
    public static int dayIndex(LocalDate date) {
        return date.getDayOfWeek().getValue() % 7;
    }

    @Override
    public boolean isRecurring() {
        return true;
    }

    @Override
    public boolean appliesOn(LocalDate date) {
        return dayIndex(date) == dayOfWeek;
    }
}
