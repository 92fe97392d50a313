package io.github.riemr.availability.domain.model;

import java.time.LocalDate;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Inclusive range of calendar dates. A single-day time-off has {@code startDate == endDate}.
 */
public record DateRangeScope(LocalDate startDate, LocalDate endDate) implements Scope {

    public DateRangeScope {
        Objects.requireNonNull(startDate, "startDate");
        Objects.requireNonNull(endDate, "endDate");
        if (endDate.isBefore(startDate)) {
            throw new IllegalArgumentException("endDate must not be before startDate");
        }
    }

    public static DateRangeScope singleDay(LocalDate date) {
        return new DateRangeScope(date, date);
    }

    @Override
    public boolean isRecurring() {
        return false;
    }

    @Override
    public boolean appliesOn(LocalDate date) {
        return !date.isBefore(startDate) && !date.isAfter(endDate);
    }

    public boolean intersects(DateRangeScope other) {
        return !startDate.isAfter(other.endDate) && !other.startDate.isAfter(endDate);
    }

    /** Weekday indexes (0 = Sunday) touched by this range. */
    public Set<Integer> daysOfWeek() {
        Set<Integer> days = new LinkedHashSet<>();
        for (LocalDate d = startDate; !d.isAfter(endDate) && days.size() < 7; d = d.plusDays(1)) {
            days.add(RecurringScope.dayIndex(d));
        }
        return days;
    }
}
