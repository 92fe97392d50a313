package io.github.riemr.availability.domain.timeline;

import io.github.riemr.availability.domain.model.TimeRange;

import java.time.LocalDate;
import java.util.Collection;
import java.util.Optional;

public final class ProposalValidator {
    private ProposalValidator() {}

    public static Optional<WriteValidationError> validateInterval(Integer startMinute, Integer endMinute) {
        if (startMinute == null || endMinute == null) return Optional.of(WriteValidationError.INVALID_INTERVAL);
        if (!new TimeRange(startMinute, endMinute).isValid()) return Optional.of(WriteValidationError.INVALID_INTERVAL);
        return Optional.empty();
    }

    public static boolean isValidDayList(Collection<Integer> days) {
        return days != null && !days.isEmpty() && days.stream().allMatch(d -> d != null && d >= 0 && d <= 6);
    }

    public static boolean isValidDateRange(LocalDate start, LocalDate end) {
        return start != null && end != null && !end.isBefore(start);
    }
}
