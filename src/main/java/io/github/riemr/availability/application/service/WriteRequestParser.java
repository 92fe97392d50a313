package io.github.riemr.availability.application.service;

import io.github.riemr.availability.domain.model.TimeRange;
import io.github.riemr.availability.domain.timeline.IntervalCalculus;
import io.github.riemr.availability.domain.timeline.ProposalValidator;

/**
 * Turns request time strings into a validated interval. Malformed or missing
 * times count as an invalid interval rather than a request error.
 */
final class WriteRequestParser {
    private WriteRequestParser() {}

    static TimeRange parseInterval(String startTime, String endTime) {
        Integer start = parseOrNull(startTime);
        Integer end = parseOrNull(endTime);
        if (ProposalValidator.validateInterval(start, end).isPresent()) return null;
        return new TimeRange(start, end);
    }

    private static Integer parseOrNull(String text) {
        if (text == null || text.isBlank()) return null;
        try {
            return IntervalCalculus.parseMinute(text);
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
