package io.github.riemr.availability.domain.timeline;

import io.github.riemr.availability.domain.model.ScheduledRecord;
import io.github.riemr.availability.domain.model.TimeRange;

import java.util.List;

/**
 * Outcome of a write-path overlap check. A conflict is a decision point for the
 * caller, not a failure.
 *
 * @param hasOverlap         whether any existing record overlaps the proposal
 * @param overlappingEntries the overlapping records, ordered by start time
 * @param replaceCandidate   the proposal as it would be inserted on REPLACE
 * @param mergeCandidate     proposal merged with the first overlapping entry, or {@code null}
 */
public record OverlapCheckResult<T extends ScheduledRecord<T>>(
        boolean hasOverlap,
        List<T> overlappingEntries,
        TimeRange replaceCandidate,
        TimeRange mergeCandidate
) {

    public static <T extends ScheduledRecord<T>> OverlapCheckResult<T> none(TimeRange proposed) {
        return new OverlapCheckResult<T>(false, List.<T>of(), proposed, null);
    }
}
