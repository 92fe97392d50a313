package io.github.riemr.availability.domain.timeline;

import io.github.riemr.availability.domain.model.DateRangeScope;
import io.github.riemr.availability.domain.model.RecurringScope;
import io.github.riemr.availability.domain.model.ScheduledRecord;
import io.github.riemr.availability.domain.model.Scope;
import io.github.riemr.availability.domain.model.SpecificDateScope;
import io.github.riemr.availability.domain.model.TimeRange;

import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Guards writes of availability slots and time-off against overlapping records
 * of the same type, and turns the caller's Replace/Merge choice into a plan.
 * Records are always deleted whole; nothing is trimmed.
 */
public class OverlapConflictManager {

    public <T extends ScheduledRecord<T>> OverlapCheckResult<T> checkOverlap(Scope proposedScope,
                                                                            TimeRange proposed,
                                                                            Collection<T> existing) {
        Objects.requireNonNull(proposedScope, "proposedScope");
        Objects.requireNonNull(proposed, "proposed");
        if (existing == null || existing.isEmpty()) return OverlapCheckResult.<T>none(proposed);

        List<T> overlapping = existing.stream()
                .filter(r -> sameScopeUnit(proposedScope, r.getScope()))
                .filter(r -> IntervalCalculus.overlaps(proposed, r.range()))
                .sorted(Comparator.comparing((T r) -> r.range(), IntervalCalculus.BY_START)
                        .thenComparing((T r) -> r.getId(), Comparator.nullsLast(Comparator.naturalOrder())))
                .toList();
        if (overlapping.isEmpty()) return OverlapCheckResult.<T>none(proposed);

        // only the first overlapping entry feeds the merge preview
        TimeRange merged = IntervalCalculus.merge(proposed, overlapping.get(0).range());
        return new OverlapCheckResult<T>(true, overlapping, proposed, merged);
    }

    public <T extends ScheduledRecord<T>> ResolutionPlan<T> applyReplace(OverlapCheckResult<T> result, T proposed) {
        return new ResolutionPlan<T>(idsOf(result), proposed);
    }

    public <T extends ScheduledRecord<T>> ResolutionPlan<T> applyMerge(OverlapCheckResult<T> result, T proposed) {
        if (!result.hasOverlap()) return ResolutionPlan.<T>insertOnly(proposed);
        T merged = proposed.mergedWith(result.mergeCandidate(), result.overlappingEntries().get(0));
        return new ResolutionPlan<T>(idsOf(result), merged);
    }

    public <T extends ScheduledRecord<T>> ResolutionPlan<T> plan(ResolutionDecision decision,
                                                                OverlapCheckResult<T> result,
                                                                T proposed) {
        switch (decision) {
            case CANCEL:
                return ResolutionPlan.<T>empty();
            case REPLACE:
                return applyReplace(result, proposed);
            case MERGE:
                return applyMerge(result, proposed);
            default:
                throw new IllegalArgumentException("Unsupported decision: " + decision);
        }
    }

    /**
     * Write-path scope match. A recurring proposal only meets recurring records on the
     * same weekday; a dated proposal meets dated records sharing a date and recurring
     * records on any weekday it touches.
     */
    static boolean sameScopeUnit(Scope proposed, Scope existing) {
        if (proposed instanceof RecurringScope p) {
            return existing instanceof RecurringScope e && e.dayOfWeek() == p.dayOfWeek();
        }
        DateRangeScope proposedDates = asRange(proposed);
        if (existing instanceof RecurringScope e) {
            return proposedDates.daysOfWeek().contains(e.dayOfWeek());
        }
        return proposedDates.intersects(asRange(existing));
    }

    private static DateRangeScope asRange(Scope scope) {
        if (scope instanceof DateRangeScope r) return r;
        if (scope instanceof SpecificDateScope s) return DateRangeScope.singleDay(s.date());
        throw new IllegalArgumentException("Unsupported scope: " + scope);
    }

    private static <T extends ScheduledRecord<T>> List<Long> idsOf(OverlapCheckResult<T> result) {
        return result.overlappingEntries().stream().map(ScheduledRecord::getId).toList();
    }
}
