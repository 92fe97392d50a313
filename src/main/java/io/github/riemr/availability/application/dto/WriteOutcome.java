package io.github.riemr.availability.application.dto;

import io.github.riemr.availability.domain.model.ScheduledRecord;
import io.github.riemr.availability.domain.model.Scope;
import io.github.riemr.availability.domain.timeline.OverlapCheckResult;
import io.github.riemr.availability.domain.timeline.WriteValidationError;

/**
 * Result of one scope unit (one weekday, one date or one date range) of a write.
 */
public record WriteOutcome<T extends ScheduledRecord<T>>(
        Scope scope,
        WriteUnitStatus status,
        WriteValidationError validationError,
        OverlapCheckResult<T> conflict,
        ExecutionReport<T> report
) {

    public static <T extends ScheduledRecord<T>> WriteOutcome<T> invalid(WriteValidationError error) {
        return new WriteOutcome<T>(null, WriteUnitStatus.INVALID, error, null, null);
    }

    public static <T extends ScheduledRecord<T>> WriteOutcome<T> conflict(Scope scope, OverlapCheckResult<T> conflict) {
        return new WriteOutcome<T>(scope, WriteUnitStatus.CONFLICT, null, conflict, null);
    }

    public static <T extends ScheduledRecord<T>> WriteOutcome<T> cancelled(Scope scope) {
        return new WriteOutcome<T>(scope, WriteUnitStatus.CANCELLED, null, null, null);
    }

    public static <T extends ScheduledRecord<T>> WriteOutcome<T> executed(Scope scope, ExecutionReport<T> report) {
        WriteUnitStatus status = report.completed() ? WriteUnitStatus.COMMITTED : WriteUnitStatus.FAILED;
        return new WriteOutcome<T>(scope, status, null, null, report);
    }
}
