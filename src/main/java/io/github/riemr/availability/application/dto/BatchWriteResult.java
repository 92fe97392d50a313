package io.github.riemr.availability.application.dto;

import io.github.riemr.availability.domain.model.ScheduledRecord;
import io.github.riemr.availability.domain.timeline.WriteValidationError;

import java.util.List;

/**
 * Per-unit outcomes of a write spanning several scope units. Units are not
 * atomic together: units committed before a failure stay committed.
 */
public record BatchWriteResult<T extends ScheduledRecord<T>>(List<WriteOutcome<T>> units) {

    public static <T extends ScheduledRecord<T>> BatchWriteResult<T> invalid(WriteValidationError error) {
        return new BatchWriteResult<T>(List.of(WriteOutcome.<T>invalid(error)));
    }

    public long count(WriteUnitStatus status) {
        return units.stream().filter(u -> u.status() == status).count();
    }

    public boolean isInvalid() {
        return units.stream().anyMatch(u -> u.status() == WriteUnitStatus.INVALID);
    }
}
