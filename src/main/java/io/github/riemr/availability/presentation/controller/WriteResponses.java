package io.github.riemr.availability.presentation.controller;

import io.github.riemr.availability.application.dto.BatchWriteResult;
import io.github.riemr.availability.application.dto.WriteOutcome;
import io.github.riemr.availability.application.dto.WriteUnitStatus;
import io.github.riemr.availability.domain.model.ScheduledRecord;
import io.github.riemr.availability.domain.timeline.WriteValidationError;
import org.springframework.http.ResponseEntity;

import java.util.Map;

/**
 * HTTP mapping shared by the write controllers: validation errors are 400,
 * everything else (conflicts and failed units included) is 200 with per-unit detail.
 */
final class WriteResponses {
    private WriteResponses() {}

    static <T extends ScheduledRecord<T>> ResponseEntity<?> of(BatchWriteResult<T> result) {
        if (result.isInvalid()) {
            return badRequest(result.units().get(0).validationError());
        }
        return ResponseEntity.ok(result);
    }

    static <T extends ScheduledRecord<T>> ResponseEntity<?> of(WriteOutcome<T> outcome) {
        if (outcome.status() == WriteUnitStatus.INVALID) {
            return badRequest(outcome.validationError());
        }
        return ResponseEntity.ok(outcome);
    }

    private static ResponseEntity<?> badRequest(WriteValidationError error) {
        String message = switch (error) {
            case INVALID_INTERVAL -> "startTime must be before endTime, both within 00:00-24:00";
            case MISSING_SCOPE -> "a valid weekday list, date or date range is required";
        };
        return ResponseEntity.badRequest().body(Map.of("error", error.name(), "message", message));
    }
}
