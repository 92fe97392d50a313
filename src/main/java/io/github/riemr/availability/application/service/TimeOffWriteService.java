package io.github.riemr.availability.application.service;

import io.github.riemr.availability.application.dto.BatchWriteResult;
import io.github.riemr.availability.application.dto.TimeOffWriteRequest;
import io.github.riemr.availability.application.dto.WriteOutcome;
import io.github.riemr.availability.application.dto.WriteUnitStatus;
import io.github.riemr.availability.application.repository.TimeOffRepository;
import io.github.riemr.availability.domain.model.DateRangeScope;
import io.github.riemr.availability.domain.model.RecurringScope;
import io.github.riemr.availability.domain.model.Scope;
import io.github.riemr.availability.domain.model.TimeOff;
import io.github.riemr.availability.domain.model.TimeRange;
import io.github.riemr.availability.domain.timeline.OverlapCheckResult;
import io.github.riemr.availability.domain.timeline.ProposalValidator;
import io.github.riemr.availability.domain.timeline.ResolutionDecision;
import io.github.riemr.availability.domain.timeline.ResolutionPlan;
import io.github.riemr.availability.domain.timeline.TimelineEngine;
import io.github.riemr.availability.domain.timeline.WriteValidationError;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

@Service
@RequiredArgsConstructor
@Slf4j
public class TimeOffWriteService {
    private final TimeOffRepository repository;
    private final ScheduleWriteCoordinator coordinator;
    private final TimelineEngine engine;
    private final Clock clock;

    public List<TimeOff> list(String providerId) {
        return repository.findByProvider(providerId);
    }

    public BatchWriteResult<TimeOff> create(String providerId, TimeOffWriteRequest req) {
        TimeRange range = interval(req);
        if (range == null) return BatchWriteResult.<TimeOff>invalid(WriteValidationError.INVALID_INTERVAL);
        List<Scope> scopes = toScopes(req);
        if (scopes.isEmpty()) return BatchWriteResult.<TimeOff>invalid(WriteValidationError.MISSING_SCOPE);

        List<WriteOutcome<TimeOff>> outcomes = new ArrayList<>();
        for (Scope scope : scopes) {
            outcomes.add(coordinator.writeUnit(repository, repository.findByProvider(providerId),
                    newTimeOff(providerId, scope, range, req)));
        }
        BatchWriteResult<TimeOff> result = new BatchWriteResult<>(outcomes);
        log.info("Time-off write for provider {}: {} committed, {} conflict(s), {} failed",
                providerId, result.count(WriteUnitStatus.COMMITTED), result.count(WriteUnitStatus.CONFLICT),
                result.count(WriteUnitStatus.FAILED));
        return result;
    }

    public BatchWriteResult<TimeOff> resolve(String providerId, TimeOffWriteRequest req) {
        if (req.getDecision() == null) throw new IllegalArgumentException("decision is required");
        TimeRange range = interval(req);
        if (range == null) return BatchWriteResult.<TimeOff>invalid(WriteValidationError.INVALID_INTERVAL);
        List<Scope> scopes = toScopes(req);
        if (scopes.isEmpty()) return BatchWriteResult.<TimeOff>invalid(WriteValidationError.MISSING_SCOPE);

        List<WriteOutcome<TimeOff>> outcomes = new ArrayList<>();
        for (Scope scope : scopes) {
            outcomes.add(coordinator.resolveUnit(repository, repository.findByProvider(providerId),
                    newTimeOff(providerId, scope, range, req), req.getDecision()));
        }
        log.info("Time-off {} for provider {} over {} unit(s)", req.getDecision(), providerId, outcomes.size());
        return new BatchWriteResult<>(outcomes);
    }

    /**
     * Edits times, all-day flag and reason of a time-off; the scope is kept.
     */
    public WriteOutcome<TimeOff> update(String providerId, Long timeOffId, TimeOffWriteRequest req) {
        TimeOff current = find(providerId, timeOffId);
        TimeRange range = interval(req);
        if (range == null) return WriteOutcome.<TimeOff>invalid(WriteValidationError.INVALID_INTERVAL);

        TimeOff edited = newTimeOff(providerId, current.getScope(), range, req);
        List<TimeOff> others = repository.findByProvider(providerId).stream()
                .filter(t -> !Objects.equals(t.getId(), timeOffId))
                .toList();
        OverlapCheckResult<TimeOff> check = engine.checkOverlap(edited.getScope(), edited.range(), others);

        ResolutionDecision decision = req.getDecision();
        if (check.hasOverlap() && decision == null) {
            return WriteOutcome.<TimeOff>conflict(edited.getScope(), check);
        }
        if (decision == ResolutionDecision.CANCEL) {
            return WriteOutcome.<TimeOff>cancelled(edited.getScope());
        }
        ResolutionPlan<TimeOff> plan = decision == null
                ? ResolutionPlan.<TimeOff>insertOnly(edited)
                : engine.<TimeOff>plan(decision, check, edited);
        List<Long> toDelete = new ArrayList<>();
        toDelete.add(timeOffId);
        toDelete.addAll(plan.toDelete());
        log.info("Updating time-off {} of provider {} to {}", timeOffId, providerId, edited.range());
        return coordinator.execute(repository, new ResolutionPlan<TimeOff>(toDelete, plan.toInsert()), edited.getScope());
    }

    public void delete(String providerId, Long timeOffId) {
        find(providerId, timeOffId);
        repository.delete(timeOffId);
        log.info("Deleted time-off {} of provider {}", timeOffId, providerId);
    }

    private TimeOff find(String providerId, Long timeOffId) {
        TimeOff timeOff = repository.findById(timeOffId);
        if (timeOff == null || !Objects.equals(timeOff.getProviderId(), providerId)) {
            throw new RecordNotFoundException("Time-off not found: " + timeOffId);
        }
        return timeOff;
    }

    private static TimeRange interval(TimeOffWriteRequest req) {
        if (req.isAllDay()) return TimeRange.fullDay();
        return WriteRequestParser.parseInterval(req.getStartTime(), req.getEndTime());
    }

    private TimeOff newTimeOff(String providerId, Scope scope, TimeRange range, TimeOffWriteRequest req) {
        return TimeOff.builder()
                .providerId(providerId)
                .scope(scope)
                .startMinute(range.startMinute())
                .endMinute(range.endMinute())
                .allDay(req.isAllDay())
                .reason(req.getReason())
                .createdAt(LocalDateTime.now(clock))
                .build();
    }

    private static List<Scope> toScopes(TimeOffWriteRequest req) {
        if (req.getDaysOfWeek() != null && !req.getDaysOfWeek().isEmpty()) {
            if (!ProposalValidator.isValidDayList(req.getDaysOfWeek())) return List.of();
            return req.getDaysOfWeek().stream().distinct().sorted()
                    .map(d -> (Scope) new RecurringScope(d))
                    .toList();
        }
        LocalDate start = req.getStartDate();
        LocalDate end = req.getEndDate() != null ? req.getEndDate() : start;
        if (!ProposalValidator.isValidDateRange(start, end)) return List.of();
        return List.of(new DateRangeScope(start, end));
    }
}
