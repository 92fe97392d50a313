package io.github.riemr.availability.application.service;

import io.github.riemr.availability.application.dto.AvailabilityWriteRequest;
import io.github.riemr.availability.application.dto.BatchWriteResult;
import io.github.riemr.availability.application.dto.WriteOutcome;
import io.github.riemr.availability.application.dto.WriteUnitStatus;
import io.github.riemr.availability.application.repository.AvailabilitySlotRepository;
import io.github.riemr.availability.domain.model.AvailabilitySlot;
import io.github.riemr.availability.domain.model.RecurringScope;
import io.github.riemr.availability.domain.model.Scope;
import io.github.riemr.availability.domain.model.SpecificDateScope;
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
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

@Service
@RequiredArgsConstructor
@Slf4j
public class AvailabilityWriteService {
    private final AvailabilitySlotRepository repository;
    private final ScheduleWriteCoordinator coordinator;
    private final TimelineEngine engine;
    private final Clock clock;

    public List<AvailabilitySlot> list(String providerId) {
        return repository.findByProvider(providerId);
    }

    /**
     * Creates availability for every requested unit. Units without overlap are
     * committed right away; overlapping units come back as conflicts.
     */
    public BatchWriteResult<AvailabilitySlot> create(String providerId, AvailabilityWriteRequest req) {
        TimeRange range = WriteRequestParser.parseInterval(req.getStartTime(), req.getEndTime());
        if (range == null) return BatchWriteResult.<AvailabilitySlot>invalid(WriteValidationError.INVALID_INTERVAL);
        List<Scope> scopes = toScopes(req);
        if (scopes.isEmpty()) return BatchWriteResult.<AvailabilitySlot>invalid(WriteValidationError.MISSING_SCOPE);

        List<WriteOutcome<AvailabilitySlot>> outcomes = new ArrayList<>();
        for (Scope scope : scopes) {
            // re-read per unit so earlier units of this batch are visible
            outcomes.add(coordinator.writeUnit(repository, repository.findByProvider(providerId),
                    newSlot(providerId, scope, range)));
        }
        BatchWriteResult<AvailabilitySlot> result = new BatchWriteResult<>(outcomes);
        log.info("Availability write for provider {}: {} committed, {} conflict(s), {} failed",
                providerId, result.count(WriteUnitStatus.COMMITTED), result.count(WriteUnitStatus.CONFLICT),
                result.count(WriteUnitStatus.FAILED));
        return result;
    }

    /**
     * Applies a Cancel/Replace/Merge decision to each unit of a previously deferred write.
     */
    public BatchWriteResult<AvailabilitySlot> resolve(String providerId, AvailabilityWriteRequest req) {
        if (req.getDecision() == null) throw new IllegalArgumentException("decision is required");
        TimeRange range = WriteRequestParser.parseInterval(req.getStartTime(), req.getEndTime());
        if (range == null) return BatchWriteResult.<AvailabilitySlot>invalid(WriteValidationError.INVALID_INTERVAL);
        List<Scope> scopes = toScopes(req);
        if (scopes.isEmpty()) return BatchWriteResult.<AvailabilitySlot>invalid(WriteValidationError.MISSING_SCOPE);

        List<WriteOutcome<AvailabilitySlot>> outcomes = new ArrayList<>();
        for (Scope scope : scopes) {
            outcomes.add(coordinator.resolveUnit(repository, repository.findByProvider(providerId),
                    newSlot(providerId, scope, range), req.getDecision()));
        }
        log.info("Availability {} for provider {} over {} unit(s)", req.getDecision(), providerId, outcomes.size());
        return new BatchWriteResult<>(outcomes);
    }

    /**
     * Changes the times of an existing slot by deleting it and inserting the edited
     * copy. The slot itself is left out of the overlap check.
     */
    public WriteOutcome<AvailabilitySlot> update(String providerId, Long slotId, AvailabilityWriteRequest req) {
        AvailabilitySlot current = find(providerId, slotId);
        TimeRange range = WriteRequestParser.parseInterval(req.getStartTime(), req.getEndTime());
        if (range == null) return WriteOutcome.<AvailabilitySlot>invalid(WriteValidationError.INVALID_INTERVAL);

        AvailabilitySlot edited = newSlot(providerId, current.getScope(), range);
        List<AvailabilitySlot> others = repository.findByProvider(providerId).stream()
                .filter(s -> !Objects.equals(s.getId(), slotId))
                .toList();
        OverlapCheckResult<AvailabilitySlot> check = engine.checkOverlap(edited.getScope(), range, others);

        ResolutionDecision decision = req.getDecision();
        if (check.hasOverlap() && decision == null) {
            return WriteOutcome.<AvailabilitySlot>conflict(edited.getScope(), check);
        }
        if (decision == ResolutionDecision.CANCEL) {
            return WriteOutcome.<AvailabilitySlot>cancelled(edited.getScope());
        }
        ResolutionPlan<AvailabilitySlot> plan = decision == null
                ? ResolutionPlan.<AvailabilitySlot>insertOnly(edited)
                : engine.<AvailabilitySlot>plan(decision, check, edited);
        List<Long> toDelete = new ArrayList<>();
        toDelete.add(slotId);
        toDelete.addAll(plan.toDelete());
        log.info("Updating availability {} of provider {} to {}", slotId, providerId, range);
        return coordinator.execute(repository, new ResolutionPlan<AvailabilitySlot>(toDelete, plan.toInsert()), edited.getScope());
    }

    public void delete(String providerId, Long slotId) {
        find(providerId, slotId);
        repository.delete(slotId);
        log.info("Deleted availability {} of provider {}", slotId, providerId);
    }

    private AvailabilitySlot find(String providerId, Long slotId) {
        AvailabilitySlot slot = repository.findById(slotId);
        if (slot == null || !Objects.equals(slot.getProviderId(), providerId)) {
            throw new RecordNotFoundException("Availability slot not found: " + slotId);
        }
        return slot;
    }

    private AvailabilitySlot newSlot(String providerId, Scope scope, TimeRange range) {
        return AvailabilitySlot.builder()
                .providerId(providerId)
                .scope(scope)
                .startMinute(range.startMinute())
                .endMinute(range.endMinute())
                .createdAt(LocalDateTime.now(clock))
                .build();
    }

    private static List<Scope> toScopes(AvailabilityWriteRequest req) {
        if (req.getDaysOfWeek() != null && !req.getDaysOfWeek().isEmpty()) {
            if (!ProposalValidator.isValidDayList(req.getDaysOfWeek())) return List.of();
            return req.getDaysOfWeek().stream().distinct().sorted()
                    .map(d -> (Scope) new RecurringScope(d))
                    .toList();
        }
        if (req.getDate() != null) {
            return List.of(new SpecificDateScope(req.getDate()));
        }
        return List.of();
    }
}
