package io.github.riemr.availability.application.service;

import io.github.riemr.availability.application.dto.ExecutionReport;
import io.github.riemr.availability.application.dto.WriteOutcome;
import io.github.riemr.availability.application.repository.RecordStore;
import io.github.riemr.availability.domain.model.ScheduledRecord;
import io.github.riemr.availability.domain.model.Scope;
import io.github.riemr.availability.domain.timeline.OverlapCheckResult;
import io.github.riemr.availability.domain.timeline.ResolutionDecision;
import io.github.riemr.availability.domain.timeline.ResolutionPlan;
import io.github.riemr.availability.domain.timeline.TimelineEngine;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Runs one scope unit of a write against a record store: overlap check, then
 * either an immediate insert or a deferred conflict, and plan execution once
 * the caller has decided.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ScheduleWriteCoordinator {

    private final TimelineEngine engine;

    public <T extends ScheduledRecord<T>> WriteOutcome<T> writeUnit(RecordStore<T> store,
                                                                   Collection<T> existing,
                                                                   T proposed) {
        OverlapCheckResult<T> check = engine.checkOverlap(proposed.getScope(), proposed.range(), existing);
        if (check.hasOverlap()) {
            log.info("Deferred {} {}: overlaps {} existing record(s)",
                    proposed.getScope(), proposed.range(), check.overlappingEntries().size());
            return WriteOutcome.<T>conflict(proposed.getScope(), check);
        }
        return execute(store, ResolutionPlan.<T>insertOnly(proposed), proposed.getScope());
    }

    /**
     * Applies the caller's decision to a unit. The overlap check is repeated so the
     * plan is built against the store as it is now, not as it was when the conflict
     * was reported.
     */
    public <T extends ScheduledRecord<T>> WriteOutcome<T> resolveUnit(RecordStore<T> store,
                                                                     Collection<T> existing,
                                                                     T proposed,
                                                                     ResolutionDecision decision) {
        if (decision == ResolutionDecision.CANCEL) {
            log.info("Cancelled write for {} {}", proposed.getScope(), proposed.range());
            return WriteOutcome.<T>cancelled(proposed.getScope());
        }
        OverlapCheckResult<T> check = engine.checkOverlap(proposed.getScope(), proposed.range(), existing);
        return execute(store, engine.plan(decision, check, proposed), proposed.getScope());
    }

    /**
     * Executes a plan: deletes in order, then the insert. Stops at the first store
     * failure and reports which steps had already gone through.
     */
    public <T extends ScheduledRecord<T>> WriteOutcome<T> execute(RecordStore<T> store, ResolutionPlan<T> plan, Scope scope) {
        List<Long> deleted = new ArrayList<>();
        try {
            for (Long id : plan.toDelete()) {
                store.delete(id);
                deleted.add(id);
            }
            T inserted = plan.toInsert() == null ? null : store.insert(plan.toInsert());
            log.debug("Committed {}: deleted={}, inserted={}", scope, deleted,
                    inserted == null ? null : inserted.getId());
            return WriteOutcome.<T>executed(scope, ExecutionReport.<T>success(deleted, inserted));
        } catch (RuntimeException e) {
            log.warn("Store failure while applying plan for {} after deleting {}: {}", scope, deleted, e.getMessage(), e);
            return WriteOutcome.<T>executed(scope, ExecutionReport.<T>failure(deleted, e.getMessage()));
        }
    }
}
