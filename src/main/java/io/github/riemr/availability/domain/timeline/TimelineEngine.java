package io.github.riemr.availability.domain.timeline;

import io.github.riemr.availability.domain.model.Appointment;
import io.github.riemr.availability.domain.model.AvailabilitySlot;
import io.github.riemr.availability.domain.model.ScheduledRecord;
import io.github.riemr.availability.domain.model.Scope;
import io.github.riemr.availability.domain.model.TimeBlock;
import io.github.riemr.availability.domain.model.TimeOff;
import io.github.riemr.availability.domain.model.TimeRange;

import java.time.LocalDate;
import java.util.Collection;
import java.util.List;

/**
 * Entry point for every consumer that renders a provider's day or guards a write.
 * Implementations are pure: no I/O, no shared mutable state.
 */
public interface TimelineEngine {

    /**
     * Resolves the sorted, typed timeline of one date.
     */
    List<TimeBlock> resolveTimeline(LocalDate date,
                                    Collection<AvailabilitySlot> availabilitySlots,
                                    Collection<TimeOff> timeOffs,
                                    Collection<Appointment> appointments);

    <T extends ScheduledRecord<T>> OverlapCheckResult<T> checkOverlap(Scope proposedScope,
                                                                     TimeRange proposedInterval,
                                                                     Collection<T> existingRecords);

    <T extends ScheduledRecord<T>> ResolutionPlan<T> applyReplace(OverlapCheckResult<T> result, T proposedEntry);

    <T extends ScheduledRecord<T>> ResolutionPlan<T> applyMerge(OverlapCheckResult<T> result, T proposedEntry);

    <T extends ScheduledRecord<T>> ResolutionPlan<T> plan(ResolutionDecision decision,
                                                         OverlapCheckResult<T> result,
                                                         T proposedEntry);
}
