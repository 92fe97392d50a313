package io.github.riemr.availability.domain.timeline;

import io.github.riemr.availability.domain.model.Appointment;
import io.github.riemr.availability.domain.model.AvailabilitySlot;
import io.github.riemr.availability.domain.model.ScheduledRecord;
import io.github.riemr.availability.domain.model.Scope;
import io.github.riemr.availability.domain.model.TimeBlock;
import io.github.riemr.availability.domain.model.TimeOff;
import io.github.riemr.availability.domain.model.TimeRange;

import java.time.Clock;
import java.time.LocalDate;
import java.util.Collection;
import java.util.List;

public class DefaultTimelineEngine implements TimelineEngine {

    private final Clock clock;
    private final AvailabilityResolver availabilityResolver;
    private final ExceptionResolver exceptionResolver;
    private final TimelineCompositor compositor;
    private final OverlapConflictManager conflictManager;

    public DefaultTimelineEngine(Clock clock, boolean showAppointments) {
        this(clock, new AvailabilityResolver(), new ExceptionResolver(),
                new TimelineCompositor(showAppointments), new OverlapConflictManager());
    }

    DefaultTimelineEngine(Clock clock,
                          AvailabilityResolver availabilityResolver,
                          ExceptionResolver exceptionResolver,
                          TimelineCompositor compositor,
                          OverlapConflictManager conflictManager) {
        this.clock = clock;
        this.availabilityResolver = availabilityResolver;
        this.exceptionResolver = exceptionResolver;
        this.compositor = compositor;
        this.conflictManager = conflictManager;
    }

    @Override
    public List<TimeBlock> resolveTimeline(LocalDate date,
                                           Collection<AvailabilitySlot> availabilitySlots,
                                           Collection<TimeOff> timeOffs,
                                           Collection<Appointment> appointments) {
        LocalDate today = LocalDate.now(clock);
        List<AvailabilitySlot> availability = availabilityResolver.resolve(availabilitySlots, date, today);
        List<TimeBlock> timeOff = exceptionResolver.resolve(timeOffs, date, today);
        return compositor.compose(date, availability, timeOff, appointments == null ? List.of() : appointments);
    }

    @Override
    public <T extends ScheduledRecord<T>> OverlapCheckResult<T> checkOverlap(Scope proposedScope,
                                                                            TimeRange proposedInterval,
                                                                            Collection<T> existingRecords) {
        return conflictManager.checkOverlap(proposedScope, proposedInterval, existingRecords);
    }

    @Override
    public <T extends ScheduledRecord<T>> ResolutionPlan<T> applyReplace(OverlapCheckResult<T> result, T proposedEntry) {
        return conflictManager.applyReplace(result, proposedEntry);
    }

    @Override
    public <T extends ScheduledRecord<T>> ResolutionPlan<T> applyMerge(OverlapCheckResult<T> result, T proposedEntry) {
        return conflictManager.applyMerge(result, proposedEntry);
    }

    @Override
    public <T extends ScheduledRecord<T>> ResolutionPlan<T> plan(ResolutionDecision decision,
                                                                OverlapCheckResult<T> result,
                                                                T proposedEntry) {
        return conflictManager.plan(decision, result, proposedEntry);
    }
}
