package io.github.riemr.availability.domain.model;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;

/**
 * A time-off exception carved out of availability. Scope is either
 * {@link RecurringScope} or {@link DateRangeScope}.
 */
@Value
@Builder(toBuilder = true)
public class TimeOff implements ScheduledRecord<TimeOff> {
    Long id;
    String providerId;
    Scope scope;
    int startMinute;
    int endMinute;
    boolean allDay;
    String reason;
    LocalDateTime createdAt;

    /** All-day records always occupy 00:00-24:00 whatever their stored times. */
    @Override
    public TimeRange range() {
        return allDay ? TimeRange.fullDay() : new TimeRange(startMinute, endMinute);
    }

    @Override
    public TimeOff mergedWith(TimeRange merged, TimeOff firstOverlap) {
        String mergedReason = reason != null && !reason.isBlank() ? reason : firstOverlap.getReason();
        return toBuilder()
                .id(null)
                .startMinute(merged.startMinute())
                .endMinute(merged.endMinute())
                .allDay(merged.isFullDay() && (allDay || firstOverlap.isAllDay()))
                .reason(mergedReason)
                .build();
    }
}
