package io.github.riemr.availability.domain.model;

import lombok.Builder;
import lombok.Value;

/**
 * One typed interval of a resolved day. Computed per date and never persisted.
 */
@Value
@Builder(toBuilder = true)
public class TimeBlock {
    String id;
    BlockKind kind;
    int startMinute;
    int endMinute;
    String reason;
    String clientName;
    AppointmentStatus status;
    boolean allDay;
    boolean recurring;
    Long sourceRef;
    TimeRange originalRange; // only on split fragments

    public TimeRange range() {
        return new TimeRange(startMinute, endMinute);
    }

    public String getStartTime() {
        return range().toString().substring(0, 5);
    }

    public String getEndTime() {
        return range().toString().substring(6);
    }

    public boolean isSplit() {
        return originalRange != null;
    }
}
