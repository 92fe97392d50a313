package io.github.riemr.availability.domain.model;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;

@Value
@Builder(toBuilder = true)
public class AvailabilitySlot implements ScheduledRecord<AvailabilitySlot> {
    Long id;
    String providerId;
    Scope scope;
    int startMinute;
    int endMinute;
    LocalDateTime createdAt; // activation timestamp for recurring slots

    @Override
    public TimeRange range() {
        return new TimeRange(startMinute, endMinute);
    }

    @Override
    public AvailabilitySlot mergedWith(TimeRange merged, AvailabilitySlot firstOverlap) {
        return toBuilder()
                .id(null)
                .startMinute(merged.startMinute())
                .endMinute(merged.endMinute())
                .build();
    }
}
