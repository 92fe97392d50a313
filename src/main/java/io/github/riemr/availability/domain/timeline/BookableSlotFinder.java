package io.github.riemr.availability.domain.timeline;

import io.github.riemr.availability.domain.model.BlockKind;
import io.github.riemr.availability.domain.model.TimeBlock;
import io.github.riemr.availability.domain.model.TimeRange;

import java.util.ArrayList;
import java.util.List;

/**
 * Derives bookable fixed-length slots from a resolved timeline. A slot must lie
 * entirely inside one availability block and must not overlap any appointment.
 */
public final class BookableSlotFinder {
    private BookableSlotFinder() {}

    public static List<TimeRange> find(List<TimeBlock> timeline, int durationMinutes) {
        if (durationMinutes < 1) throw new IllegalArgumentException("duration must be >= 1 minute");
        if (timeline == null || timeline.isEmpty()) return List.of();

        List<TimeRange> booked = timeline.stream()
                .filter(b -> b.getKind() == BlockKind.APPOINTMENT)
                .map(TimeBlock::range)
                .toList();

        List<TimeRange> result = new ArrayList<>();
        for (TimeBlock block : timeline) {
            if (block.getKind() != BlockKind.AVAILABILITY) continue;
            for (int start = block.getStartMinute(); start + durationMinutes <= block.getEndMinute(); start += durationMinutes) {
                TimeRange candidate = new TimeRange(start, start + durationMinutes);
                if (booked.stream().noneMatch(b -> IntervalCalculus.overlaps(candidate, b))) {
                    result.add(candidate);
                }
            }
        }
        result.sort(IntervalCalculus.BY_START);
        return result;
    }
}
