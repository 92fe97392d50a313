package io.github.riemr.availability.domain.timeline;

import io.github.riemr.availability.domain.model.BlockKind;
import io.github.riemr.availability.domain.model.TimeBlock;

import java.util.List;

/**
 * Splits a resolved timeline into all-day time-off and everything else,
 * keeping the order of each part.
 */
public final class TimelinePartitioner {
    private TimelinePartitioner() {}

    public static PartitionedTimeline partition(List<TimeBlock> timeline) {
        List<TimeBlock> allDay = timeline.stream().filter(TimelinePartitioner::isAllDay).toList();
        List<TimeBlock> timed = timeline.stream().filter(b -> !isAllDay(b)).toList();
        return new PartitionedTimeline(allDay, timed);
    }

    private static boolean isAllDay(TimeBlock block) {
        return block.getKind() == BlockKind.TIME_OFF && block.isAllDay();
    }
}
