package io.github.riemr.availability.domain.timeline;

import io.github.riemr.availability.domain.model.BlockKind;
import io.github.riemr.availability.domain.model.TimeBlock;
import io.github.riemr.availability.domain.model.TimeOff;
import io.github.riemr.availability.domain.model.TimeRange;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

/**
 * Resolves which time-off applies on a date. One-time (date range) entries take
 * precedence: a recurring entry overlapping an accepted block is either dropped,
 * when fully covered, or cut into the fragments left uncovered.
 */
public class ExceptionResolver {

    private static final Comparator<TimeOff> PRECEDENCE = Comparator
            .comparing((TimeOff t) -> t.getScope().isRecurring())
            .thenComparingInt(t -> t.range().startMinute())
            .thenComparingInt(t -> t.range().endMinute())
            .thenComparing(TimeOff::getId, Comparator.nullsLast(Comparator.naturalOrder()));

    public List<TimeBlock> resolve(Collection<TimeOff> timeOffs, LocalDate date, LocalDate today) {
        if (timeOffs == null || timeOffs.isEmpty()) return List.of();

        Stream<TimeOff> oneTime = timeOffs.stream()
                .filter(t -> !t.getScope().isRecurring())
                .filter(t -> t.getScope().appliesOn(date));
        Stream<TimeOff> recurring = timeOffs.stream()
                .filter(t -> t.getScope().isRecurring())
                .filter(t -> t.getScope().appliesOn(date))
                .filter(t -> ActivationPolicy.isActiveOn(t.getCreatedAt(), date, today));
        List<TimeOff> candidates = Stream.concat(oneTime, recurring).sorted(PRECEDENCE).toList();

        List<TimeBlock> accepted = new ArrayList<>();
        for (TimeOff candidate : candidates) {
            TimeRange range = candidate.range();
            List<TimeRange> overlapping = accepted.stream()
                    .map(TimeBlock::range)
                    .filter(r -> IntervalCalculus.overlaps(range, r))
                    .toList();

            if (overlapping.isEmpty() || !candidate.getScope().isRecurring()) {
                accepted.add(toBlock(candidate));
                continue;
            }
            if (overlapping.stream().anyMatch(r -> IntervalCalculus.covers(r, range))) {
                continue;
            }
            List<TimeRange> segments = IntervalCalculus.splitAround(range, overlapping);
            for (int i = 0; i < segments.size(); i++) {
                accepted.add(toFragment(candidate, segments.get(i), i));
            }
        }
        return accepted;
    }

    private static TimeBlock toBlock(TimeOff t) {
        TimeRange r = t.range();
        return base(t)
                .id("time-off-" + t.getId())
                .startMinute(r.startMinute())
                .endMinute(r.endMinute())
                .build();
    }

    private static TimeBlock toFragment(TimeOff t, TimeRange segment, int index) {
        return base(t)
                .id("time-off-" + t.getId() + "-split-" + index)
                .startMinute(segment.startMinute())
                .endMinute(segment.endMinute())
                .originalRange(t.range())
                .build();
    }

    private static TimeBlock.TimeBlockBuilder base(TimeOff t) {
        return TimeBlock.builder()
                .kind(BlockKind.TIME_OFF)
                .reason(t.getReason())
                .allDay(t.isAllDay())
                .recurring(t.getScope().isRecurring())
                .sourceRef(t.getId());
    }
}
