package io.github.riemr.availability.domain.timeline;

import io.github.riemr.availability.domain.model.Appointment;
import io.github.riemr.availability.domain.model.AvailabilitySlot;
import io.github.riemr.availability.domain.model.BlockKind;
import io.github.riemr.availability.domain.model.TimeBlock;
import io.github.riemr.availability.domain.model.TimeRange;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;

/**
 * Builds the single sorted timeline for one date out of resolved availability,
 * resolved time-off and that day's appointments. Only availability is cut:
 * time-off and appointments are emitted as they are.
 */
public class TimelineCompositor {

    static final Comparator<TimeBlock> TIMELINE_ORDER = Comparator
            .comparingInt(TimeBlock::getStartMinute)
            .thenComparing(TimeBlock::getKind)
            .thenComparingInt(TimeBlock::getEndMinute)
            .thenComparing(TimeBlock::getId);

    private final boolean showAppointments;

    public TimelineCompositor(boolean showAppointments) {
        this.showAppointments = showAppointments;
    }

    public List<TimeBlock> compose(LocalDate date,
                                   Collection<AvailabilitySlot> availability,
                                   Collection<TimeBlock> timeOff,
                                   Collection<Appointment> appointments) {
        List<TimeBlock> blocks = new ArrayList<>();

        List<TimeRange> timeOffRanges = timeOff.stream().map(TimeBlock::range).toList();
        for (AvailabilitySlot slot : availability) {
            blocks.addAll(splitAvailability(slot, timeOffRanges));
        }
        blocks.addAll(timeOff);
        if (showAppointments && appointments != null) {
            appointments.stream()
                    .filter(a -> a.getStatus() == null || !a.getStatus().isCancelled())
                    .filter(a -> a.getStartDateTime() != null && date.equals(a.getStartDateTime().toLocalDate()))
                    .map(a -> toBlock(a, date))
                    .filter(b -> b.getEndMinute() > b.getStartMinute())
                    .forEach(blocks::add);
        }

        blocks.sort(TIMELINE_ORDER);
        return List.copyOf(blocks);
    }

    private static List<TimeBlock> splitAvailability(AvailabilitySlot slot, List<TimeRange> timeOffRanges) {
        TimeRange range = slot.range();
        List<TimeRange> overlapping = timeOffRanges.stream()
                .filter(r -> IntervalCalculus.overlaps(range, r))
                .sorted(IntervalCalculus.BY_START)
                .toList();

        TimeBlock.TimeBlockBuilder base = TimeBlock.builder()
                .kind(BlockKind.AVAILABILITY)
                .recurring(slot.getScope().isRecurring())
                .sourceRef(slot.getId());
        if (overlapping.isEmpty()) {
            return List.of(base.id("availability-" + slot.getId())
                    .startMinute(range.startMinute())
                    .endMinute(range.endMinute())
                    .build());
        }
        return IntervalCalculus.splitAround(range, overlapping).stream()
                .map(seg -> base.id("availability-" + slot.getId() + "-split-" + seg.startMinute() + "-" + seg.endMinute())
                        .startMinute(seg.startMinute())
                        .endMinute(seg.endMinute())
                        .originalRange(range)
                        .build())
                .toList();
    }

    private static TimeBlock toBlock(Appointment a, LocalDate date) {
        int start = IntervalCalculus.toMinute(a.getStartDateTime().toLocalTime());
        LocalDateTime end = a.getEndDateTime();
        int endMinute = end == null || end.toLocalDate().isAfter(date)
                ? TimeRange.DAY_END
                : IntervalCalculus.toMinute(end.toLocalTime());
        return TimeBlock.builder()
                .id("appointment-" + a.getId())
                .kind(BlockKind.APPOINTMENT)
                .startMinute(start)
                .endMinute(endMinute)
                .clientName(a.getClientName())
                .reason(a.getNotes())
                .status(a.getStatus())
                .sourceRef(a.getId())
                .build();
    }
}
