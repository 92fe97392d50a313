package io.github.riemr.availability.domain.timeline;

import io.github.riemr.availability.domain.model.TimeRange;

import java.time.LocalTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Minute-of-day interval arithmetic. All intervals are half-open, so ranges that
 * only touch at an endpoint do not overlap.
 */
public final class IntervalCalculus {
    private IntervalCalculus() {}

    public static final Comparator<TimeRange> BY_START = Comparator
            .comparingInt(TimeRange::startMinute)
            .thenComparingInt(TimeRange::endMinute);

    public static boolean overlaps(int aStart, int aEnd, int bStart, int bEnd) {
        return aStart < bEnd && bStart < aEnd;
    }

    public static boolean overlaps(TimeRange a, TimeRange b) {
        return overlaps(a.startMinute(), a.endMinute(), b.startMinute(), b.endMinute());
    }

    public static TimeRange merge(int aStart, int aEnd, int bStart, int bEnd) {
        return new TimeRange(Math.min(aStart, bStart), Math.max(aEnd, bEnd));
    }

    public static TimeRange merge(TimeRange a, TimeRange b) {
        return merge(a.startMinute(), a.endMinute(), b.startMinute(), b.endMinute());
    }

    /** True when {@code outer} fully contains {@code inner}. */
    public static boolean covers(TimeRange outer, TimeRange inner) {
        return outer.startMinute() <= inner.startMinute() && outer.endMinute() >= inner.endMinute();
    }

    /**
     * Returns the parts of {@code base} not covered by {@code blockers}, in order.
     * Blockers are walked by start time; a cursor starts at {@code base.start}, every
     * gap before the next blocker is emitted and the cursor then jumps past that blocker.
     * Adjacent, nested and partially overlapping blockers are all handled by the cursor.
     */
    public static List<TimeRange> splitAround(TimeRange base, Collection<TimeRange> blockers) {
        Objects.requireNonNull(base, "base");
        if (blockers == null || blockers.isEmpty()) return List.of(base);

        List<TimeRange> sorted = blockers.stream().sorted(BY_START).toList();
        List<TimeRange> segments = new ArrayList<>();
        int cursor = base.startMinute();
        for (TimeRange blocker : sorted) {
            if (cursor >= base.endMinute()) break;
            if (blocker.startMinute() > cursor) {
                segments.add(new TimeRange(cursor, Math.min(blocker.startMinute(), base.endMinute())));
            }
            cursor = Math.max(cursor, blocker.endMinute());
        }
        if (cursor < base.endMinute()) {
            segments.add(new TimeRange(cursor, base.endMinute()));
        }
        return segments;
    }

    /** Parses {@code HH:mm} (or {@code HH:mm:ss}); {@code 24:00} maps to minute 1440. */
    public static int parseMinute(String text) {
        if (text == null || text.isBlank()) throw new IllegalArgumentException("time is required");
        String[] parts = text.trim().split(":");
        if (parts.length < 2 || parts.length > 3) throw new IllegalArgumentException("Invalid time: " + text);
        try {
            int h = Integer.parseInt(parts[0]);
            int m = Integer.parseInt(parts[1]);
            if (h == 24 && m == 0) return TimeRange.DAY_END;
            if (h < 0 || h > 23 || m < 0 || m > 59) throw new IllegalArgumentException("Invalid time: " + text);
            return h * 60 + m;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid time: " + text, e);
        }
    }

    public static String formatMinute(int minute) {
        if (minute < 0 || minute > TimeRange.DAY_END) throw new IllegalArgumentException("Minute out of range: " + minute);
        return String.format("%02d:%02d", minute / 60, minute % 60);
    }

    public static int toMinute(LocalTime t) {
        return t.getHour() * 60 + t.getMinute();
    }
}
