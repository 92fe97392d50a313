package io.github.riemr.availability.domain.timeline;

import io.github.riemr.availability.domain.model.AvailabilitySlot;

import java.time.LocalDate;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;

/**
 * Picks the availability slots that apply on a date. Specific-date slots override
 * recurring ones for that date completely; the two are never merged.
 */
public class AvailabilityResolver {

    static final Comparator<AvailabilitySlot> ORDER = Comparator
            .comparingInt(AvailabilitySlot::getStartMinute)
            .thenComparingInt(AvailabilitySlot::getEndMinute)
            .thenComparing(AvailabilitySlot::getId, Comparator.nullsLast(Comparator.naturalOrder()));

    public List<AvailabilitySlot> resolve(Collection<AvailabilitySlot> slots, LocalDate date, LocalDate today) {
        if (slots == null || slots.isEmpty()) return List.of();

        List<AvailabilitySlot> specific = slots.stream()
                .filter(s -> !s.getScope().isRecurring())
                .filter(s -> s.getScope().appliesOn(date))
                .sorted(ORDER)
                .toList();
        if (!specific.isEmpty()) {
            return specific;
        }

        return slots.stream()
                .filter(s -> s.getScope().isRecurring())
                .filter(s -> s.getScope().appliesOn(date))
                .filter(s -> ActivationPolicy.isActiveOn(s.getCreatedAt(), date, today))
                .sorted(ORDER)
                .toList();
    }
}
