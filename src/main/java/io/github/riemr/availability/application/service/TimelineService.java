package io.github.riemr.availability.application.service;

import io.github.riemr.availability.application.repository.AppointmentRepository;
import io.github.riemr.availability.application.repository.AvailabilitySlotRepository;
import io.github.riemr.availability.application.repository.TimeOffRepository;
import io.github.riemr.availability.config.AvailabilityProperties;
import io.github.riemr.availability.domain.model.Appointment;
import io.github.riemr.availability.domain.model.AvailabilitySlot;
import io.github.riemr.availability.domain.model.TimeBlock;
import io.github.riemr.availability.domain.model.TimeOff;
import io.github.riemr.availability.domain.model.TimeRange;
import io.github.riemr.availability.domain.timeline.BookableSlotFinder;
import io.github.riemr.availability.domain.timeline.PartitionedTimeline;
import io.github.riemr.availability.domain.timeline.TimelineEngine;
import io.github.riemr.availability.domain.timeline.TimelinePartitioner;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Read side: loads a provider's records and hands them to the engine.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TimelineService {
    private static final int WEEK_DAYS = 7;

    private final AvailabilitySlotRepository availabilityRepository;
    private final TimeOffRepository timeOffRepository;
    private final AppointmentRepository appointmentRepository;
    private final TimelineEngine engine;
    private final AvailabilityProperties properties;

    public List<TimeBlock> resolveTimeline(String providerId, LocalDate date) {
        List<AvailabilitySlot> slots = availabilityRepository.findByProvider(providerId);
        List<TimeOff> timeOffs = timeOffRepository.findByProvider(providerId);
        List<Appointment> appointments = appointmentRepository.findByProviderAndPeriod(
                providerId, date.atStartOfDay(), date.plusDays(1).atStartOfDay());
        List<TimeBlock> timeline = engine.resolveTimeline(date, slots, timeOffs, appointments);
        log.debug("Resolved {} block(s) for provider {} on {}", timeline.size(), providerId, date);
        return timeline;
    }

    /**
     * Resolves seven consecutive dates starting at {@code start}. Records are
     * loaded once for the whole week.
     */
    public Map<LocalDate, List<TimeBlock>> resolveWeek(String providerId, LocalDate start) {
        List<AvailabilitySlot> slots = availabilityRepository.findByProvider(providerId);
        List<TimeOff> timeOffs = timeOffRepository.findByProvider(providerId);
        List<Appointment> appointments = appointmentRepository.findByProviderAndPeriod(
                providerId, start.atStartOfDay(), start.plusDays(WEEK_DAYS).atStartOfDay());

        Map<LocalDate, List<TimeBlock>> week = new LinkedHashMap<>();
        for (int i = 0; i < WEEK_DAYS; i++) {
            LocalDate date = start.plusDays(i);
            week.put(date, engine.resolveTimeline(date, slots, timeOffs, appointments));
        }
        return week;
    }

    public PartitionedTimeline resolvePartitioned(String providerId, LocalDate date) {
        return TimelinePartitioner.partition(resolveTimeline(providerId, date));
    }

    /**
     * Start/end pairs of free slots of the given length on a date. A null duration
     * falls back to {@code availability.default-slot-minutes}.
     */
    public List<TimeRange> findBookableSlots(String providerId, LocalDate date, Integer durationMinutes) {
        int duration = durationMinutes != null ? durationMinutes : properties.defaultSlotMinutes();
        return BookableSlotFinder.find(resolveTimeline(providerId, date), duration);
    }
}
