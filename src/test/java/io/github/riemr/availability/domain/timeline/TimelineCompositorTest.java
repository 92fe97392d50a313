package io.github.riemr.availability.domain.timeline;

import io.github.riemr.availability.domain.model.Appointment;
import io.github.riemr.availability.domain.model.AppointmentStatus;
import io.github.riemr.availability.domain.model.AvailabilitySlot;
import io.github.riemr.availability.domain.model.BlockKind;
import io.github.riemr.availability.domain.model.RecurringScope;
import io.github.riemr.availability.domain.model.TimeBlock;
import io.github.riemr.availability.domain.model.TimeRange;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class TimelineCompositorTest {

    private static final LocalDate DATE = LocalDate.of(2024, 6, 17);

    private final TimelineCompositor compositor = new TimelineCompositor(true);

    private static AvailabilitySlot slot(long id, int start, int end) {
        return AvailabilitySlot.builder()
                .id(id).providerId("p1").scope(new RecurringScope(1))
                .startMinute(start).endMinute(end)
                .build();
    }

    private static TimeBlock timeOff(String id, int start, int end) {
        return TimeBlock.builder().id(id).kind(BlockKind.TIME_OFF).startMinute(start).endMinute(end).build();
    }

    private static Appointment appointment(long id, LocalDateTime start, LocalDateTime end, AppointmentStatus status) {
        return Appointment.builder()
                .id(id).providerId("p1")
                .startDateTime(start).endDateTime(end)
                .status(status)
                .clientName("Client " + id)
                .notes("note " + id)
                .build();
    }

    @Test
    void availability_isSplitAroundTimeOff() {
        List<TimeBlock> timeline = compositor.compose(DATE,
                List.of(slot(1, 540, 1020)), List.of(timeOff("time-off-7", 720, 780)), List.of());

        assertThat(timeline).extracting(TimeBlock::getId).containsExactly(
                "availability-1-split-540-720", "time-off-7", "availability-1-split-780-1020");
        assertThat(timeline.get(0).getOriginalRange()).isEqualTo(new TimeRange(540, 1020));
        assertThat(timeline.get(0).getSourceRef()).isEqualTo(1L);
    }

    @Test
    void availability_fullyCovered_disappears() {
        List<TimeBlock> timeline = compositor.compose(DATE,
                List.of(slot(1, 540, 600)), List.of(timeOff("time-off-7", 0, 1440)), List.of());

        assertThat(timeline).extracting(TimeBlock::getKind).containsExactly(BlockKind.TIME_OFF);
    }

    @Test
    void appointments_areEmittedUncut_andCancelledOnesSkipped() {
        Appointment booked = appointment(10, DATE.atTime(10, 0), DATE.atTime(10, 30), AppointmentStatus.CONFIRMED);
        Appointment cancelled = appointment(11, DATE.atTime(11, 0), DATE.atTime(11, 30), AppointmentStatus.CANCELLED);
        Appointment otherDay = appointment(12, DATE.plusDays(1).atTime(9, 0), DATE.plusDays(1).atTime(9, 30),
                AppointmentStatus.PENDING);

        List<TimeBlock> timeline = compositor.compose(DATE,
                List.of(slot(1, 540, 1020)), List.of(), List.of(booked, cancelled, otherDay));

        assertThat(timeline).extracting(TimeBlock::getId).containsExactly("availability-1", "appointment-10");
        TimeBlock block = timeline.get(1);
        assertThat(block.range()).isEqualTo(new TimeRange(600, 630));
        assertThat(block.getClientName()).isEqualTo("Client 10");
        assertThat(block.getReason()).isEqualTo("note 10");
        assertThat(block.getStatus()).isEqualTo(AppointmentStatus.CONFIRMED);
    }

    @Test
    void appointment_crossingMidnight_isClippedToEndOfDay() {
        Appointment late = appointment(20, DATE.atTime(23, 0), DATE.plusDays(1).atTime(1, 0), AppointmentStatus.CONFIRMED);

        List<TimeBlock> timeline = compositor.compose(DATE, List.of(), List.of(), List.of(late));

        assertThat(timeline).singleElement().satisfies(b -> {
            assertThat(b.getStartTime()).isEqualTo("23:00");
            assertThat(b.getEndTime()).isEqualTo("24:00");
        });
    }

    @Test
    void appointment_withoutPositiveLength_isDropped() {
        Appointment empty = appointment(30, DATE.atTime(10, 0), DATE.atTime(10, 0), AppointmentStatus.CONFIRMED);
        Appointment reversed = appointment(31, DATE.atTime(15, 0), DATE.atTime(14, 0), AppointmentStatus.SCHEDULED);
        Appointment valid = appointment(32, DATE.atTime(16, 0), DATE.atTime(16, 45), AppointmentStatus.SCHEDULED);

        List<TimeBlock> timeline = compositor.compose(DATE,
                List.of(slot(1, 540, 1020)), List.of(), List.of(empty, reversed, valid));

        assertThat(timeline).extracting(TimeBlock::getId).containsExactly("availability-1", "appointment-32");
        assertThat(timeline).allSatisfy(b -> assertThat(b.getEndMinute()).isGreaterThan(b.getStartMinute()));
    }

    @Test
    void hiddenAppointments_areLeftOut() {
        TimelineCompositor withoutAppointments = new TimelineCompositor(false);
        Appointment booked = appointment(10, DATE.atTime(10, 0), DATE.atTime(10, 30), AppointmentStatus.CONFIRMED);

        List<TimeBlock> timeline = withoutAppointments.compose(DATE, List.of(slot(1, 540, 1020)), List.of(), List.of(booked));

        assertThat(timeline).extracting(TimeBlock::getKind).containsExactly(BlockKind.AVAILABILITY);
    }

    @Test
    void sameStart_ordersTimeOffAndAvailabilityBeforeAppointment() {
        Appointment morning = appointment(10, DATE.atTime(9, 0), DATE.atTime(9, 30), AppointmentStatus.CONFIRMED);
        Appointment noon = appointment(11, DATE.atTime(12, 0), DATE.atTime(12, 30), AppointmentStatus.PENDING);

        List<TimeBlock> timeline = compositor.compose(DATE,
                List.of(slot(1, 540, 720)),
                List.of(timeOff("time-off-3", 720, 780)),
                List.of(noon, morning));

        assertThat(timeline).extracting(TimeBlock::getId).containsExactly(
                "availability-1", "appointment-10", "time-off-3", "appointment-11");
        assertThat(timeline).isSortedAccordingTo(TimelineCompositor.TIMELINE_ORDER);
    }
}
