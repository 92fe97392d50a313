package io.github.riemr.availability.domain.timeline;

import io.github.riemr.availability.domain.model.BlockKind;
import io.github.riemr.availability.domain.model.TimeBlock;
import io.github.riemr.availability.domain.model.TimeRange;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BookableSlotFinderTest {

    private static TimeBlock block(BlockKind kind, int start, int end) {
        return TimeBlock.builder().id(kind + "-" + start).kind(kind).startMinute(start).endMinute(end).build();
    }

    @Test
    void slotsStepByDuration_insideAvailability() {
        List<TimeRange> slots = BookableSlotFinder.find(List.of(block(BlockKind.AVAILABILITY, 540, 660)), 30);

        assertThat(slots).containsExactly(
                new TimeRange(540, 570), new TimeRange(570, 600), new TimeRange(600, 630), new TimeRange(630, 660));
    }

    @Test
    void slotsOverlappingAppointments_areSkipped() {
        List<TimeBlock> timeline = List.of(
                block(BlockKind.AVAILABILITY, 540, 660),
                block(BlockKind.APPOINTMENT, 580, 600));

        assertThat(BookableSlotFinder.find(timeline, 30))
                .containsExactly(new TimeRange(540, 570), new TimeRange(600, 630), new TimeRange(630, 660));
    }

    @Test
    void trailingRemainderShorterThanDuration_isNotOffered() {
        List<TimeRange> slots = BookableSlotFinder.find(List.of(block(BlockKind.AVAILABILITY, 540, 640)), 45);

        assertThat(slots).containsExactly(new TimeRange(540, 585), new TimeRange(585, 630));
    }

    @Test
    void timeOffBlocks_offerNothing() {
        assertThat(BookableSlotFinder.find(List.of(block(BlockKind.TIME_OFF, 540, 660)), 30)).isEmpty();
        assertThat(BookableSlotFinder.find(List.of(), 30)).isEmpty();
    }

    @Test
    void nonPositiveDuration_isRejected() {
        assertThatThrownBy(() -> BookableSlotFinder.find(List.of(), 0)).isInstanceOf(IllegalArgumentException.class);
    }
}
