package io.github.riemr.availability.application.service;

import io.github.riemr.availability.application.dto.BatchWriteResult;
import io.github.riemr.availability.application.dto.TimeOffWriteRequest;
import io.github.riemr.availability.application.dto.WriteOutcome;
import io.github.riemr.availability.application.dto.WriteUnitStatus;
import io.github.riemr.availability.domain.model.DateRangeScope;
import io.github.riemr.availability.domain.model.RecurringScope;
import io.github.riemr.availability.domain.model.TimeOff;
import io.github.riemr.availability.domain.model.TimeRange;
import io.github.riemr.availability.domain.timeline.DefaultTimelineEngine;
import io.github.riemr.availability.domain.timeline.ResolutionDecision;
import io.github.riemr.availability.domain.timeline.TimelineEngine;
import io.github.riemr.availability.domain.timeline.WriteValidationError;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class TimeOffWriteServiceTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-06-10T08:00:00Z"), ZoneOffset.UTC);
    private static final String PROVIDER = "p1";
    private static final LocalDate A_MONDAY = LocalDate.of(2024, 6, 17);

    private InMemoryTimeOffRepository repository;
    private TimeOffWriteService service;

    @BeforeEach
    void setup() {
        repository = new InMemoryTimeOffRepository();
        TimelineEngine engine = new DefaultTimelineEngine(CLOCK, true);
        service = new TimeOffWriteService(repository, new ScheduleWriteCoordinator(engine), engine, CLOCK);
    }

    @Test
    void create_dateRange_singleUnitWithReason() {
        TimeOffWriteRequest req = TimeOffWriteRequest.builder()
                .startDate(A_MONDAY).endDate(A_MONDAY.plusDays(4))
                .startTime("12:00").endTime("13:00")
                .reason("Conference")
                .build();

        BatchWriteResult<TimeOff> result = service.create(PROVIDER, req);

        assertThat(result.units()).singleElement().satisfies(u -> assertThat(u.status()).isEqualTo(WriteUnitStatus.COMMITTED));
        assertThat(repository.all()).singleElement().satisfies(t -> {
            assertThat(t.getScope()).isEqualTo(new DateRangeScope(A_MONDAY, A_MONDAY.plusDays(4)));
            assertThat(t.getReason()).isEqualTo("Conference");
        });
    }

    @Test
    void create_singleDate_defaultsEndDateToStart() {
        TimeOffWriteRequest req = TimeOffWriteRequest.builder()
                .startDate(A_MONDAY).startTime("12:00").endTime("13:00")
                .build();

        service.create(PROVIDER, req);

        assertThat(repository.all()).singleElement()
                .satisfies(t -> assertThat(t.getScope()).isEqualTo(DateRangeScope.singleDay(A_MONDAY)));
    }

    @Test
    void create_allDay_ignoresTimes() {
        TimeOffWriteRequest req = TimeOffWriteRequest.builder()
                .startDate(A_MONDAY).allDay(true)
                .build();

        service.create(PROVIDER, req);

        assertThat(repository.all()).singleElement().satisfies(t -> {
            assertThat(t.isAllDay()).isTrue();
            assertThat(t.range()).isEqualTo(TimeRange.fullDay());
        });
    }

    @Test
    void create_reversedDateRange_isMissingScope() {
        TimeOffWriteRequest req = TimeOffWriteRequest.builder()
                .startDate(A_MONDAY).endDate(A_MONDAY.minusDays(1))
                .startTime("12:00").endTime("13:00")
                .build();

        BatchWriteResult<TimeOff> result = service.create(PROVIDER, req);

        assertThat(result.units().get(0).validationError()).isEqualTo(WriteValidationError.MISSING_SCOPE);
        assertThat(repository.all()).isEmpty();
    }

    @Test
    void create_recurringLunch_conflictsWithExistingOnSameDay() {
        repository.seed(TimeOff.builder().providerId(PROVIDER).scope(new RecurringScope(1))
                .startMinute(720).endMinute(780).reason("Lunch").build());
        TimeOffWriteRequest req = TimeOffWriteRequest.builder()
                .daysOfWeek(List.of(1, 2)).startTime("12:30").endTime("13:30")
                .build();

        BatchWriteResult<TimeOff> result = service.create(PROVIDER, req);

        assertThat(result.units()).extracting(WriteOutcome::status)
                .containsExactly(WriteUnitStatus.CONFLICT, WriteUnitStatus.COMMITTED);
    }

    @Test
    void resolve_merge_keepsExistingReason() {
        repository.seed(TimeOff.builder().providerId(PROVIDER).scope(new RecurringScope(1))
                .startMinute(720).endMinute(780).reason("Lunch").build());
        TimeOffWriteRequest req = TimeOffWriteRequest.builder()
                .daysOfWeek(List.of(1)).startTime("12:30").endTime("13:30")
                .decision(ResolutionDecision.MERGE)
                .build();

        service.resolve(PROVIDER, req);

        assertThat(repository.all()).singleElement().satisfies(t -> {
            assertThat(t.range()).isEqualTo(new TimeRange(720, 810));
            assertThat(t.getReason()).isEqualTo("Lunch");
        });
    }

    @Test
    void update_changesTimesAndKeepsScope() {
        TimeOff existing = repository.seed(TimeOff.builder().providerId(PROVIDER)
                .scope(DateRangeScope.singleDay(A_MONDAY))
                .startMinute(720).endMinute(780).reason("Dentist").build());
        TimeOffWriteRequest req = TimeOffWriteRequest.builder()
                .startTime("14:00").endTime("15:00").reason("Dentist, moved")
                .build();

        WriteOutcome<TimeOff> outcome = service.update(PROVIDER, existing.getId(), req);

        assertThat(outcome.status()).isEqualTo(WriteUnitStatus.COMMITTED);
        assertThat(repository.all()).singleElement().satisfies(t -> {
            assertThat(t.getScope()).isEqualTo(DateRangeScope.singleDay(A_MONDAY));
            assertThat(t.range()).isEqualTo(new TimeRange(840, 900));
            assertThat(t.getReason()).isEqualTo("Dentist, moved");
        });
    }
}
