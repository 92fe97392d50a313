package io.github.riemr.availability.infrastructure.repository;

import io.github.riemr.availability.domain.model.DateRangeScope;
import io.github.riemr.availability.domain.model.RecurringScope;
import io.github.riemr.availability.domain.model.TimeOff;
import io.github.riemr.availability.domain.model.TimeRange;
import io.github.riemr.availability.infrastructure.persistence.entity.TimeOffRow;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;

class TimeOffRepositoryImplTest {

    @Test
    void rowWithoutEndDate_isSingleDayRange() {
        TimeOffRow row = new TimeOffRow();
        row.setId(1L);
        row.setProviderId("p1");
        row.setStartDate(LocalDate.of(2024, 6, 17));
        row.setStartMinute(720);
        row.setEndMinute(780);
        row.setReason("Dentist");

        TimeOff timeOff = TimeOffRepositoryImpl.toDomain(row);

        assertThat(timeOff.getScope()).isEqualTo(DateRangeScope.singleDay(LocalDate.of(2024, 6, 17)));
        assertThat(timeOff.isAllDay()).isFalse();
        assertThat(timeOff.getReason()).isEqualTo("Dentist");
    }

    @Test
    void allDayRecord_isStoredAsFullDay() {
        TimeOff timeOff = TimeOff.builder()
                .providerId("p1").scope(new RecurringScope(6))
                .startMinute(600).endMinute(660).allDay(true)
                .build();

        TimeOffRow row = TimeOffRepositoryImpl.toRow(timeOff);

        assertThat(row.getDayOfWeek()).isEqualTo((short) 6);
        assertThat(row.getStartDate()).isNull();
        assertThat(row.getAllDay()).isTrue();
        assertThat(new TimeRange(row.getStartMinute(), row.getEndMinute())).isEqualTo(TimeRange.fullDay());
    }
}
