package io.github.riemr.availability.infrastructure.repository;

import io.github.riemr.availability.application.repository.TimeOffRepository;
import io.github.riemr.availability.application.service.PersistenceFailureException;
import io.github.riemr.availability.domain.model.DateRangeScope;
import io.github.riemr.availability.domain.model.RecurringScope;
import io.github.riemr.availability.domain.model.Scope;
import io.github.riemr.availability.domain.model.TimeOff;
import io.github.riemr.availability.infrastructure.mapper.TimeOffMapper;
import io.github.riemr.availability.infrastructure.persistence.entity.TimeOffRow;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public class TimeOffRepositoryImpl implements TimeOffRepository {

    private final TimeOffMapper mapper;

    public TimeOffRepositoryImpl(TimeOffMapper mapper) {
        this.mapper = mapper;
    }

    @Override
    public TimeOff findById(Long id) {
        TimeOffRow row = mapper.selectByPrimaryKey(id);
        return row == null ? null : toDomain(row);
    }

    @Override
    public List<TimeOff> findByProvider(String providerId) {
        return mapper.selectByProvider(providerId).stream().map(TimeOffRepositoryImpl::toDomain).toList();
    }

    @Override
    public TimeOff insert(TimeOff timeOff) {
        TimeOffRow row = toRow(timeOff);
        if (mapper.insert(row) != 1) {
            throw new PersistenceFailureException("Insert of time-off failed for provider " + timeOff.getProviderId());
        }
        return timeOff.toBuilder().id(row.getId()).build();
    }

    @Override
    public void delete(Long id) {
        if (mapper.deleteByPrimaryKey(id) != 1) {
            throw new PersistenceFailureException("Time-off " + id + " could not be deleted");
        }
    }

    static TimeOff toDomain(TimeOffRow row) {
        Scope scope;
        if (row.getDayOfWeek() != null) {
            scope = new RecurringScope(row.getDayOfWeek());
        } else {
            // single-day rows may leave end_date empty
            scope = new DateRangeScope(row.getStartDate(),
                    row.getEndDate() != null ? row.getEndDate() : row.getStartDate());
        }
        return TimeOff.builder()
                .id(row.getId())
                .providerId(row.getProviderId())
                .scope(scope)
                .startMinute(row.getStartMinute())
                .endMinute(row.getEndMinute())
                .allDay(Boolean.TRUE.equals(row.getAllDay()))
                .reason(row.getReason())
                .createdAt(row.getCreatedAt())
                .build();
    }

    static TimeOffRow toRow(TimeOff timeOff) {
        TimeOffRow row = new TimeOffRow();
        row.setId(timeOff.getId());
        row.setProviderId(timeOff.getProviderId());
        if (timeOff.getScope() instanceof RecurringScope recurring) {
            row.setDayOfWeek((short) recurring.dayOfWeek());
        } else if (timeOff.getScope() instanceof DateRangeScope range) {
            row.setStartDate(range.startDate());
            row.setEndDate(range.endDate());
        } else {
            throw new IllegalArgumentException("Unsupported time-off scope: " + timeOff.getScope());
        }
        row.setStartMinute(timeOff.range().startMinute());
        row.setEndMinute(timeOff.range().endMinute());
        row.setAllDay(timeOff.isAllDay());
        row.setReason(timeOff.getReason());
        row.setCreatedAt(timeOff.getCreatedAt());
        return row;
    }
}
