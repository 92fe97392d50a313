package io.github.riemr.availability.infrastructure.repository;

import io.github.riemr.availability.application.repository.AvailabilitySlotRepository;
import io.github.riemr.availability.application.service.PersistenceFailureException;
import io.github.riemr.availability.domain.model.AvailabilitySlot;
import io.github.riemr.availability.domain.model.RecurringScope;
import io.github.riemr.availability.domain.model.Scope;
import io.github.riemr.availability.domain.model.SpecificDateScope;
import io.github.riemr.availability.infrastructure.mapper.AvailabilitySlotMapper;
import io.github.riemr.availability.infrastructure.persistence.entity.AvailabilitySlotRow;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public class AvailabilitySlotRepositoryImpl implements AvailabilitySlotRepository {

    private final AvailabilitySlotMapper mapper;

    public AvailabilitySlotRepositoryImpl(AvailabilitySlotMapper mapper) {
        this.mapper = mapper;
    }

    @Override
    public AvailabilitySlot findById(Long id) {
        AvailabilitySlotRow row = mapper.selectByPrimaryKey(id);
        return row == null ? null : toDomain(row);
    }

    @Override
    public List<AvailabilitySlot> findByProvider(String providerId) {
        return mapper.selectByProvider(providerId).stream().map(AvailabilitySlotRepositoryImpl::toDomain).toList();
    }

    @Override
    public AvailabilitySlot insert(AvailabilitySlot slot) {
        AvailabilitySlotRow row = toRow(slot);
        if (mapper.insert(row) != 1) {
            throw new PersistenceFailureException("Insert of availability slot failed for provider " + slot.getProviderId());
        }
        return slot.toBuilder().id(row.getId()).build();
    }

    @Override
    public void delete(Long id) {
        if (mapper.deleteByPrimaryKey(id) != 1) {
            throw new PersistenceFailureException("Availability slot " + id + " could not be deleted");
        }
    }

    static AvailabilitySlot toDomain(AvailabilitySlotRow row) {
        Scope scope = row.getDayOfWeek() != null
                ? new RecurringScope(row.getDayOfWeek())
                : new SpecificDateScope(row.getSpecificDate());
        return AvailabilitySlot.builder()
                .id(row.getId())
                .providerId(row.getProviderId())
                .scope(scope)
                .startMinute(row.getStartMinute())
                .endMinute(row.getEndMinute())
                .createdAt(row.getCreatedAt())
                .build();
    }

    static AvailabilitySlotRow toRow(AvailabilitySlot slot) {
        AvailabilitySlotRow row = new AvailabilitySlotRow();
        row.setId(slot.getId());
        row.setProviderId(slot.getProviderId());
        if (slot.getScope() instanceof RecurringScope recurring) {
            row.setDayOfWeek((short) recurring.dayOfWeek());
        } else if (slot.getScope() instanceof SpecificDateScope specific) {
            row.setSpecificDate(specific.date());
        } else {
            throw new IllegalArgumentException("Unsupported availability scope: " + slot.getScope());
        }
        row.setStartMinute(slot.getStartMinute());
        row.setEndMinute(slot.getEndMinute());
        row.setCreatedAt(slot.getCreatedAt());
        return row;
    }
}
