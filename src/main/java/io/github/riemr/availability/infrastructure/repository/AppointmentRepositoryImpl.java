package io.github.riemr.availability.infrastructure.repository;

import io.github.riemr.availability.application.repository.AppointmentRepository;
import io.github.riemr.availability.domain.model.Appointment;
import io.github.riemr.availability.domain.model.AppointmentStatus;
import io.github.riemr.availability.infrastructure.mapper.AppointmentMapper;
import io.github.riemr.availability.infrastructure.persistence.entity.AppointmentRow;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

@Repository
@Slf4j
public class AppointmentRepositoryImpl implements AppointmentRepository {

    private final AppointmentMapper mapper;

    public AppointmentRepositoryImpl(AppointmentMapper mapper) {
        this.mapper = mapper;
    }

    @Override
    public List<Appointment> findByProviderAndPeriod(String providerId, LocalDateTime from, LocalDateTime to) {
        List<Appointment> result = new ArrayList<>();
        for (AppointmentRow row : mapper.selectByProviderAndPeriod(providerId, from, to)) {
            try {
                result.add(toDomain(row));
            } catch (IllegalArgumentException e) {
                // unrecognised status: skip the row, keep the rest of the period
                log.warn("Skipping appointment {} of provider {}: {}", row.getId(), providerId, e.getMessage());
            }
        }
        return result;
    }

    static Appointment toDomain(AppointmentRow row) {
        return Appointment.builder()
                .id(row.getId())
                .providerId(row.getProviderId())
                .startDateTime(row.getStartDateTime())
                .endDateTime(row.getEndDateTime())
                .status(AppointmentStatus.fromCode(row.getStatus()))
                .clientName(row.getClientName())
                .notes(row.getNotes())
                .build();
    }
}
