package io.github.riemr.availability.application.repository;

import io.github.riemr.availability.domain.model.Appointment;

import java.time.LocalDateTime;
import java.util.List;

public interface AppointmentRepository {
    /** Appointments starting in {@code [from, to)}. */
    List<Appointment> findByProviderAndPeriod(String providerId, LocalDateTime from, LocalDateTime to);
}
