package io.github.riemr.availability.domain.model;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;

/**
 * A booked appointment. Owned by the booking side; read-only here.
 */
@Value
@Builder
public class Appointment {
    Long id;
    String providerId;
    LocalDateTime startDateTime;
    LocalDateTime endDateTime;
    AppointmentStatus status;
    String clientName;
    String notes;
}
