package io.github.riemr.availability.infrastructure.persistence.entity;

import java.io.Serializable;
import java.time.LocalDateTime;

public class AppointmentRow implements Serializable {
    private Long id;
    private String providerId;
    private LocalDateTime startDateTime;
    private LocalDateTime endDateTime;
    private String status; // PENDING / SCHEDULED / CONFIRMED / COMPLETED / CANCELLED / NO_SHOW
    private String clientName;
    private String notes;

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }
    public String getProviderId() { return providerId; }
    public void setProviderId(String providerId) { this.providerId = providerId; }
    public LocalDateTime getStartDateTime() { return startDateTime; }
    public void setStartDateTime(LocalDateTime startDateTime) { this.startDateTime = startDateTime; }
    public LocalDateTime getEndDateTime() { return endDateTime; }
    public void setEndDateTime(LocalDateTime endDateTime) { this.endDateTime = endDateTime; }
    public String getStatus() { return status; }
    public void setStatus(String status) { this.status = status; }
    public String getClientName() { return clientName; }
    public void setClientName(String clientName) { this.clientName = clientName; }
    public String getNotes() { return notes; }
    public void setNotes(String notes) { this.notes = notes; }
}
