package io.github.riemr.availability.domain.model;

public enum AppointmentStatus {
    PENDING,
    SCHEDULED,
    CONFIRMED,
    COMPLETED,
    CANCELLED,
    NO_SHOW;

    public static AppointmentStatus fromCode(String code) {
        if (code == null) return null;
        String upper = code.trim().toUpperCase().replace('-', '_');
        for (AppointmentStatus s : values()) {
            if (s.name().equals(upper)) return s;
        }
        throw new IllegalArgumentException("Unknown appointment status: " + code);
    }

    public boolean isCancelled() {
        return this == CANCELLED;
    }
}
