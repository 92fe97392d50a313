package io.github.riemr.availability.application.dto;

public enum WriteUnitStatus {
    COMMITTED,
    CONFLICT,
    CANCELLED,
    FAILED,
    INVALID
}
