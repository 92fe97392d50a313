package io.github.riemr.availability.application.repository;

import io.github.riemr.availability.domain.model.TimeOff;

import java.util.List;

public interface TimeOffRepository extends RecordStore<TimeOff> {
    TimeOff findById(Long id);

    List<TimeOff> findByProvider(String providerId);
}
