package io.github.riemr.availability.application.repository;

import io.github.riemr.availability.domain.model.AvailabilitySlot;

import java.util.List;

public interface AvailabilitySlotRepository extends RecordStore<AvailabilitySlot> {
    AvailabilitySlot findById(Long id);

    List<AvailabilitySlot> findByProvider(String providerId);
}
