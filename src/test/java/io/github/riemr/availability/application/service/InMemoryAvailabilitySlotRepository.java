package io.github.riemr.availability.application.service;

import io.github.riemr.availability.application.repository.AvailabilitySlotRepository;
import io.github.riemr.availability.domain.model.AvailabilitySlot;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

class InMemoryAvailabilitySlotRepository implements AvailabilitySlotRepository {
    private final Map<Long, AvailabilitySlot> rows = new LinkedHashMap<>();
    private long nextId = 1;
    boolean failInserts;

    AvailabilitySlot seed(AvailabilitySlot slot) {
        return insert(slot);
    }

    @Override
    public AvailabilitySlot findById(Long id) {
        return rows.get(id);
    }

    @Override
    public List<AvailabilitySlot> findByProvider(String providerId) {
        return rows.values().stream().filter(s -> Objects.equals(s.getProviderId(), providerId)).toList();
    }

    @Override
    public AvailabilitySlot insert(AvailabilitySlot slot) {
        if (failInserts) throw new PersistenceFailureException("insert rejected");
        AvailabilitySlot saved = slot.toBuilder().id(nextId++).build();
        rows.put(saved.getId(), saved);
        return saved;
    }

    @Override
    public void delete(Long id) {
        if (rows.remove(id) == null) throw new PersistenceFailureException("no row " + id);
    }

    List<AvailabilitySlot> all() {
        return new ArrayList<>(rows.values());
    }
}
