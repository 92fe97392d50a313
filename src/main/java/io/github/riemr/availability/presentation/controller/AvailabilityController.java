package io.github.riemr.availability.presentation.controller;

import io.github.riemr.availability.application.dto.AvailabilityWriteRequest;
import io.github.riemr.availability.application.service.AvailabilityWriteService;
import io.github.riemr.availability.domain.model.AvailabilitySlot;
import jakarta.validation.Valid;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/providers/{providerId}/availability")
public class AvailabilityController {
    private final AvailabilityWriteService service;

    public AvailabilityController(AvailabilityWriteService service) {
        this.service = service;
    }

    @GetMapping(produces = MediaType.APPLICATION_JSON_VALUE)
    public List<AvailabilitySlot> list(@PathVariable("providerId") String providerId) {
        return service.list(providerId);
    }

    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<?> create(@PathVariable("providerId") String providerId,
                                    @Valid @RequestBody AvailabilityWriteRequest req) {
        return WriteResponses.of(service.create(providerId, req));
    }

    @PostMapping(path = "/resolve", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<?> resolve(@PathVariable("providerId") String providerId,
                                     @Valid @RequestBody AvailabilityWriteRequest req) {
        return WriteResponses.of(service.resolve(providerId, req));
    }

    @PutMapping(path = "/{slotId}", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<?> update(@PathVariable("providerId") String providerId,
                                    @PathVariable("slotId") Long slotId,
                                    @Valid @RequestBody AvailabilityWriteRequest req) {
        return WriteResponses.of(service.update(providerId, slotId, req));
    }

    @DeleteMapping(path = "/{slotId}")
    public ResponseEntity<?> delete(@PathVariable("providerId") String providerId,
                                    @PathVariable("slotId") Long slotId) {
        service.delete(providerId, slotId);
        return ResponseEntity.ok().build();
    }
}
