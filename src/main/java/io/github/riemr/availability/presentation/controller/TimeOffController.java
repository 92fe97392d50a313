package io.github.riemr.availability.presentation.controller;

import io.github.riemr.availability.application.dto.TimeOffWriteRequest;
import io.github.riemr.availability.application.service.TimeOffWriteService;
import io.github.riemr.availability.domain.model.TimeOff;
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
@RequestMapping("/api/providers/{providerId}/time-off")
public class TimeOffController {
    private final TimeOffWriteService service;

    public TimeOffController(TimeOffWriteService service) {
        this.service = service;
    }

    @GetMapping(produces = MediaType.APPLICATION_JSON_VALUE)
    public List<TimeOff> list(@PathVariable("providerId") String providerId) {
        return service.list(providerId);
    }

    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<?> create(@PathVariable("providerId") String providerId,
                                    @Valid @RequestBody TimeOffWriteRequest req) {
        return WriteResponses.of(service.create(providerId, req));
    }

    @PostMapping(path = "/resolve", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<?> resolve(@PathVariable("providerId") String providerId,
                                     @Valid @RequestBody TimeOffWriteRequest req) {
        return WriteResponses.of(service.resolve(providerId, req));
    }

    @PutMapping(path = "/{timeOffId}", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<?> update(@PathVariable("providerId") String providerId,
                                    @PathVariable("timeOffId") Long timeOffId,
                                    @Valid @RequestBody TimeOffWriteRequest req) {
        return WriteResponses.of(service.update(providerId, timeOffId, req));
    }

    @DeleteMapping(path = "/{timeOffId}")
    public ResponseEntity<?> delete(@PathVariable("providerId") String providerId,
                                    @PathVariable("timeOffId") Long timeOffId) {
        service.delete(providerId, timeOffId);
        return ResponseEntity.ok().build();
    }
}
