package io.github.riemr.availability.presentation.controller;

import io.github.riemr.availability.application.service.TimelineService;
import io.github.riemr.availability.domain.model.TimeBlock;
import io.github.riemr.availability.domain.model.TimeRange;
import io.github.riemr.availability.domain.timeline.IntervalCalculus;
import io.github.riemr.availability.domain.timeline.PartitionedTimeline;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/providers/{providerId}")
public class TimelineController {
    private final TimelineService timelineService;

    public TimelineController(TimelineService timelineService) {
        this.timelineService = timelineService;
    }

    @GetMapping(path = "/timeline", produces = MediaType.APPLICATION_JSON_VALUE)
    public List<TimeBlock> timeline(@PathVariable("providerId") String providerId,
                                    @RequestParam("date") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        return timelineService.resolveTimeline(providerId, date);
    }

    @GetMapping(path = "/timeline/week", produces = MediaType.APPLICATION_JSON_VALUE)
    public Map<String, List<TimeBlock>> week(@PathVariable("providerId") String providerId,
                                             @RequestParam("start") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate start) {
        Map<String, List<TimeBlock>> result = new LinkedHashMap<>();
        timelineService.resolveWeek(providerId, start).forEach((d, blocks) -> result.put(d.toString(), blocks));
        return result;
    }

    @GetMapping(path = "/timeline/partitioned", produces = MediaType.APPLICATION_JSON_VALUE)
    public PartitionedTimeline partitioned(@PathVariable("providerId") String providerId,
                                           @RequestParam("date") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        return timelineService.resolvePartitioned(providerId, date);
    }

    @GetMapping(path = "/bookable-slots", produces = MediaType.APPLICATION_JSON_VALUE)
    public List<Map<String, String>> bookableSlots(@PathVariable("providerId") String providerId,
                                                   @RequestParam("date") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date,
                                                   @RequestParam(name = "duration", required = false) Integer duration) {
        List<TimeRange> slots = timelineService.findBookableSlots(providerId, date, duration);
        return slots.stream()
                .map(s -> Map.of(
                        "startTime", IntervalCalculus.formatMinute(s.startMinute()),
                        "endTime", IntervalCalculus.formatMinute(s.endMinute())))
                .toList();
    }
}
