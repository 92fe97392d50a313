package io.github.riemr.availability.presentation.controller;

import io.github.riemr.availability.application.service.TimelineService;
import io.github.riemr.availability.domain.model.BlockKind;
import io.github.riemr.availability.domain.model.TimeBlock;
import io.github.riemr.availability.domain.model.TimeRange;
import io.github.riemr.availability.domain.timeline.PartitionedTimeline;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.SpringBootConfiguration;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(controllers = TimelineController.class)
@AutoConfigureMockMvc(addFilters = false)
class TimelineControllerTest {

    @SpringBootConfiguration
    @Import({TimelineController.class, GlobalExceptionHandler.class})
    static class TestApplication {}

    private static final LocalDate DATE = LocalDate.of(2024, 6, 17);

    @Autowired
    MockMvc mockMvc;

    @MockBean
    TimelineService timelineService;

    @BeforeEach
    void setup() {
        Mockito.reset(timelineService);
    }

    private static TimeBlock availability(int start, int end) {
        return TimeBlock.builder().id("availability-1").kind(BlockKind.AVAILABILITY)
                .startMinute(start).endMinute(end).recurring(true).sourceRef(1L).build();
    }

    @Test
    void timeline_returnsBlocksWithFormattedTimes() throws Exception {
        when(timelineService.resolveTimeline("p1", DATE)).thenReturn(List.of(availability(540, 1020)));

        mockMvc.perform(get("/api/providers/{id}/timeline", "p1").param("date", "2024-06-17"))
                .andExpect(status().isOk())
                .andExpect(content().contentType(MediaType.APPLICATION_JSON))
                .andExpect(jsonPath("$[0].id").value("availability-1"))
                .andExpect(jsonPath("$[0].kind").value("AVAILABILITY"))
                .andExpect(jsonPath("$[0].startTime").value("09:00"))
                .andExpect(jsonPath("$[0].endTime").value("17:00"));
    }

    @Test
    void timeline_missingDate_returns400() throws Exception {
        mockMvc.perform(get("/api/providers/{id}/timeline", "p1"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Bad Request"));
        verifyNoInteractions(timelineService);
    }

    @Test
    void timeline_malformedDate_returns400() throws Exception {
        mockMvc.perform(get("/api/providers/{id}/timeline", "p1").param("date", "17/06/2024"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void week_isKeyedByIsoDate() throws Exception {
        Map<LocalDate, List<TimeBlock>> week = new LinkedHashMap<>();
        week.put(DATE, List.of(availability(540, 600)));
        week.put(DATE.plusDays(1), List.of());
        when(timelineService.resolveWeek("p1", DATE)).thenReturn(week);

        mockMvc.perform(get("/api/providers/{id}/timeline/week", "p1").param("start", "2024-06-17"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$['2024-06-17'][0].startTime").value("09:00"))
                .andExpect(jsonPath("$['2024-06-18']").isEmpty());
    }

    @Test
    void partitioned_returnsBothParts() throws Exception {
        TimeBlock holiday = TimeBlock.builder().id("time-off-2").kind(BlockKind.TIME_OFF)
                .startMinute(0).endMinute(1440).allDay(true).reason("Holiday").build();
        when(timelineService.resolvePartitioned("p1", DATE))
                .thenReturn(new PartitionedTimeline(List.of(holiday), List.of()));

        mockMvc.perform(get("/api/providers/{id}/timeline/partitioned", "p1").param("date", "2024-06-17"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.allDay[0].reason").value("Holiday"))
                .andExpect(jsonPath("$.allDay[0].endTime").value("24:00"))
                .andExpect(jsonPath("$.timed").isEmpty());
    }

    @Test
    void bookableSlots_defaultsDurationToService() throws Exception {
        when(timelineService.findBookableSlots(eq("p1"), eq(DATE), isNull()))
                .thenReturn(List.of(new TimeRange(540, 570), new TimeRange(570, 600)));

        mockMvc.perform(get("/api/providers/{id}/bookable-slots", "p1").param("date", "2024-06-17"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(2))
                .andExpect(jsonPath("$[1].startTime").value("09:30"))
                .andExpect(jsonPath("$[1].endTime").value("10:00"));
    }

    @Test
    void bookableSlots_invalidDuration_returns400() throws Exception {
        when(timelineService.findBookableSlots("p1", DATE, 0))
                .thenThrow(new IllegalArgumentException("duration must be >= 1 minute"));

        mockMvc.perform(get("/api/providers/{id}/bookable-slots", "p1")
                        .param("date", "2024-06-17").param("duration", "0"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("duration must be >= 1 minute"));
    }
}
