package io.github.riemr.availability.application.dto;

import io.github.riemr.availability.domain.timeline.ResolutionDecision;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TimeOffWriteRequest {
    @Size(max = 7)
    private List<Integer> daysOfWeek; // recurring, one unit per day
    private LocalDate startDate;      // one-time range start
    private LocalDate endDate;        // defaults to startDate
    private String startTime;
    private String endTime;
    private boolean allDay;
    @Size(max = 500)
    private String reason;
    private ResolutionDecision decision;
}
