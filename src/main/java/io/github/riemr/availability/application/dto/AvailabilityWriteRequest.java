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
public class AvailabilityWriteRequest {
    @Size(max = 7)
    private List<Integer> daysOfWeek; // 0=Sun ... 6=Sat, one unit per day
    private LocalDate date;           // specific date, used when no days are given
    private String startTime;         // HH:mm
    private String endTime;           // HH:mm, 24:00 allowed
    private ResolutionDecision decision; // only for resolve/edit
}
