package io.github.riemr.availability.domain.timeline;

import io.github.riemr.availability.domain.model.TimeBlock;

import java.util.List;

public record PartitionedTimeline(List<TimeBlock> allDay, List<TimeBlock> timed) {
}
