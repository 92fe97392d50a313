package io.github.riemr.availability.domain.timeline;

public enum ResolutionDecision {
    CANCEL,
    REPLACE,
    MERGE
}
