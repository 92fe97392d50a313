package io.github.riemr.availability.domain.model;

/**
 * Kinds of timeline blocks. Declaration order is the tie-break order for
 * blocks starting at the same minute.
 */
public enum BlockKind {
    TIME_OFF,
    AVAILABILITY,
    APPOINTMENT
}
