package io.github.riemr.availability.domain.timeline;

import java.util.List;

/**
 * Store operations needed to apply a write: every id in {@code toDelete} is
 * deleted first, then {@code toInsert} (if any) is inserted.
 */
public record ResolutionPlan<T>(List<Long> toDelete, T toInsert) {

    public static <T> ResolutionPlan<T> empty() {
        return new ResolutionPlan<T>(List.<Long>of(), null);
    }

    public static <T> ResolutionPlan<T> insertOnly(T record) {
        return new ResolutionPlan<T>(List.<Long>of(), record);
    }

    public boolean isEmpty() {
        return toDelete.isEmpty() && toInsert == null;
    }
}
