package io.github.riemr.availability.application.dto;

import java.util.List;

/**
 * What actually reached the store while applying a plan.
 *
 * @param deletedIds ids deleted before the unit finished or failed, in order
 * @param inserted   the inserted record, or {@code null} when nothing was inserted
 * @param completed  whether every step of the plan succeeded
 * @param failure    failure message when {@code completed} is false
 */
public record ExecutionReport<T>(List<Long> deletedIds, T inserted, boolean completed, String failure) {

    public static <T> ExecutionReport<T> success(List<Long> deletedIds, T inserted) {
        return new ExecutionReport<T>(List.copyOf(deletedIds), inserted, true, null);
    }

    public static <T> ExecutionReport<T> failure(List<Long> deletedIds, String failure) {
        return new ExecutionReport<T>(List.copyOf(deletedIds), null, false, failure);
    }
}
