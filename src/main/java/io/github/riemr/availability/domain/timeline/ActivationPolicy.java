package io.github.riemr.availability.domain.timeline;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * Activation-date cutoff for recurring records. A recurring record does not show
 * up on past dates before it was created; today and future dates always see it.
 */
final class ActivationPolicy {
    private ActivationPolicy() {}

    static boolean isActiveOn(LocalDateTime createdAt, LocalDate target, LocalDate today) {
        if (!target.isBefore(today)) return true;
        if (createdAt == null) return true;
        return !createdAt.isAfter(target.atStartOfDay());
    }
}
