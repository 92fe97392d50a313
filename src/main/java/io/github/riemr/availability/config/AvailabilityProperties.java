package io.github.riemr.availability.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Settings under the {@code availability} prefix.
 *
 * @param zoneId             zone used to decide which date is "today"; system default when blank
 * @param showAppointments   whether resolved timelines include appointment blocks
 * @param defaultSlotMinutes slot length used for bookable slots when the caller gives none
 * @param schemaInit         whether tables are created on startup
 */
@ConfigurationProperties(prefix = "availability")
public record AvailabilityProperties(String zoneId,
                                     Boolean showAppointments,
                                     Integer defaultSlotMinutes,
                                     Boolean schemaInit) {

    public AvailabilityProperties {
        if (zoneId == null) {
            zoneId = "";
        }
        if (showAppointments == null) {
            showAppointments = Boolean.TRUE;
        }
        if (defaultSlotMinutes == null || defaultSlotMinutes < 1) {
            defaultSlotMinutes = 30;
        }
        if (schemaInit == null) {
            schemaInit = Boolean.TRUE;
        }
    }
}
