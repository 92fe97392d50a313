package io.github.riemr.availability.config;

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;

@Configuration
@ConditionalOnProperty(prefix = "availability", name = "schema-init", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class SchemaInitializer {
    private final JdbcTemplate jdbc;

    @PostConstruct
    public void ensureTables() {
        try {
            // day_of_week: 0=Sun ... 6=Sat; minutes of day, 1440 = 24:00
            jdbc.execute("CREATE TABLE IF NOT EXISTS availability_slot (" +
                    "id BIGSERIAL PRIMARY KEY, " +
                    "provider_id VARCHAR(64) NOT NULL, " +
                    "day_of_week SMALLINT NULL CHECK (day_of_week BETWEEN 0 AND 6), " +
                    "specific_date DATE NULL, " +
                    "start_minute INTEGER NOT NULL, " +
                    "end_minute INTEGER NOT NULL, " +
                    "created_at TIMESTAMP NOT NULL DEFAULT now(), " +
                    "CONSTRAINT chk_availability_scope CHECK ((day_of_week IS NULL) <> (specific_date IS NULL)), " +
                    "CONSTRAINT chk_availability_range CHECK (start_minute >= 0 AND end_minute <= 1440 AND end_minute > start_minute)" +
                    ")");
            jdbc.execute("CREATE INDEX IF NOT EXISTS idx_availability_slot_provider ON availability_slot (provider_id)");

            jdbc.execute("CREATE TABLE IF NOT EXISTS time_off (" +
                    "id BIGSERIAL PRIMARY KEY, " +
                    "provider_id VARCHAR(64) NOT NULL, " +
                    "day_of_week SMALLINT NULL CHECK (day_of_week BETWEEN 0 AND 6), " +
                    "start_date DATE NULL, " +
                    "end_date DATE NULL, " +
                    "start_minute INTEGER NOT NULL, " +
                    "end_minute INTEGER NOT NULL, " +
                    "all_day BOOLEAN NOT NULL DEFAULT FALSE, " +
                    "reason TEXT, " +
                    "created_at TIMESTAMP NOT NULL DEFAULT now(), " +
                    "CONSTRAINT chk_time_off_dates CHECK (end_date IS NULL OR end_date >= start_date), " +
                    "CONSTRAINT chk_time_off_range CHECK (start_minute >= 0 AND end_minute <= 1440 AND end_minute > start_minute)" +
                    ")");
            jdbc.execute("CREATE INDEX IF NOT EXISTS idx_time_off_provider ON time_off (provider_id)");

            // Written by the booking side; created here so a fresh database can serve timelines
            jdbc.execute("CREATE TABLE IF NOT EXISTS appointment (" +
                    "id BIGSERIAL PRIMARY KEY, " +
                    "provider_id VARCHAR(64) NOT NULL, " +
                    "start_date_time TIMESTAMP NOT NULL, " +
                    "end_date_time TIMESTAMP NOT NULL, " +
                    "status VARCHAR(16) NOT NULL, " +
                    "client_name TEXT, " +
                    "notes TEXT" +
                    ")");
            jdbc.execute("CREATE INDEX IF NOT EXISTS idx_appointment_provider_start ON appointment (provider_id, start_date_time)");

            log.info("Schema checked/initialized: availability_slot, time_off, appointment ensured.");
        } catch (Exception e) {
            log.warn("Schema initialization failed: {}", e.getMessage());
        }
    }
}
