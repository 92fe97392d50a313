package io.github.riemr.availability.domain.model;

import java.time.LocalDate;
import java.util.Objects;

public record SpecificDateScope(LocalDate date) implements Scope {

    public SpecificDateScope {
        Objects.requireNonNull(date, "date");
    }

    @Override
    public boolean isRecurring() {
        return false;
    }

    @Override
    public boolean appliesOn(LocalDate target) {
        return date.equals(target);
    }
}
