package com.example.pawpal.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.time.LocalDateTime;
import java.time.Period;
import java.util.Locale;
import java.util.Optional;

public enum Recurrence {

    DAILY(Period.ofDays(1)),
    WEEKLY(Period.ofDays(7)),
    NONE(null);

    private final Period period;

    Recurrence(Period period) {
        this.period = period;
    }

    public boolean isRecurring() {
        return period != null;
    }

    public Optional<LocalDateTime> nextAfter(LocalDateTime dateTime) {
        if (period == null || dateTime == null) {
            return Optional.empty();
        }
        return Optional.of(dateTime.plus(period));
    }

    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static Recurrence fromLabel(String label) {
        if (label == null || label.isBlank()) {
            return NONE;
        }
        try {
            return valueOf(label.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unsupported recurrence: " + label, e);
        }
    }
}
