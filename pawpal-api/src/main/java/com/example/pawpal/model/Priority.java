package com.example.pawpal.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Task priority. Unrecognised labels parse to {@link #UNKNOWN}, which ranks
 * below every known priority.
 */
public enum Priority {

    HIGH(0),
    MEDIUM(1),
    LOW(2),
    UNKNOWN(3);

    private final int rank;

    Priority(int rank) {
        this.rank = rank;
    }

    public int getRank() {
        return rank;
    }

    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static Priority fromLabel(String label) {
        if (label == null) {
            return UNKNOWN;
        }
        String normalized = label.trim();
        for (Priority priority : values()) {
            if (priority != UNKNOWN && priority.name().equalsIgnoreCase(normalized)) {
                return priority;
            }
        }
        return UNKNOWN;
    }
}
