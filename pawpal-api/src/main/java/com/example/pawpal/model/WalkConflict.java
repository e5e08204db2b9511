package com.example.pawpal.model;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/** An existing walk whose window overlaps a proposed one. */
public record WalkConflict(
        String petName,
        String taskId,
        String description,
        LocalDateTime existingStart,
        int existingDurationMinutes) {

    public static final DateTimeFormatter DISPLAY_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm");

    public String reason() {
        return "%s already has '%s' at %s for %d minutes".formatted(
                petName, description, existingStart.format(DISPLAY_FORMAT), existingDurationMinutes);
    }
}
