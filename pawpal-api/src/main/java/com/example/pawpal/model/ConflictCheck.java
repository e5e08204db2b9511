package com.example.pawpal.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDateTime;
import java.util.List;

public record ConflictCheck(
        String petName,
        LocalDateTime proposedStart,
        int durationMinutes,
        List<WalkConflict> conflicts) {

    public ConflictCheck {
        conflicts = List.copyOf(conflicts);
    }

    @JsonProperty("conflict")
    public boolean hasConflict() {
        return !conflicts.isEmpty();
    }

    @JsonProperty
    public List<String> reasons() {
        return conflicts.stream().map(WalkConflict::reason).toList();
    }

    @JsonProperty
    public String message() {
        if (hasConflict()) {
            return "%d conflict(s) for %s at %s: %s".formatted(
                    conflicts.size(), petName, proposedStart.format(WalkConflict.DISPLAY_FORMAT),
                    String.join("; ", reasons()));
        }
        return "No conflicts: %s is free at %s for %d minutes".formatted(
                petName, proposedStart.format(WalkConflict.DISPLAY_FORMAT), durationMinutes);
    }
}
