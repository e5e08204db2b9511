package com.example.pawpal.model;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

import java.time.LocalDateTime;

public record ScheduleWalkRequest(
        @NotBlank String petId,
        @NotNull LocalDateTime scheduledTime,
        @NotNull @Positive Integer durationMinutes) {
}
