package com.example.pawpal.model;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.time.LocalDateTime;

public record CreateTaskRequest(
        String petId,
        @NotBlank String description,
        @NotNull LocalDateTime dueDate,
        @NotNull Priority priority,
        Recurrence recurrence) {
}
