package com.example.pawpal.model;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;

public record CreatePetRequest(
        @NotBlank String name,
        @NotBlank String breed,
        @PositiveOrZero int age) {
}
