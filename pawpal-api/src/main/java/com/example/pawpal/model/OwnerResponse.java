package com.example.pawpal.model;

public record OwnerResponse(
        String userId,
        String name,
        String email,
        int petCount,
        int taskCount,
        int walkCount,
        int todaysTaskCount) {
}
