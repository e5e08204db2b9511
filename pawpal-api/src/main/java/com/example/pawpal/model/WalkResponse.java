package com.example.pawpal.model;

import java.time.LocalDateTime;

public record WalkResponse(
        String walkId,
        String petId,
        LocalDateTime scheduledTime,
        int durationMinutes,
        LocalDateTime endTime,
        WalkStatus status) {

    public static WalkResponse from(Walk walk) {
        return new WalkResponse(
                walk.getWalkId(),
                walk.getPetId(),
                walk.getScheduledTime(),
                walk.getDurationMinutes(),
                walk.getEndTime(),
                walk.getStatus());
    }
}
