package com.example.pawpal.model;

import java.time.LocalDateTime;

public class Walk {

    private final String walkId;
    private final String petId;
    private LocalDateTime scheduledTime;
    private final int durationMinutes;
    private WalkStatus status;

    public Walk(String walkId, String petId, LocalDateTime scheduledTime, int durationMinutes) {
        this.walkId = walkId;
        this.petId = petId;
        this.scheduledTime = scheduledTime;
        this.durationMinutes = durationMinutes;
        this.status = WalkStatus.SCHEDULED;
    }

    public String getWalkId() { return walkId; }

    public String getPetId() { return petId; }

    public LocalDateTime getScheduledTime() { return scheduledTime; }

    public int getDurationMinutes() { return durationMinutes; }

    public WalkStatus getStatus() { return status; }

    /** End of the half-open window {@code [scheduledTime, scheduledTime + duration)}. */
    public LocalDateTime getEndTime() {
        return scheduledTime.plusMinutes(durationMinutes);
    }

    public boolean isCancelled() {
        return status == WalkStatus.CANCELLED;
    }

    public void reschedule(LocalDateTime time) {
        this.scheduledTime = time;
        this.status = WalkStatus.SCHEDULED;
    }

    public void cancel() {
        this.status = WalkStatus.CANCELLED;
    }

    public void complete() {
        this.status = WalkStatus.COMPLETED;
    }
}
