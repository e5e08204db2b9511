package com.example.pawpal.model;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Optional;

public class Task {

    private final String taskId;
    private final String description;
    private LocalDateTime dueDate;
    private final Priority priority;
    private boolean completed;
    private Walk walk;
    private String userId;
    private final String petId;
    private final Recurrence recurrence;

    public Task(String taskId, String description, LocalDateTime dueDate, Priority priority) {
        this(taskId, description, dueDate, priority, null, Recurrence.NONE);
    }

    public Task(String taskId, String description, LocalDateTime dueDate, Priority priority,
                String petId, Recurrence recurrence) {
        this.taskId = taskId;
        this.description = description;
        this.dueDate = dueDate;
        this.priority = priority != null ? priority : Priority.UNKNOWN;
        this.petId = petId;
        this.recurrence = recurrence != null ? recurrence : Recurrence.NONE;
    }

    public String getTaskId() { return taskId; }

    public String getDescription() { return description; }

    public LocalDateTime getDueDate() { return dueDate; }
    public void setDueDate(LocalDateTime dueDate) { this.dueDate = dueDate; }

    public Priority getPriority() { return priority; }

    public boolean isCompleted() { return completed; }

    public Walk getWalk() { return walk; }
    public void attachWalk(Walk walk) { this.walk = walk; }

    public String getUserId() { return userId; }
    public void setUserId(String userId) { this.userId = userId; }

    public String getPetId() { return petId; }

    public Recurrence getRecurrence() { return recurrence; }

    public boolean isRecurring() {
        return recurrence.isRecurring();
    }

    /**
     * Marks the task done and completes its walk, if any. Calling it again
     * changes nothing.
     */
    public void markComplete() {
        this.completed = true;
        if (walk != null) {
            walk.complete();
        }
    }

    public Optional<LocalDateTime> getNextOccurrence() {
        return recurrence.nextAfter(dueDate);
    }

    public boolean isForToday(LocalDate today) {
        return dueDate != null && dueDate.toLocalDate().equals(today);
    }

    /** Pending with a walk that still occupies its time window. */
    public boolean hasActiveWalk() {
        return !completed && walk != null && !walk.isCancelled();
    }

    public LocalDateTime getWalkEndTime() {
        return walk == null ? dueDate : dueDate.plusMinutes(walk.getDurationMinutes());
    }
}
