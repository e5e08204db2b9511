package com.example.pawpal.model;

import java.time.LocalDateTime;

public record TaskResponse(
        String taskId,
        String description,
        LocalDateTime dueDate,
        Priority priority,
        boolean completed,
        String petId,
        String userId,
        Recurrence recurrence,
        WalkResponse walk) {

    public static TaskResponse from(Task task) {
        return new TaskResponse(
                task.getTaskId(),
                task.getDescription(),
                task.getDueDate(),
                task.getPriority(),
                task.isCompleted(),
                task.getPetId(),
                task.getUserId(),
                task.getRecurrence(),
                task.getWalk() != null ? WalkResponse.from(task.getWalk()) : null);
    }
}
