package com.example.pawpal.model;

import java.util.List;
import java.util.Optional;

/**
 * Outcome of a walk request. A rejected request carries the conflict check
 * and no walk or task.
 */
public record WalkScheduleResult(Walk walk, Task task, ConflictCheck conflictCheck) {

    public static WalkScheduleResult scheduled(Walk walk, Task task, ConflictCheck check) {
        return new WalkScheduleResult(walk, task, check);
    }

    public static WalkScheduleResult rejected(ConflictCheck check) {
        return new WalkScheduleResult(null, null, check);
    }

    public boolean isScheduled() {
        return walk != null;
    }

    public Optional<Walk> scheduledWalk() {
        return Optional.ofNullable(walk);
    }

    public List<String> reasons() {
        return conflictCheck.reasons();
    }
}
