package com.example.pawpal.model;

import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.LocalDateTime;

import static org.junit.jupiter.api.Assertions.*;

class TaskTest {

    private static final LocalDateTime NINE_AM = LocalDateTime.of(2026, 3, 10, 9, 0);

    @Test
    void markComplete_setsCompletedAndCompletesWalk() {
        Task task = new Task("TASK-001", "Walk Buddy", NINE_AM, Priority.HIGH, "PET-001", Recurrence.NONE);
        Walk walk = new Walk("WALK-001", "PET-001", NINE_AM, 30);
        task.attachWalk(walk);

        task.markComplete();

        assertTrue(task.isCompleted());
        assertEquals(WalkStatus.COMPLETED, walk.getStatus());
    }

    @Test
    void markComplete_isIdempotent() {
        Task task = new Task("TASK-001", "Feed Buddy", NINE_AM, Priority.MEDIUM);

        task.markComplete();
        task.markComplete();

        assertTrue(task.isCompleted());
        assertNull(task.getWalk());
    }

    @Test
    void nextOccurrence_followsRecurrence() {
        Task daily = new Task("TASK-001", "Feed", NINE_AM, Priority.HIGH, null, Recurrence.DAILY);
        Task weekly = new Task("TASK-002", "Bath", NINE_AM, Priority.LOW, null, Recurrence.WEEKLY);
        Task once = new Task("TASK-003", "Vet visit", NINE_AM, Priority.HIGH);

        assertEquals(NINE_AM.plusDays(1), daily.getNextOccurrence().orElseThrow());
        assertEquals(NINE_AM.plusDays(7), weekly.getNextOccurrence().orElseThrow());
        assertTrue(once.getNextOccurrence().isEmpty());
        assertEquals(NINE_AM, daily.getDueDate(), "computing the next occurrence must not move the task");
    }

    @Test
    void isForToday_comparesCalendarDate() {
        Task task = new Task("TASK-001", "Feed", LocalDateTime.of(2026, 3, 10, 23, 59), Priority.HIGH);

        assertTrue(task.isForToday(LocalDate.of(2026, 3, 10)));
        assertFalse(task.isForToday(LocalDate.of(2026, 3, 11)));
    }

    @Test
    void hasActiveWalk_falseOnceCancelledOrCompleted() {
        Task task = new Task("TASK-001", "Walk Buddy", NINE_AM, Priority.HIGH, "PET-001", Recurrence.NONE);
        assertFalse(task.hasActiveWalk());

        Walk walk = new Walk("WALK-001", "PET-001", NINE_AM, 30);
        task.attachWalk(walk);
        assertTrue(task.hasActiveWalk());
        assertEquals(NINE_AM.plusMinutes(30), task.getWalkEndTime());

        walk.cancel();
        assertFalse(task.hasActiveWalk());

        walk.reschedule(NINE_AM.plusHours(1));
        assertTrue(task.hasActiveWalk());

        task.markComplete();
        assertFalse(task.hasActiveWalk());
    }

    @Test
    void nullPriorityAndRecurrenceFallBack() {
        Task task = new Task("TASK-001", "Brush", NINE_AM, null, null, null);

        assertEquals(Priority.UNKNOWN, task.getPriority());
        assertEquals(Recurrence.NONE, task.getRecurrence());
        assertFalse(task.isRecurring());
    }
}
