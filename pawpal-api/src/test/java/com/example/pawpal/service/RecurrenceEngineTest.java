package com.example.pawpal.service;

import com.example.pawpal.model.Priority;
import com.example.pawpal.model.Recurrence;
import com.example.pawpal.model.Task;
import com.example.pawpal.model.Walk;
import com.example.pawpal.store.InMemoryTaskStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class RecurrenceEngineTest {

    private static final LocalDateTime START = LocalDateTime.of(2026, 3, 10, 8, 0);

    private RecurrenceEngine engine;

    @BeforeEach
    void setUp() {
        engine = new RecurrenceEngine(new InMemoryTaskStore());
    }

    @Test
    void nonRecurringTaskHasNoSuccessor() {
        Task task = new Task("TASK-100", "Vet visit", START, Priority.HIGH);

        assertTrue(engine.nextOccurrence(task).isEmpty());
    }

    @Test
    void successorCopiesMetadataButNotWalkOrCompletion() {
        Task task = new Task("TASK-100", "Feed Buddy", START, Priority.MEDIUM, "PET-001", Recurrence.DAILY);
        task.setUserId("user_001");
        task.attachWalk(new Walk("WALK-100", "PET-001", START, 30));
        task.markComplete();

        Task next = engine.nextOccurrence(task).orElseThrow();

        assertNotEquals(task.getTaskId(), next.getTaskId());
        assertEquals("Feed Buddy", next.getDescription());
        assertEquals(Priority.MEDIUM, next.getPriority());
        assertEquals("PET-001", next.getPetId());
        assertEquals("user_001", next.getUserId());
        assertEquals(Recurrence.DAILY, next.getRecurrence());
        assertEquals(START.plusDays(1), next.getDueDate());
        assertFalse(next.isCompleted());
        assertNull(next.getWalk());
    }

    @Test
    void successorsChainByPeriod() {
        Task current = new Task("TASK-100", "Bath", START, Priority.LOW, null, Recurrence.WEEKLY);

        for (int i = 0; i < 4; i++) {
            Optional<Task> next = engine.nextOccurrence(current);
            assertTrue(next.isPresent());
            current = next.get();
        }

        assertEquals(START.plusWeeks(4), current.getDueDate());
    }
}
