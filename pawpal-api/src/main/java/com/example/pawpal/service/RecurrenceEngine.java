package com.example.pawpal.service;

import com.example.pawpal.model.Task;
import com.example.pawpal.store.InMemoryTaskStore;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.Optional;

/**
 * Builds the successor of a recurring task. The successor is not registered
 * anywhere; the caller decides where it goes.
 */
@Component
public class RecurrenceEngine {

    private final InMemoryTaskStore taskStore;

    public RecurrenceEngine(InMemoryTaskStore taskStore) {
        this.taskStore = taskStore;
    }

    public Optional<Task> nextOccurrence(Task task) {
        return task.getNextOccurrence().map(next -> copyAt(task, next));
    }

    /** Same description, priority, pet, owner and recurrence; fresh id, pending, no walk. */
    public Task copyAt(Task task, LocalDateTime dueDate) {
        Task copy = new Task(
                taskStore.nextId(),
                task.getDescription(),
                dueDate,
                task.getPriority(),
                task.getPetId(),
                task.getRecurrence());
        copy.setUserId(task.getUserId());
        return copy;
    }
}
