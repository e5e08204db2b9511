package com.example.pawpal.store;

import com.example.pawpal.model.Task;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

@Component
public class InMemoryTaskStore {

    private final ConcurrentHashMap<String, Task> tasks = new ConcurrentHashMap<>();
    private final AtomicInteger idSequence = new AtomicInteger(1);

    public String nextId() {
        String id;
        do {
            id = "TASK-%03d".formatted(idSequence.getAndIncrement());
        } while (tasks.containsKey(id));
        return id;
    }

    public void save(Task task) {
        tasks.put(task.getTaskId(), task);
    }

    public boolean exists(String taskId) {
        return taskId != null && tasks.containsKey(taskId);
    }

    public Optional<Task> findById(String taskId) {
        return taskId == null ? Optional.empty() : Optional.ofNullable(tasks.get(taskId));
    }

    /** Resolves ids in the given order, skipping unknown ones. */
    public List<Task> findAllById(List<String> taskIds) {
        return taskIds.stream()
                .map(tasks::get)
                .filter(Objects::nonNull)
                .toList();
    }

    public Collection<Task> findAll() {
        return tasks.values();
    }
}
