package com.example.pawpal.service;

import com.example.pawpal.model.ConflictCheck;
import com.example.pawpal.model.Pet;
import com.example.pawpal.model.Task;
import com.example.pawpal.model.WalkConflict;
import com.example.pawpal.store.InMemoryTaskStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Overlap checks between walk windows. Windows are half-open, so a walk that
 * starts exactly when another ends does not conflict with it.
 *
 * <p>Checks are advisory: nothing here mutates state or blocks scheduling.
 */
@Component
public class ConflictDetector {

    private static final Logger log = LoggerFactory.getLogger(ConflictDetector.class);

    private final InMemoryTaskStore taskStore;

    public ConflictDetector(InMemoryTaskStore taskStore) {
        this.taskStore = taskStore;
    }

    public static boolean overlaps(LocalDateTime startA, LocalDateTime endA,
                                   LocalDateTime startB, LocalDateTime endB) {
        return startA.isBefore(endB) && endA.isAfter(startB);
    }

    public ConflictCheck check(Pet pet, LocalDateTime proposedStart, int durationMinutes) {
        LocalDateTime proposedEnd = proposedStart.plusMinutes(durationMinutes);
        List<WalkConflict> conflicts = new ArrayList<>();

        for (Task task : activeWalkTasks(pet)) {
            if (overlaps(proposedStart, proposedEnd, task.getDueDate(), task.getWalkEndTime())) {
                conflicts.add(new WalkConflict(
                        pet.getName(),
                        task.getTaskId(),
                        task.getDescription(),
                        task.getDueDate(),
                        task.getWalk().getDurationMinutes()));
            }
        }

        log.debug("Conflict check for pet {} at {} ({} min): {} conflict(s)",
                pet.getPetId(), proposedStart, durationMinutes, conflicts.size());
        return new ConflictCheck(pet.getName(), proposedStart, durationMinutes, conflicts);
    }

    /**
     * Compares every unordered pair of active walks per pet and reports each
     * overlapping pair once.
     */
    public List<String> findAllConflicts(Collection<Pet> pets) {
        List<String> reports = new ArrayList<>();
        for (Pet pet : pets) {
            List<Task> walks = activeWalkTasks(pet);
            for (int i = 0; i < walks.size(); i++) {
                Task first = walks.get(i);
                for (int j = i + 1; j < walks.size(); j++) {
                    Task second = walks.get(j);
                    if (overlaps(first.getDueDate(), first.getWalkEndTime(),
                            second.getDueDate(), second.getWalkEndTime())) {
                        reports.add(describePair(pet, first, second));
                    }
                }
            }
        }
        return reports;
    }

    private List<Task> activeWalkTasks(Pet pet) {
        return taskStore.findAllById(pet.getTaskIds()).stream()
                .filter(Task::hasActiveWalk)
                .toList();
    }

    private static String describePair(Pet pet, Task first, Task second) {
        return "Conflict for %s: '%s' at %s (%d min) overlaps '%s' at %s (%d min)".formatted(
                pet.getName(),
                first.getDescription(), first.getDueDate().format(WalkConflict.DISPLAY_FORMAT),
                first.getWalk().getDurationMinutes(),
                second.getDescription(), second.getDueDate().format(WalkConflict.DISPLAY_FORMAT),
                second.getWalk().getDurationMinutes());
    }
}
