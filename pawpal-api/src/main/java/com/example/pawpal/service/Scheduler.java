package com.example.pawpal.service;

import com.example.pawpal.exception.ScheduleValidationException;
import com.example.pawpal.exception.WalkNotFoundException;
import com.example.pawpal.model.ConflictCheck;
import com.example.pawpal.model.Pet;
import com.example.pawpal.model.Priority;
import com.example.pawpal.model.Recurrence;
import com.example.pawpal.model.Task;
import com.example.pawpal.model.User;
import com.example.pawpal.model.Walk;
import com.example.pawpal.model.WalkScheduleResult;
import com.example.pawpal.model.WalkStatus;
import com.example.pawpal.store.InMemoryPetStore;
import com.example.pawpal.store.InMemoryTaskStore;
import com.example.pawpal.store.InMemoryWalkStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Schedules walks and tasks for one owner.
 *
 * <p>Mutating operations are serialized on the scheduler instance, so a
 * conflict check and the walk it admits are committed together. Queries never
 * mutate and return tasks in the order they were registered with the owner.
 */
public class Scheduler {

    private static final Logger log = LoggerFactory.getLogger(Scheduler.class);

    /** Group key for tasks that belong to no pet. */
    public static final String GENERAL_GROUP = "General";

    private static final Comparator<Task> BY_TIME = Comparator.comparing(Task::getDueDate);
    private static final Comparator<Task> BY_PRIORITY =
            Comparator.comparingInt((Task t) -> t.getPriority().getRank()).thenComparing(BY_TIME);

    private final User user;
    private final InMemoryPetStore petStore;
    private final InMemoryTaskStore taskStore;
    private final InMemoryWalkStore walkStore;
    private final ConflictDetector conflictDetector;
    private final RecurrenceEngine recurrenceEngine;
    private final Clock clock;

    public Scheduler(User user,
                     InMemoryPetStore petStore,
                     InMemoryTaskStore taskStore,
                     InMemoryWalkStore walkStore,
                     ConflictDetector conflictDetector,
                     RecurrenceEngine recurrenceEngine,
                     Clock clock) {
        this.user = user;
        this.petStore = petStore;
        this.taskStore = taskStore;
        this.walkStore = walkStore;
        this.conflictDetector = conflictDetector;
        this.recurrenceEngine = recurrenceEngine;
        this.clock = clock;
    }

    public User getUser() {
        return user;
    }

    // ──────────────────────────────────────────────────────────────────────
    // Pets
    // ──────────────────────────────────────────────────────────────────────

    public synchronized Pet addPet(Pet pet) {
        if (pet == null) {
            throw new ScheduleValidationException("MISSING_FIELD", "Pet is required");
        }
        requireText(pet.getPetId(), "petId");
        requireText(pet.getName(), "name");
        if (pet.getAge() < 0) {
            throw new ScheduleValidationException("INVALID_AGE",
                    "Age must not be negative: " + pet.getAge());
        }
        petStore.findById(pet.getPetId())
                .filter(existing -> existing != pet)
                .ifPresent(existing -> {
                    throw new ScheduleValidationException("DUPLICATE_ID",
                            "Pet id already in use: " + pet.getPetId());
                });

        petStore.save(pet);
        user.addPet(pet);
        log.info("Pet {} ({}) added for owner {}", pet.getPetId(), pet.getName(), user.getUserId());
        return pet;
    }

    public List<Pet> getPets() {
        return petStore.findAllById(user.getPetIds());
    }

    public Optional<Pet> getPet(String petId) {
        if (petId == null || !user.ownsPet(petId)) {
            return Optional.empty();
        }
        return petStore.findById(petId);
    }

    // ──────────────────────────────────────────────────────────────────────
    // Walks
    // ──────────────────────────────────────────────────────────────────────

    /**
     * Schedules a walk unless it overlaps one of the pet's active walks. A
     * rejected request creates nothing and carries the conflict reasons.
     */
    public synchronized WalkScheduleResult scheduleWalk(Pet pet, LocalDateTime time, int durationMinutes) {
        Pet stored = requireOwnedPet(pet);
        if (time == null) {
            throw new ScheduleValidationException("MISSING_FIELD", "Walk time is required");
        }
        requirePositiveDuration(durationMinutes);

        ConflictCheck check = conflictDetector.check(stored, time, durationMinutes);
        if (check.hasConflict()) {
            log.warn("Walk for pet {} at {} ({} min) rejected: {}",
                    stored.getPetId(), time, durationMinutes, check.reasons());
            return WalkScheduleResult.rejected(check);
        }

        Walk walk = new Walk(walkStore.nextId(), stored.getPetId(), time, durationMinutes);
        Task task = new Task(taskStore.nextId(), "Walk " + stored.getName(), time,
                Priority.HIGH, stored.getPetId(), Recurrence.NONE);
        task.attachWalk(walk);
        register(task);

        log.info("Walk {} scheduled for pet {} at {} ({} min), task {}",
                walk.getWalkId(), stored.getPetId(), time, durationMinutes, task.getTaskId());
        return WalkScheduleResult.scheduled(walk, task, check);
    }

    public ConflictCheck hasConflict(Pet pet, LocalDateTime start, int durationMinutes) {
        Pet stored = requireOwnedPet(pet);
        if (start == null) {
            throw new ScheduleValidationException("MISSING_FIELD", "Walk time is required");
        }
        requirePositiveDuration(durationMinutes);
        return conflictDetector.check(stored, start, durationMinutes);
    }

    public synchronized Walk cancelWalk(String walkId) {
        Walk walk = walkStore.findById(walkId)
                .filter(w -> user.getWalkIds().contains(w.getWalkId()))
                .orElseThrow(() -> new WalkNotFoundException(walkId));
        if (walk.getStatus() == WalkStatus.COMPLETED) {
            throw new ScheduleValidationException("WALK_ALREADY_COMPLETED",
                    "Walk " + walkId + " is already completed");
        }
        walk.cancel();
        log.info("Walk {} for pet {} cancelled", walkId, walk.getPetId());
        return walk;
    }

    /** Active walks of the registered pet with this pet's id. Unknown pets have none. */
    public List<Walk> getScheduledWalks(Pet pet) {
        if (pet == null) {
            return List.of();
        }
        return getPet(pet.getPetId())
                .map(stored -> taskStore.findAllById(stored.getTaskIds()).stream()
                        .filter(Task::hasActiveWalk)
                        .map(Task::getWalk)
                        .toList())
                .orElse(List.of());
    }

    // ──────────────────────────────────────────────────────────────────────
    // Tasks
    // ──────────────────────────────────────────────────────────────────────

    /** Registers a task built by the caller, walk included, without conflict checks. */
    public synchronized Task addTask(Task task) {
        if (task == null) {
            throw new ScheduleValidationException("MISSING_FIELD", "Task is required");
        }
        requireText(task.getTaskId(), "taskId");
        requireText(task.getDescription(), "description");
        if (task.getDueDate() == null) {
            throw new ScheduleValidationException("MISSING_FIELD", "dueDate is required");
        }
        if (taskStore.exists(task.getTaskId())) {
            throw new ScheduleValidationException("DUPLICATE_ID",
                    "Task id already in use: " + task.getTaskId());
        }
        if (task.getPetId() != null) {
            requireOwnedPet(petStore.findById(task.getPetId()).orElse(null), task.getPetId());
        }
        Walk walk = task.getWalk();
        if (walk != null) {
            requireText(walk.getWalkId(), "walkId");
            if (!Objects.equals(walk.getPetId(), task.getPetId())) {
                throw new ScheduleValidationException("UNKNOWN_PET",
                        "Walk " + walk.getWalkId() + " is for pet " + walk.getPetId()
                                + " but task " + task.getTaskId() + " is for pet " + task.getPetId());
            }
            requirePositiveDuration(walk.getDurationMinutes());
            if (walkStore.exists(walk.getWalkId())) {
                throw new ScheduleValidationException("DUPLICATE_ID",
                        "Walk id already in use: " + walk.getWalkId());
            }
        }

        register(task);
        log.info("Task {} '{}' added for {}", task.getTaskId(), task.getDescription(),
                task.getPetId() != null ? "pet " + task.getPetId() : "owner " + user.getUserId());
        return task;
    }

    public synchronized Task createTask(Pet pet, String description, LocalDateTime dueDate, Priority priority) {
        return createRecurringTask(pet, description, dueDate, priority, Recurrence.NONE);
    }

    /** Registers a pending task with the given recurrence. A null pet files it under the owner only. */
    public synchronized Task createRecurringTask(Pet pet, String description, LocalDateTime startTime,
                                                 Priority priority, Recurrence recurrence) {
        if (pet != null) {
            requireOwnedPet(pet);
        }
        requireText(description, "description");
        if (startTime == null) {
            throw new ScheduleValidationException("MISSING_FIELD", "startTime is required");
        }

        Task task = new Task(taskStore.nextId(), description, startTime, priority,
                pet != null ? pet.getPetId() : null, recurrence);
        register(task);
        log.info("Task {} '{}' created, due {} ({})", task.getTaskId(), description, startTime,
                task.getRecurrence().label());
        return task;
    }

    /**
     * Completes a task and, when it recurs, registers and returns its
     * successor. Completing an already completed task does nothing.
     */
    public synchronized Optional<Task> completeTask(Task task) {
        requireRegistered(task);
        if (task.isCompleted()) {
            log.debug("Task {} already completed", task.getTaskId());
            return Optional.empty();
        }

        task.markComplete();
        log.info("Task {} '{}' completed", task.getTaskId(), task.getDescription());

        Optional<Task> next = recurrenceEngine.nextOccurrence(task);
        next.ifPresent(successor -> {
            register(successor);
            log.info("Task {} created as next {} occurrence of {}, due {}",
                    successor.getTaskId(), task.getRecurrence().label(), task.getTaskId(),
                    successor.getDueDate());
        });
        return next;
    }

    /**
     * Moves overdue recurring tasks forward one period. Each one gets the
     * advanced due date and is marked complete; a pending copy is registered
     * at that date. Attached walks move to the new date and go back to
     * SCHEDULED.
     *
     * @return the copies created
     */
    public synchronized List<Task> rescheduleMissedTasks() {
        LocalDateTime now = LocalDateTime.now(clock);
        List<Task> created = new ArrayList<>();

        for (Task task : getAllTasks()) {
            if (task.isCompleted() || !task.getDueDate().isBefore(now)) {
                continue;
            }
            Optional<LocalDateTime> next = task.getNextOccurrence();
            if (next.isEmpty()) {
                continue;
            }

            LocalDateTime missed = task.getDueDate();
            task.setDueDate(next.get());
            task.markComplete();
            Task copy = recurrenceEngine.copyAt(task, next.get());
            register(copy);
            if (task.getWalk() != null) {
                task.getWalk().reschedule(next.get());
            }
            created.add(copy);
            log.info("Missed task {} (due {}) moved to {} as task {}",
                    task.getTaskId(), missed, next.get(), copy.getTaskId());
        }
        return created;
    }

    // ──────────────────────────────────────────────────────────────────────
    // Queries
    // ──────────────────────────────────────────────────────────────────────

    public List<Task> getAllTasks() {
        return taskStore.findAllById(user.getTaskIds());
    }

    public Optional<Task> getTask(String taskId) {
        if (taskId == null || !user.getTaskIds().contains(taskId)) {
            return Optional.empty();
        }
        return taskStore.findById(taskId);
    }

    public List<Task> getTasksByPet(Pet pet) {
        if (pet == null) {
            return List.of();
        }
        return filterTasks(t -> pet.getPetId().equals(t.getPetId()));
    }

    public List<Task> getTasksByPriority(Priority priority) {
        return filterTasks(t -> t.getPriority() == priority);
    }

    /** Exact pet-name match, ignoring case. */
    public List<Task> getTasksByPetName(String petName) {
        if (petName == null || petName.isBlank()) {
            return List.of();
        }
        Set<String> petIds = getPets().stream()
                .filter(p -> p.getName() != null && p.getName().equalsIgnoreCase(petName.trim()))
                .map(Pet::getPetId)
                .collect(Collectors.toSet());
        if (petIds.isEmpty()) {
            return List.of();
        }
        return filterTasks(t -> t.getPetId() != null && petIds.contains(t.getPetId()));
    }

    public List<Task> getTasksByStatus(boolean completed) {
        return filterTasks(t -> t.isCompleted() == completed);
    }

    public List<Task> getPendingTasks() {
        return getTasksByStatus(false);
    }

    public List<Task> getCompletedTasks() {
        return getTasksByStatus(true);
    }

    /** Pending tasks due on the clock's current date. */
    public List<Task> getTodaysTasks() {
        LocalDate today = LocalDate.now(clock);
        return filterTasks(t -> !t.isCompleted() && t.isForToday(today));
    }

    public List<Task> sortTasksByTime(List<Task> tasks) {
        List<Task> sorted = new ArrayList<>(tasks);
        sorted.sort(BY_TIME);
        return sorted;
    }

    /** Orders by priority rank (high, medium, low, unknown), then due date. */
    public List<Task> sortTasksByPriority(List<Task> tasks) {
        List<Task> sorted = new ArrayList<>(tasks);
        sorted.sort(BY_PRIORITY);
        return sorted;
    }

    /**
     * Today's pending tasks grouped by pet name in first-seen order, each
     * group sorted by priority. Tasks without a pet go under {@value #GENERAL_GROUP}.
     */
    public Map<String, List<Task>> getOrganizedTodaysTasks() {
        Map<String, List<Task>> groups = new LinkedHashMap<>();
        for (Task task : getTodaysTasks()) {
            String key = petStore.findById(task.getPetId())
                    .map(Pet::getName)
                    .orElse(GENERAL_GROUP);
            groups.computeIfAbsent(key, k -> new ArrayList<>()).add(task);
        }
        groups.replaceAll((petName, tasks) -> sortTasksByPriority(tasks));
        return groups;
    }

    public List<String> checkAllConflicts() {
        List<String> reports = conflictDetector.findAllConflicts(getPets());
        if (!reports.isEmpty()) {
            log.warn("{} walk conflict(s) found in schedule for owner {}", reports.size(), user.getUserId());
        }
        return reports;
    }

    // ──────────────────────────────────────────────────────────────────────

    private List<Task> filterTasks(Predicate<Task> predicate) {
        return getAllTasks().stream().filter(predicate).toList();
    }

    private void register(Task task) {
        task.setUserId(user.getUserId());
        taskStore.save(task);
        user.addTask(task.getTaskId());
        petStore.findById(task.getPetId()).ifPresent(pet -> pet.addTask(task.getTaskId()));

        Walk walk = task.getWalk();
        if (walk != null) {
            walkStore.save(walk);
            user.addWalk(walk.getWalkId());
        }
    }

    /** Resolves the caller's pet to the registered instance. */
    private Pet requireOwnedPet(Pet pet) {
        if (pet == null) {
            throw new ScheduleValidationException("MISSING_FIELD", "Pet is required");
        }
        return requireOwnedPet(petStore.findById(pet.getPetId()).orElse(null), pet.getPetId());
    }

    private Pet requireOwnedPet(Pet stored, String petId) {
        if (stored == null || !user.ownsPet(petId)) {
            throw new ScheduleValidationException("UNKNOWN_PET",
                    "Pet " + petId + " does not belong to owner " + user.getUserId());
        }
        return stored;
    }

    private void requireRegistered(Task task) {
        if (task == null) {
            throw new ScheduleValidationException("MISSING_FIELD", "Task is required");
        }
        if (!user.getTaskIds().contains(task.getTaskId())) {
            throw new ScheduleValidationException("UNKNOWN_TASK",
                    "Task " + task.getTaskId() + " is not registered for owner " + user.getUserId());
        }
    }

    private static void requirePositiveDuration(int durationMinutes) {
        if (durationMinutes <= 0) {
            throw new ScheduleValidationException("INVALID_DURATION",
                    "Duration must be positive, got " + durationMinutes + " minutes");
        }
    }

    private static void requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new ScheduleValidationException("MISSING_FIELD", field + " is required");
        }
    }
}
