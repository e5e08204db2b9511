package com.example.pawpal.controller;

import com.example.pawpal.exception.TaskNotFoundException;
import com.example.pawpal.model.CompleteTaskResponse;
import com.example.pawpal.model.CreateTaskRequest;
import com.example.pawpal.model.Pet;
import com.example.pawpal.model.Priority;
import com.example.pawpal.model.Recurrence;
import com.example.pawpal.model.Task;
import com.example.pawpal.model.TaskResponse;
import com.example.pawpal.service.PetService;
import com.example.pawpal.service.Scheduler;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

@RestController
@RequestMapping("/api/tasks")
public class TaskController {

    private final PetService petService;
    private final Scheduler scheduler;

    public TaskController(PetService petService, Scheduler scheduler) {
        this.petService = petService;
        this.scheduler = scheduler;
    }

    /** Filters are combined; {@code sort} is {@code time} or {@code priority}. */
    @GetMapping
    public List<TaskResponse> listTasks(@RequestParam(required = false) String petId,
                                        @RequestParam(required = false) String petName,
                                        @RequestParam(required = false) String priority,
                                        @RequestParam(required = false) Boolean completed,
                                        @RequestParam(required = false) String sort) {
        List<Task> tasks = scheduler.getAllTasks();
        if (petId != null) {
            tasks = retain(tasks, scheduler.getTasksByPet(petService.getPet(petId)));
        }
        if (petName != null) {
            tasks = retain(tasks, scheduler.getTasksByPetName(petName));
        }
        if (priority != null) {
            tasks = retain(tasks, scheduler.getTasksByPriority(Priority.fromLabel(priority)));
        }
        if (completed != null) {
            tasks = retain(tasks, scheduler.getTasksByStatus(completed));
        }

        if ("time".equalsIgnoreCase(sort)) {
            tasks = scheduler.sortTasksByTime(tasks);
        } else if ("priority".equalsIgnoreCase(sort)) {
            tasks = scheduler.sortTasksByPriority(tasks);
        }
        return tasks.stream().map(TaskResponse::from).toList();
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public TaskResponse createTask(@Valid @RequestBody CreateTaskRequest request) {
        Pet pet = request.petId() != null ? petService.getPet(request.petId()) : null;
        Recurrence recurrence = request.recurrence() != null ? request.recurrence() : Recurrence.NONE;
        Task task = recurrence.isRecurring()
                ? scheduler.createRecurringTask(pet, request.description(), request.dueDate(),
                        request.priority(), recurrence)
                : scheduler.createTask(pet, request.description(), request.dueDate(), request.priority());
        return TaskResponse.from(task);
    }

    @GetMapping("/{id}")
    public TaskResponse getTask(@PathVariable String id) {
        return TaskResponse.from(findTask(id));
    }

    @PostMapping("/{id}/complete")
    public CompleteTaskResponse completeTask(@PathVariable String id) {
        Task task = findTask(id);
        Optional<Task> next = scheduler.completeTask(task);
        return new CompleteTaskResponse(
                TaskResponse.from(task),
                next.map(TaskResponse::from).orElse(null));
    }

    @GetMapping("/today")
    public Map<String, List<TaskResponse>> getTodaysSchedule() {
        Map<String, List<TaskResponse>> schedule = new LinkedHashMap<>();
        scheduler.getOrganizedTodaysTasks().forEach((petName, tasks) ->
                schedule.put(petName, tasks.stream().map(TaskResponse::from).toList()));
        return schedule;
    }

    @PostMapping("/reschedule-missed")
    public List<TaskResponse> rescheduleMissedTasks() {
        return scheduler.rescheduleMissedTasks().stream()
                .map(TaskResponse::from)
                .toList();
    }

    private Task findTask(String taskId) {
        return scheduler.getTask(taskId)
                .orElseThrow(() -> new TaskNotFoundException(taskId));
    }

    private static List<Task> retain(List<Task> tasks, List<Task> matches) {
        Set<Task> keep = Collections.newSetFromMap(new IdentityHashMap<>());
        keep.addAll(matches);
        return tasks.stream().filter(keep::contains).toList();
    }
}
