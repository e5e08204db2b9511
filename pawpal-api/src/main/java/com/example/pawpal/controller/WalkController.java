package com.example.pawpal.controller;

import com.example.pawpal.exception.WalkConflictException;
import com.example.pawpal.model.ConflictCheck;
import com.example.pawpal.model.Pet;
import com.example.pawpal.model.ScheduleWalkRequest;
import com.example.pawpal.model.TaskResponse;
import com.example.pawpal.model.WalkResponse;
import com.example.pawpal.model.WalkScheduleResult;
import com.example.pawpal.service.PetService;
import com.example.pawpal.service.Scheduler;
import jakarta.validation.Valid;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDateTime;

@RestController
@RequestMapping("/api/walks")
public class WalkController {

    private final PetService petService;
    private final Scheduler scheduler;

    public WalkController(PetService petService, Scheduler scheduler) {
        this.petService = petService;
        this.scheduler = scheduler;
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public TaskResponse scheduleWalk(@Valid @RequestBody ScheduleWalkRequest request) {
        Pet pet = petService.getPet(request.petId());
        WalkScheduleResult result = scheduler.scheduleWalk(pet, request.scheduledTime(), request.durationMinutes());
        if (!result.isScheduled()) {
            throw new WalkConflictException(pet.getPetId(), result.conflictCheck().message(), result.reasons());
        }
        return TaskResponse.from(result.task());
    }

    @GetMapping("/conflict-check")
    public ConflictCheck checkConflict(@RequestParam String petId,
                                       @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime start,
                                       @RequestParam int durationMinutes) {
        return scheduler.hasConflict(petService.getPet(petId), start, durationMinutes);
    }

    @PostMapping("/{walkId}/cancel")
    public WalkResponse cancelWalk(@PathVariable String walkId) {
        return WalkResponse.from(scheduler.cancelWalk(walkId));
    }
}
