package com.example.pawpal.controller;

import com.example.pawpal.model.OwnerResponse;
import com.example.pawpal.model.User;
import com.example.pawpal.service.Scheduler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/owner")
public class OwnerController {

    private final Scheduler scheduler;

    public OwnerController(Scheduler scheduler) {
        this.scheduler = scheduler;
    }

    @GetMapping
    public OwnerResponse getOwner() {
        User user = scheduler.getUser();
        return new OwnerResponse(
                user.getUserId(),
                user.getName(),
                user.getEmail(),
                user.getPetIds().size(),
                user.getTaskIds().size(),
                user.getWalkIds().size(),
                scheduler.getTodaysTasks().size());
    }
}
