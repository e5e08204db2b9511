package com.example.pawpal.controller;

import com.example.pawpal.service.Scheduler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/conflicts")
public class ConflictController {

    private final Scheduler scheduler;

    public ConflictController(Scheduler scheduler) {
        this.scheduler = scheduler;
    }

    @GetMapping
    public List<String> checkAllConflicts() {
        return scheduler.checkAllConflicts();
    }
}
