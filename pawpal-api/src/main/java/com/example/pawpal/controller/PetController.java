package com.example.pawpal.controller;

import com.example.pawpal.model.CreatePetRequest;
import com.example.pawpal.model.Pet;
import com.example.pawpal.model.WalkResponse;
import com.example.pawpal.service.PetService;
import com.example.pawpal.service.Scheduler;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/pets")
public class PetController {

    private final PetService petService;
    private final Scheduler scheduler;

    public PetController(PetService petService, Scheduler scheduler) {
        this.petService = petService;
        this.scheduler = scheduler;
    }

    @GetMapping
    public List<Pet> listPets() {
        return petService.listPets();
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public Pet addPet(@Valid @RequestBody CreatePetRequest request) {
        return petService.addPet(request);
    }

    @GetMapping("/{id}")
    public Pet getPet(@PathVariable String id) {
        return petService.getPet(id);
    }

    @GetMapping("/{id}/walks")
    public List<WalkResponse> getScheduledWalks(@PathVariable String id) {
        Pet pet = petService.getPet(id);
        return scheduler.getScheduledWalks(pet).stream()
                .map(WalkResponse::from)
                .toList();
    }
}
