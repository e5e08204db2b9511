package com.example.pawpal.service;

import com.example.pawpal.exception.PetNotFoundException;
import com.example.pawpal.model.CreatePetRequest;
import com.example.pawpal.model.Pet;
import com.example.pawpal.store.InMemoryPetStore;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
public class PetService {

    private final InMemoryPetStore petStore;
    private final Scheduler scheduler;

    public PetService(InMemoryPetStore petStore, Scheduler scheduler) {
        this.petStore = petStore;
        this.scheduler = scheduler;
    }

    public Pet getPet(String petId) {
        return scheduler.getPet(petId)
                .orElseThrow(() -> new PetNotFoundException(petId));
    }

    public List<Pet> listPets() {
        return scheduler.getPets();
    }

    public Pet addPet(CreatePetRequest request) {
        Pet pet = new Pet(petStore.nextId(), request.name().trim(), request.breed().trim(), request.age());
        return scheduler.addPet(pet);
    }
}
