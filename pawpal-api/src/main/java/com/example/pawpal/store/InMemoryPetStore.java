package com.example.pawpal.store;

import com.example.pawpal.model.Pet;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

@Component
public class InMemoryPetStore {

    private final ConcurrentHashMap<String, Pet> pets = new ConcurrentHashMap<>();
    private final AtomicInteger idSequence = new AtomicInteger(1);

    public String nextId() {
        String id;
        do {
            id = "PET-%03d".formatted(idSequence.getAndIncrement());
        } while (pets.containsKey(id));
        return id;
    }

    public void save(Pet pet) {
        pets.put(pet.getPetId(), pet);
    }

    public Optional<Pet> findById(String petId) {
        return petId == null ? Optional.empty() : Optional.ofNullable(pets.get(petId));
    }

    /** Resolves ids in the given order, skipping unknown ones. */
    public List<Pet> findAllById(List<String> petIds) {
        return petIds.stream()
                .map(pets::get)
                .filter(Objects::nonNull)
                .toList();
    }
}
