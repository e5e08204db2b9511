package com.example.pawpal.model;

import java.util.Collections;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * The single owner of a schedule. Pets, tasks and walks are referenced by id;
 * the entities themselves live in the stores.
 */
public class User {

    private final String userId;
    private final String name;
    private final String email;
    private final List<String> petIds = new CopyOnWriteArrayList<>();
    private final List<String> taskIds = new CopyOnWriteArrayList<>();
    private final List<String> walkIds = new CopyOnWriteArrayList<>();

    public User(String userId, String name, String email) {
        this.userId = userId;
        this.name = name;
        this.email = email;
    }

    public String getUserId() { return userId; }

    public String getName() { return name; }

    public String getEmail() { return email; }

    public void addPet(Pet pet) {
        pet.setOwnerId(userId);
        if (!petIds.contains(pet.getPetId())) {
            petIds.add(pet.getPetId());
        }
    }

    public boolean ownsPet(String petId) {
        return petIds.contains(petId);
    }

    public void addTask(String taskId) {
        taskIds.add(taskId);
    }

    public void addWalk(String walkId) {
        walkIds.add(walkId);
    }

    public List<String> getPetIds() {
        return Collections.unmodifiableList(petIds);
    }

    public List<String> getTaskIds() {
        return Collections.unmodifiableList(taskIds);
    }

    public List<String> getWalkIds() {
        return Collections.unmodifiableList(walkIds);
    }
}
