package com.example.pawpal.model;

import java.util.Collections;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

public class Pet {

    private final String petId;
    private final String name;
    private final String breed;
    private final int age;
    private String ownerId;
    private final List<String> taskIds = new CopyOnWriteArrayList<>();

    public Pet(String petId, String name, String breed, int age) {
        this.petId = petId;
        this.name = name;
        this.breed = breed;
        this.age = age;
    }

    public String getPetId() { return petId; }

    public String getName() { return name; }

    public String getBreed() { return breed; }

    public int getAge() { return age; }

    public String getOwnerId() { return ownerId; }
    public void setOwnerId(String ownerId) { this.ownerId = ownerId; }

    public List<String> getTaskIds() {
        return Collections.unmodifiableList(taskIds);
    }

    public void addTask(String taskId) {
        taskIds.add(taskId);
    }

    public String getDetails() {
        return "%s (%s, %d years old)".formatted(name, breed, age);
    }
}
