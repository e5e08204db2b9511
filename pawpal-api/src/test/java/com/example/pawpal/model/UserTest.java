package com.example.pawpal.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class UserTest {

    @Test
    void addPet_setsOwnerAndRecordsPetOnce() {
        User user = new User("user_001", "Malik", "malik@pawpal.com");
        Pet buddy = new Pet("PET-001", "Buddy", "Golden Retriever", 3);

        user.addPet(buddy);
        user.addPet(buddy);

        assertEquals("user_001", buddy.getOwnerId());
        assertEquals(1, user.getPetIds().size());
        assertTrue(user.ownsPet("PET-001"));
        assertFalse(user.ownsPet("PET-002"));
    }

    @Test
    void addTaskToPet_increasesTaskCount() {
        Pet buddy = new Pet("PET-001", "Buddy", "Golden Retriever", 3);
        int initialCount = buddy.getTaskIds().size();

        buddy.addTask("TASK-001");

        assertEquals(initialCount + 1, buddy.getTaskIds().size());
        assertTrue(buddy.getTaskIds().contains("TASK-001"));
    }

    @Test
    void petDetails() {
        Pet buddy = new Pet("PET-001", "Buddy", "Golden Retriever", 3);

        assertEquals("Buddy (Golden Retriever, 3 years old)", buddy.getDetails());
    }
}
