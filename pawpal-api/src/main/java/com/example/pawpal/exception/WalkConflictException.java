package com.example.pawpal.exception;

import java.util.List;

public class WalkConflictException extends RuntimeException {

    private final String petId;
    private final List<String> reasons;

    public WalkConflictException(String petId, String message, List<String> reasons) {
        super(message);
        this.petId = petId;
        this.reasons = List.copyOf(reasons);
    }

    public String getPetId() { return petId; }
    public List<String> getReasons() { return reasons; }
}
