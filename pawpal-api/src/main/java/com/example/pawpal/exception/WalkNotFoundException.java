package com.example.pawpal.exception;

public class WalkNotFoundException extends RuntimeException {

    private final String walkId;

    public WalkNotFoundException(String walkId) {
        super("Walk not found: " + walkId);
        this.walkId = walkId;
    }

    public String getWalkId() { return walkId; }
}
