package com.example.pawpal.model;

public enum WalkStatus {
    SCHEDULED,
    CANCELLED,
    COMPLETED
}
