package com.example.pawpal.model;

public record CompleteTaskResponse(TaskResponse completed, TaskResponse nextOccurrence) {
}
