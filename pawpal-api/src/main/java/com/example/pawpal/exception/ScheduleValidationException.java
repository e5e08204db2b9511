package com.example.pawpal.exception;

/**
 * Rejected scheduler input: missing fields, non-positive durations, pets the
 * owner does not have, duplicate ids or invalid state transitions.
 */
public class ScheduleValidationException extends RuntimeException {

    private final String errorCode;

    public ScheduleValidationException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public String getErrorCode() { return errorCode; }
}
