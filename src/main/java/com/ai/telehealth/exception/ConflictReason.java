package com.ai.telehealth.exception;

public enum ConflictReason {
    OUTSIDE_AVAILABILITY("Provider is not available during this time slot."),
    TIME_OFF("Provider is on time off during this time slot."),
    OVERLAPPING_APPOINTMENT("Provider already has an appointment during this time slot.");

    private final String message;

    ConflictReason(String message) {
        this.message = message;
    }

    public String getMessage() {
        return message;
    }
}
