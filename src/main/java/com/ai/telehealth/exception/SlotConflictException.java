package com.ai.telehealth.exception;

public class SlotConflictException extends SchedulingException {

    private final ConflictReason reason;

    public SlotConflictException(ConflictReason reason) {
        super(reason.getMessage());
        this.reason = reason;
    }

    public ConflictReason getReason() {
        return reason;
    }
}
