package com.ai.telehealth.dto;

import com.ai.telehealth.exception.ConflictReason;

public record AvailabilityCheck(boolean available, ConflictReason reason) {

    public static AvailabilityCheck ok() {
        return new AvailabilityCheck(true, null);
    }

    public static AvailabilityCheck rejected(ConflictReason reason) {
        return new AvailabilityCheck(false, reason);
    }
}
