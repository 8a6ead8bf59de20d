package com.ai.telehealth.dto;

import jakarta.validation.constraints.NotNull;

import java.time.LocalDateTime;

public record RescheduleRequest(@NotNull LocalDateTime scheduledTime, @NotNull LocalDateTime endTime) {
}
