package com.ai.telehealth.dto;

import jakarta.validation.constraints.NotNull;

import java.time.LocalDateTime;

public record TimeOffRequest(@NotNull LocalDateTime startTime, @NotNull LocalDateTime endTime, String reason) {
}
