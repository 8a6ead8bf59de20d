package com.ai.telehealth.dto;

import jakarta.validation.constraints.NotNull;

public record ConsultationRequest(@NotNull Long appointmentId) {
}
