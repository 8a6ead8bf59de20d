package com.ai.telehealth.dto;

import com.ai.telehealth.entity.Appointment;
import jakarta.validation.constraints.NotNull;

import java.time.LocalDateTime;

public record FollowUpRequest(
        @NotNull LocalDateTime scheduledTime,
        @NotNull LocalDateTime endTime,
        Appointment.Type appointmentType,
        String reason) {
}
