package com.ai.telehealth.dto;

import com.ai.telehealth.entity.Appointment;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;

import java.time.LocalDate;
import java.time.LocalDateTime;

@Builder(toBuilder = true)
public record BookingRequest(
        @NotNull Long patientId,
        @NotNull Long providerId,
        @NotNull LocalDateTime scheduledTime,
        @NotNull LocalDateTime endTime,
        Appointment.Type appointmentType,
        String reason,
        Boolean sendReminder,
        boolean recurring,
        String recurrencePattern,
        LocalDate recurrenceEndDate) {

    public Appointment.Type typeOrDefault() {
        return appointmentType != null ? appointmentType : Appointment.Type.VIDEO_CONSULTATION;
    }
}
