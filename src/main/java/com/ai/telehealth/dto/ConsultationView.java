package com.ai.telehealth.dto;

import com.ai.telehealth.entity.Consultation;

import java.time.LocalDateTime;

/**
 * Consultation as returned to callers: no access code and no host start URL.
 */
public record ConsultationView(
        Long id,
        Long appointmentId,
        LocalDateTime startTime,
        LocalDateTime endTime,
        Long durationMinutes,
        String meetingId,
        String joinUrl,
        String notes) {

    public static ConsultationView of(Consultation c) {
        return new ConsultationView(
                c.getId(),
                c.getAppointmentId(),
                c.getStartTime(),
                c.getEndTime(),
                c.getDuration() != null ? c.getDuration().toMinutes() : null,
                c.getMeetingId(),
                c.getJoinUrl(),
                c.getNotes());
    }
}
