package com.ai.telehealth.event;

import java.time.LocalDateTime;

/**
 * The appointment {@code previousAppointmentId} was replaced by {@code appointmentId}.
 */
public record AppointmentRescheduledEvent(Long previousAppointmentId, Long appointmentId, LocalDateTime previousTime) {
}
