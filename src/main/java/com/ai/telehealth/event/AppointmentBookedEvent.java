package com.ai.telehealth.event;

public record AppointmentBookedEvent(Long appointmentId) {
}
