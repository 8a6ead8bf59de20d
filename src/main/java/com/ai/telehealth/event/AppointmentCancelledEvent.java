package com.ai.telehealth.event;

public record AppointmentCancelledEvent(Long appointmentId) {
}
