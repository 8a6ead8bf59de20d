package com.ai.telehealth.dto;

import java.time.LocalDateTime;

public record MeetingRequest(String topic, LocalDateTime startTime, int durationMinutes, String hostEmail) {
}
