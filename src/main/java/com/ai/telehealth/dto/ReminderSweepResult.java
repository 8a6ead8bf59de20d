package com.ai.telehealth.dto;

public record ReminderSweepResult(int pending, int sent) {
}
