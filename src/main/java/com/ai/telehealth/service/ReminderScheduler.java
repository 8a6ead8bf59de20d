package com.ai.telehealth.service;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(name = "telehealth.reminders.enabled", havingValue = "true", matchIfMissing = true)
public class ReminderScheduler {

    private final ReminderService reminderService;

    public ReminderScheduler(ReminderService reminderService) {
        this.reminderService = reminderService;
    }

    @Scheduled(fixedDelayString = "${telehealth.reminders.interval:PT15M}",
            initialDelayString = "${telehealth.reminders.initial-delay:PT1M}")
    public void sendDueReminders() {
        reminderService.sweep();
    }
}
