package com.ai.telehealth.controller;

import com.ai.telehealth.dto.ReminderSweepResult;
import com.ai.telehealth.service.ReminderService;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/reminders")
public class ReminderController {

    private final ReminderService reminderService;

    public ReminderController(ReminderService reminderService) {
        this.reminderService = reminderService;
    }

    @PostMapping("/sweep")
    public ReminderSweepResult sweep() {
        return reminderService.sweep();
    }
}
