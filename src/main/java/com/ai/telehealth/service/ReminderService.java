package com.ai.telehealth.service;

import com.ai.telehealth.dto.ParticipantProfile;
import com.ai.telehealth.dto.ReminderSweepResult;
import com.ai.telehealth.entity.Appointment;
import com.ai.telehealth.exception.ResourceNotFoundException;
import com.ai.telehealth.repository.AppointmentRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Appointment reminders. {@code reminderSent} gates delivery, giving at-least-once
 * semantics: a failed send leaves the flag unset and the next sweep retries.
 */
@Service
public class ReminderService {

    private static final Logger log = LoggerFactory.getLogger(ReminderService.class);

    private final AppointmentRepository appointmentRepository;
    private final IdentityService identityService;
    private final EmailService emailService;
    private final Clock clock;
    private final Duration leadTime;

    public ReminderService(AppointmentRepository appointmentRepository,
                           IdentityService identityService,
                           EmailService emailService,
                           Clock clock,
                           @Value("${telehealth.reminders.lead-time:24h}") Duration leadTime) {
        this.appointmentRepository = appointmentRepository;
        this.identityService = identityService;
        this.emailService = emailService;
        this.clock = clock;
        this.leadTime = leadTime;
    }

    /**
     * Appointments starting within [now, now + leadTime] that still need a reminder.
     */
    @Transactional(readOnly = true)
    public List<Appointment> dueForReminder(LocalDateTime now, Duration leadTime) {
        return appointmentRepository
                .findBySendReminderTrueAndReminderSentFalseAndStatusInAndScheduledTimeBetweenOrderByScheduledTimeAsc(
                        Appointment.Status.PENDING, now, now.plus(leadTime));
    }

    public boolean sendReminder(Appointment appointment) {
        ParticipantProfile patient;
        ParticipantProfile provider;
        try {
            patient = identityService.patient(appointment.getPatientId());
            provider = identityService.provider(appointment.getProviderId());
        } catch (ResourceNotFoundException e) {
            log.error("Cannot send reminder for appointment {}: {}", appointment.getId(), e.getMessage());
            return false;
        }
        if (!patient.hasEmail()) {
            log.warn("Cannot send reminder: patient {} has no email", patient.id());
            return false;
        }

        if (!emailService.sendAppointmentReminder(appointment, patient, provider)) {
            return false;
        }
        appointment.setReminderSent(true);
        try {
            appointmentRepository.save(appointment);
        } catch (OptimisticLockingFailureException e) {
            // changed since the sweep read it; the next sweep re-reads the row
            appointment.setReminderSent(false);
            log.warn("Reminder for appointment {} was sent but not recorded: {}", appointment.getId(), e.getMessage());
            return false;
        }
        return true;
    }

    public ReminderSweepResult sweep() {
        List<Appointment> due = dueForReminder(LocalDateTime.now(clock), leadTime);
        int sent = 0;
        for (Appointment appointment : due) {
            if (sendReminder(appointment)) {
                sent++;
            }
        }
        log.info("Sent {} appointment reminders out of {} pending", sent, due.size());
        return new ReminderSweepResult(due.size(), sent);
    }
}
