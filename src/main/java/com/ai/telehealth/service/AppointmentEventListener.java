package com.ai.telehealth.service;

import com.ai.telehealth.dto.ParticipantProfile;
import com.ai.telehealth.entity.Appointment;
import com.ai.telehealth.event.AppointmentBookedEvent;
import com.ai.telehealth.event.AppointmentCancelledEvent;
import com.ai.telehealth.event.AppointmentRescheduledEvent;
import com.ai.telehealth.exception.SchedulingException;
import com.ai.telehealth.repository.AppointmentRepository;
import com.ai.telehealth.repository.ConsultationRepository;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Side effects of appointment writes that reach outside the database. They run only
 * once the write has committed, each in its own transaction, and failures are logged.
 */
@Component
@RequiredArgsConstructor
public class AppointmentEventListener {

    private static final Logger log = LoggerFactory.getLogger(AppointmentEventListener.class);

    private final AppointmentRepository appointmentRepository;
    private final ConsultationRepository consultationRepository;
    private final ConsultationService consultationService;
    private final IdentityService identityService;
    private final EmailService emailService;

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void onBooked(AppointmentBookedEvent event) {
        try {
            Appointment appointment = appointmentRepository.findById(event.appointmentId()).orElse(null);
            if (appointment == null) {
                log.warn("Booked appointment {} vanished before post-commit handling", event.appointmentId());
                return;
            }
            consultationRepository.findByAppointmentId(appointment.getId())
                    .ifPresent(consultation -> consultationService.bindMeeting(consultation, appointment));

            ParticipantProfile patient = identityService.patient(appointment.getPatientId());
            ParticipantProfile provider = identityService.provider(appointment.getProviderId());
            emailService.sendAppointmentConfirmation(appointment, patient, provider);
        } catch (SchedulingException e) {
            log.error("Post-booking handling failed for appointment {}: {}", event.appointmentId(), e.getMessage());
        }
    }

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void onCancelled(AppointmentCancelledEvent event) {
        try {
            appointmentRepository.findById(event.appointmentId()).ifPresent(appointment -> {
                ParticipantProfile patient = identityService.patient(appointment.getPatientId());
                ParticipantProfile provider = identityService.provider(appointment.getProviderId());
                emailService.sendAppointmentCancellation(appointment, patient, provider);
            });
        } catch (SchedulingException e) {
            log.error("Cancellation notice failed for appointment {}: {}", event.appointmentId(), e.getMessage());
        }
    }

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void onRescheduled(AppointmentRescheduledEvent event) {
        try {
            consultationService.propagateReschedule(event.appointmentId());
            appointmentRepository.findById(event.appointmentId()).ifPresent(appointment -> {
                ParticipantProfile patient = identityService.patient(appointment.getPatientId());
                ParticipantProfile provider = identityService.provider(appointment.getProviderId());
                emailService.sendAppointmentRescheduled(appointment, patient, provider, event.previousTime());
            });
        } catch (SchedulingException e) {
            log.error("Reschedule handling failed for appointment {}: {}", event.appointmentId(), e.getMessage());
        }
    }
}
