package com.ai.telehealth.service;

import com.ai.telehealth.dto.BookingRequest;
import com.ai.telehealth.entity.Appointment;
import com.ai.telehealth.event.AppointmentCancelledEvent;
import com.ai.telehealth.event.AppointmentRescheduledEvent;
import com.ai.telehealth.exception.InvalidTransitionException;
import com.ai.telehealth.exception.ResourceNotFoundException;
import com.ai.telehealth.repository.AppointmentRepository;
import com.ai.telehealth.repository.ConsultationRepository;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Appointment status machine:
 * SCHEDULED -> CONFIRMED -> IN_PROGRESS -> COMPLETED, SCHEDULED|CONFIRMED -> CANCELLED,
 * SCHEDULED|CONFIRMED -> RESCHEDULED, any -> NO_SHOW.
 * IN_PROGRESS and COMPLETED are driven by the consultation, see {@link ConsultationService}.
 */
@Service
@RequiredArgsConstructor
public class AppointmentService {

    private static final Logger log = LoggerFactory.getLogger(AppointmentService.class);

    private final AppointmentRepository appointmentRepository;
    private final ConsultationRepository consultationRepository;
    private final BookingService bookingService;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    @Transactional(readOnly = true)
    public Appointment get(Long appointmentId) {
        return appointmentRepository.findById(appointmentId)
                .orElseThrow(() -> new ResourceNotFoundException("Appointment", appointmentId));
    }

    @Transactional
    public Appointment confirm(Long appointmentId) {
        Appointment appt = lock(appointmentId);
        if (appt.getStatus() != Appointment.Status.SCHEDULED) {
            throw new InvalidTransitionException("Only a scheduled appointment can be confirmed (current status: " + appt.getStatus() + ").");
        }
        appt.setStatus(Appointment.Status.CONFIRMED);
        log.info("Confirmed appointment {}", appointmentId);
        return appointmentRepository.save(appt);
    }

    @Transactional
    public Appointment cancel(Long appointmentId) {
        Appointment appt = lock(appointmentId);
        if (!appt.getStatus().isPending()) {
            throw new InvalidTransitionException("Cannot cancel an appointment in status " + appt.getStatus() + ".");
        }
        appt.setStatus(Appointment.Status.CANCELLED);
        appt = appointmentRepository.save(appt);

        eventPublisher.publishEvent(new AppointmentCancelledEvent(appt.getId()));
        log.info("Cancelled appointment {} for patient {}", appointmentId, appt.getPatientId());
        return appt;
    }

    /**
     * Replaces the appointment with a new one at the requested range. The original keeps
     * its range and becomes RESCHEDULED; the replacement points back at it through
     * {@code parentAppointmentId} and takes over the consultation, if any.
     */
    @Transactional
    public Appointment reschedule(Long appointmentId, LocalDateTime newStart, LocalDateTime newEnd) {
        SlotCalculator.requireValidRange(newStart, newEnd);
        Appointment original = lock(appointmentId);
        if (!original.getStatus().isPending()) {
            throw new InvalidTransitionException("Cannot reschedule an appointment in status " + original.getStatus() + ".");
        }

        BookingRequest request = BookingRequest.builder()
                .patientId(original.getPatientId())
                .providerId(original.getProviderId())
                .scheduledTime(newStart)
                .endTime(newEnd)
                .appointmentType(original.getAppointmentType())
                .reason(original.getReason())
                .sendReminder(original.isSendReminder())
                .recurring(original.isRecurring())
                .recurrencePattern(original.getRecurrencePattern())
                .recurrenceEndDate(original.getRecurrenceEndDate())
                .build();
        Appointment replacement = bookingService.reserve(request, original.getId(), original.getId());

        original.setStatus(Appointment.Status.RESCHEDULED);
        appointmentRepository.save(original);

        consultationRepository.findByAppointmentId(original.getId()).ifPresent(consultation -> {
            consultation.setAppointmentId(replacement.getId());
            consultationRepository.save(consultation);
        });

        eventPublisher.publishEvent(new AppointmentRescheduledEvent(original.getId(), replacement.getId(), original.getScheduledTime()));
        log.info("Rescheduled appointment {} to {} ({} - {})", original.getId(), replacement.getId(), newStart, newEnd);
        return replacement;
    }

    @Transactional
    public Appointment markNoShow(Long appointmentId) {
        Appointment appt = lock(appointmentId);
        appt.setStatus(Appointment.Status.NO_SHOW);
        log.info("Marked appointment {} as no-show", appointmentId);
        return appointmentRepository.save(appt);
    }

    /**
     * Future SCHEDULED or CONFIRMED appointments of a patient or provider, soonest first.
     */
    @Transactional(readOnly = true)
    public List<Appointment> upcoming(ParticipantRole role, Long participantId) {
        LocalDateTime now = LocalDateTime.now(clock);
        switch (role) {
            case PATIENT:
                return appointmentRepository.findByPatientIdAndScheduledTimeAfterAndStatusInOrderByScheduledTimeAsc(
                        participantId, now, Appointment.Status.PENDING);
            case PROVIDER:
                return appointmentRepository.findByProviderIdAndScheduledTimeAfterAndStatusInOrderByScheduledTimeAsc(
                        participantId, now, Appointment.Status.PENDING);
            default:
                throw new IllegalArgumentException("Unknown role " + role);
        }
    }

    private Appointment lock(Long appointmentId) {
        return appointmentRepository.findByIdForUpdate(appointmentId)
                .orElseThrow(() -> new ResourceNotFoundException("Appointment", appointmentId));
    }
}
