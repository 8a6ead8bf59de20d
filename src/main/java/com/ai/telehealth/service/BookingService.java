package com.ai.telehealth.service;

import com.ai.telehealth.dto.AvailabilityCheck;
import com.ai.telehealth.dto.BookingRequest;
import com.ai.telehealth.dto.FollowUpRequest;
import com.ai.telehealth.entity.Appointment;
import com.ai.telehealth.entity.Consultation;
import com.ai.telehealth.entity.ProviderAvailability;
import com.ai.telehealth.entity.ProviderTimeOff;
import com.ai.telehealth.event.AppointmentBookedEvent;
import com.ai.telehealth.exception.ConflictReason;
import com.ai.telehealth.exception.ResourceNotFoundException;
import com.ai.telehealth.exception.SlotConflictException;
import com.ai.telehealth.repository.AppointmentRepository;
import com.ai.telehealth.repository.ConsultationRepository;
import com.ai.telehealth.repository.ProviderAvailabilityRepository;
import com.ai.telehealth.repository.ProviderRepository;
import com.ai.telehealth.repository.ProviderTimeOffRepository;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Guards appointment creation against the provider's availability, time off and
 * existing bookings.
 */
@Service
@RequiredArgsConstructor
public class BookingService {

    private static final Logger log = LoggerFactory.getLogger(BookingService.class);

    private final ProviderRepository providerRepository;
    private final ProviderAvailabilityRepository availabilityRepository;
    private final ProviderTimeOffRepository timeOffRepository;
    private final AppointmentRepository appointmentRepository;
    private final ConsultationRepository consultationRepository;
    private final IdentityService identityService;
    private final ApplicationEventPublisher eventPublisher;

    @Transactional(readOnly = true)
    public AvailabilityCheck checkAvailable(Long providerId, LocalDateTime start, LocalDateTime end) {
        SlotCalculator.requireValidRange(start, end);
        return checkAvailable(providerId, start, end, null);
    }

    /**
     * Books a new appointment in SCHEDULED. Session kinds get their consultation row in
     * the same transaction; the remote meeting and the confirmation e-mail follow
     * after commit.
     */
    @Transactional
    public Appointment createAppointment(BookingRequest request) {
        Appointment appointment = reserve(request, null, null);
        if (appointment.getAppointmentType().requiresSession()) {
            consultationRepository.save(Consultation.builder().appointmentId(appointment.getId()).build());
        }
        eventPublisher.publishEvent(new AppointmentBookedEvent(appointment.getId()));
        return appointment;
    }

    /**
     * Books a new appointment for the same participants, linked to {@code parentAppointmentId}.
     */
    @Transactional
    public Appointment createFollowUp(Long parentAppointmentId, FollowUpRequest request) {
        Appointment parent = appointmentRepository.findById(parentAppointmentId)
                .orElseThrow(() -> new ResourceNotFoundException("Appointment", parentAppointmentId));

        BookingRequest booking = BookingRequest.builder()
                .patientId(parent.getPatientId())
                .providerId(parent.getProviderId())
                .scheduledTime(request.scheduledTime())
                .endTime(request.endTime())
                .appointmentType(request.appointmentType() != null ? request.appointmentType() : Appointment.Type.FOLLOW_UP)
                .reason(request.reason() != null ? request.reason() : parent.getReason())
                .sendReminder(parent.isSendReminder())
                .build();

        Appointment followUp = reserve(booking, parent.getId(), null);
        if (followUp.getAppointmentType().requiresSession()) {
            consultationRepository.save(Consultation.builder().appointmentId(followUp.getId()).build());
        }
        eventPublisher.publishEvent(new AppointmentBookedEvent(followUp.getId()));
        log.info("Booked follow-up {} for appointment {}", followUp.getId(), parent.getId());
        return followUp;
    }

    /**
     * Validates, locks the provider, re-checks availability and persists the appointment.
     * Runs inside the caller's transaction when there is one.
     *
     * @param ignoreAppointmentId appointment whose current slot is not treated as a conflict
     */
    @Transactional
    public Appointment reserve(BookingRequest request, Long parentAppointmentId, Long ignoreAppointmentId) {
        SlotCalculator.requireValidRange(request.scheduledTime(), request.endTime());
        identityService.requirePatient(request.patientId());
        providerRepository.findByIdForUpdate(request.providerId())
                .orElseThrow(() -> new ResourceNotFoundException("Provider", request.providerId()));

        AvailabilityCheck check = checkAvailable(request.providerId(), request.scheduledTime(), request.endTime(), ignoreAppointmentId);
        if (!check.available()) {
            log.warn("Booking rejected for provider {} {} - {}: {}", request.providerId(),
                    request.scheduledTime(), request.endTime(), check.reason());
            throw new SlotConflictException(check.reason());
        }

        Appointment appointment = Appointment.builder()
                .patientId(request.patientId())
                .providerId(request.providerId())
                .scheduledTime(request.scheduledTime())
                .endTime(request.endTime())
                .status(Appointment.Status.SCHEDULED)
                .appointmentType(request.typeOrDefault())
                .reason(request.reason())
                .parentAppointmentId(parentAppointmentId)
                .recurring(request.recurring())
                .recurrencePattern(request.recurrencePattern())
                .recurrenceEndDate(request.recurrenceEndDate())
                .sendReminder(request.sendReminder() == null || request.sendReminder())
                .build();
        appointment = appointmentRepository.save(appointment);

        log.info("Booked appointment {}: patient={} provider={} {} - {}", appointment.getId(),
                request.patientId(), request.providerId(), request.scheduledTime(), request.endTime());
        return appointment;
    }

    private AvailabilityCheck checkAvailable(Long providerId, LocalDateTime start, LocalDateTime end, Long ignoreAppointmentId) {
        List<ProviderAvailability> rows = availabilityRepository
                .findByProviderIdAndDayOfWeekAndEnabledTrueOrderByStartTimeAsc(providerId, SlotCalculator.dayIndex(start.toLocalDate()));
        List<ProviderTimeOff> timeOff = timeOffRepository.findTouching(providerId, start, end);
        List<Appointment> existing = appointmentRepository.findOverlapping(providerId, Appointment.Status.ACTIVE, start, end);

        Optional<ConflictReason> conflict = SlotCalculator.findConflict(start, end, rows, timeOff, existing, ignoreAppointmentId);
        return conflict.map(AvailabilityCheck::rejected).orElseGet(AvailabilityCheck::ok);
    }
}
