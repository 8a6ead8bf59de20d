package com.ai.telehealth.service;

import com.ai.telehealth.dto.JoinInfo;
import com.ai.telehealth.dto.MeetingDetails;
import com.ai.telehealth.dto.MeetingRequest;
import com.ai.telehealth.dto.ParticipantProfile;
import com.ai.telehealth.entity.Appointment;
import com.ai.telehealth.entity.Consultation;
import com.ai.telehealth.exception.ExternalProviderException;
import com.ai.telehealth.exception.InvalidTransitionException;
import com.ai.telehealth.exception.ParticipantAccessException;
import com.ai.telehealth.exception.ResourceNotFoundException;
import com.ai.telehealth.repository.AppointmentRepository;
import com.ai.telehealth.repository.ConsultationRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Objects;

/**
 * Session companion of an appointment: start/end bookkeeping and the binding to an
 * external meeting. Meeting provider failures are logged and never undo local state.
 */
@Service
public class ConsultationService {

    private static final Logger log = LoggerFactory.getLogger(ConsultationService.class);

    private final ConsultationRepository consultationRepository;
    private final AppointmentRepository appointmentRepository;
    private final MeetingProvider meetingProvider;
    private final IdentityService identityService;
    private final Clock clock;
    private final boolean accessCodeRequiredForPatients;

    public ConsultationService(ConsultationRepository consultationRepository,
                               AppointmentRepository appointmentRepository,
                               MeetingProvider meetingProvider,
                               IdentityService identityService,
                               Clock clock,
                               @Value("${telehealth.access-code.required-for-patients:true}") boolean accessCodeRequiredForPatients) {
        this.consultationRepository = consultationRepository;
        this.appointmentRepository = appointmentRepository;
        this.meetingProvider = meetingProvider;
        this.identityService = identityService;
        this.clock = clock;
        this.accessCodeRequiredForPatients = accessCodeRequiredForPatients;
    }

    @Transactional(readOnly = true)
    public Consultation get(Long consultationId) {
        return consultationRepository.findById(consultationId)
                .orElseThrow(() -> new ResourceNotFoundException("Consultation", consultationId));
    }

    /**
     * Creates the consultation for an appointment. The row is committed before the
     * meeting provider is called, so a slow or failing provider leaves a consultation
     * without meeting fields rather than no consultation.
     */
    public Consultation create(Long appointmentId) {
        Appointment appointment = appointmentRepository.findById(appointmentId)
                .orElseThrow(() -> new ResourceNotFoundException("Appointment", appointmentId));
        if (consultationRepository.existsByAppointmentId(appointmentId)) {
            throw new InvalidTransitionException("Appointment " + appointmentId + " already has a consultation.");
        }
        Consultation consultation = consultationRepository.save(
                Consultation.builder().appointmentId(appointmentId).build());
        log.info("Created consultation {} for appointment {}", consultation.getId(), appointmentId);

        if (appointment.getAppointmentType().requiresSession()) {
            consultation = bindMeeting(consultation, appointment);
        }
        return consultation;
    }

    public Consultation bindMeeting(Long consultationId) {
        Consultation consultation = get(consultationId);
        Appointment appointment = appointmentRepository.findById(consultation.getAppointmentId())
                .orElseThrow(() -> new ResourceNotFoundException("Appointment", consultation.getAppointmentId()));
        return bindMeeting(consultation, appointment);
    }

    /**
     * Requests a meeting for the appointment's time range and stores its identifiers.
     * Already bound consultations are returned unchanged.
     */
    public Consultation bindMeeting(Consultation consultation, Appointment appointment) {
        if (consultation.hasMeeting()) {
            return consultation;
        }
        ParticipantProfile provider = identityService.provider(appointment.getProviderId());
        ParticipantProfile patient = identityService.patient(appointment.getPatientId());
        String topic = "Medical Consultation - " + provider.fullName() + " and " + patient.fullName();

        try {
            MeetingDetails meeting = meetingProvider.createMeeting(new MeetingRequest(
                    topic, appointment.getScheduledTime(), (int) appointment.durationMinutes(), provider.email()));
            consultation.setMeetingId(meeting.id());
            consultation.setMeetingPassword(meeting.password());
            consultation.setJoinUrl(meeting.joinUrl());
            consultation.setStartUrl(meeting.startUrl());
            return consultationRepository.save(consultation);
        } catch (ExternalProviderException e) {
            log.error("Failed to create meeting for consultation {}: {}", consultation.getId(), e.getMessage());
            return consultation;
        }
    }

    /**
     * Moves the remote meeting to the current time range of the consultation's appointment.
     */
    @Transactional(readOnly = true)
    public void propagateReschedule(Long appointmentId) {
        consultationRepository.findByAppointmentId(appointmentId)
                .filter(Consultation::hasMeeting)
                .ifPresent(consultation -> {
                    Appointment appointment = appointmentRepository.findById(appointmentId)
                            .orElseThrow(() -> new ResourceNotFoundException("Appointment", appointmentId));
                    try {
                        meetingProvider.updateMeeting(consultation.getMeetingId(),
                                appointment.getScheduledTime(), (int) appointment.durationMinutes());
                    } catch (ExternalProviderException e) {
                        log.error("Failed to update meeting {} for appointment {}: {}",
                                consultation.getMeetingId(), appointmentId, e.getMessage());
                    }
                });
    }

    @Transactional
    public Consultation start(Long consultationId) {
        Consultation consultation = lock(consultationId);
        if (consultation.isStarted()) {
            throw new InvalidTransitionException("Consultation has already started.");
        }
        Appointment appointment = appointmentFor(consultation);
        if (!appointment.getStatus().isPending()) {
            throw new InvalidTransitionException("Cannot start a consultation for an appointment in status "
                    + appointment.getStatus() + ".");
        }

        consultation.setStartTime(LocalDateTime.now(clock));
        appointment.setStatus(Appointment.Status.IN_PROGRESS);
        appointmentRepository.save(appointment);
        log.info("Consultation {} started", consultationId);
        return consultationRepository.save(consultation);
    }

    @Transactional
    public Consultation end(Long consultationId) {
        Consultation consultation = lock(consultationId);
        if (!consultation.isStarted()) {
            throw new InvalidTransitionException("Consultation has not been started.");
        }
        if (consultation.isEnded()) {
            throw new InvalidTransitionException("Consultation has already ended.");
        }
        Appointment appointment = appointmentFor(consultation);

        consultation.setEndTime(LocalDateTime.now(clock));
        consultation.recomputeDuration();
        appointment.setStatus(Appointment.Status.COMPLETED);
        appointmentRepository.save(appointment);
        log.info("Consultation {} ended after {} minutes", consultationId, consultation.getDuration().toMinutes());
        return consultationRepository.save(consultation);
    }

    @Transactional
    public Consultation updateNotes(Long consultationId, String notes) {
        Consultation consultation = lock(consultationId);
        consultation.setNotes(notes);
        return consultationRepository.save(consultation);
    }

    /**
     * Releases the remote meeting, then removes the local row even if the release failed.
     */
    @Transactional
    public void delete(Long consultationId) {
        Consultation consultation = lock(consultationId);
        if (consultation.hasMeeting()) {
            try {
                meetingProvider.deleteMeeting(consultation.getMeetingId());
            } catch (ExternalProviderException e) {
                log.error("Failed to delete meeting {} of consultation {}: {}",
                        consultation.getMeetingId(), consultationId, e.getMessage());
            }
        }
        consultationRepository.delete(consultation);
        log.info("Deleted consultation {}", consultationId);
    }

    /**
     * Join details for a participant of the consultation. The caller's id is matched only
     * against the field of the role it claims; only the provider receives the host start URL.
     */
    @Transactional(readOnly = true)
    public JoinInfo joinInfo(Long consultationId, ParticipantRole role, Long participantId) {
        Consultation consultation = get(consultationId);
        requireParticipant(appointmentFor(consultation), role, participantId);
        return joinInfo(consultation, role);
    }

    public JoinInfo joinInfo(Consultation consultation, ParticipantRole role) {
        if (!consultation.hasMeeting()) {
            throw new InvalidTransitionException("This consultation does not have a meeting.");
        }
        boolean provider = role == ParticipantRole.PROVIDER;
        return new JoinInfo(
                consultation.getMeetingId(),
                consultation.getMeetingPassword(),
                consultation.getJoinUrl(),
                provider ? consultation.getStartUrl() : null,
                !provider && accessCodeRequiredForPatients);
    }

    @Transactional(readOnly = true)
    public void requireParticipant(Long consultationId, ParticipantRole role, Long participantId) {
        requireParticipant(appointmentFor(get(consultationId)), role, participantId);
    }

    public void requireParticipant(Appointment appointment, ParticipantRole role, Long participantId) {
        Long expected = role == ParticipantRole.PROVIDER ? appointment.getProviderId() : appointment.getPatientId();
        if (role == null || participantId == null || !Objects.equals(expected, participantId)) {
            throw new ParticipantAccessException("You are not authorized to join this consultation.");
        }
    }

    Appointment appointmentFor(Consultation consultation) {
        return appointmentRepository.findById(consultation.getAppointmentId())
                .orElseThrow(() -> new ResourceNotFoundException("Appointment", consultation.getAppointmentId()));
    }

    private Consultation lock(Long consultationId) {
        return consultationRepository.findByIdForUpdate(consultationId)
                .orElseThrow(() -> new ResourceNotFoundException("Consultation", consultationId));
    }
}
