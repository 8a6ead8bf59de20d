package com.ai.telehealth.service;

import com.ai.telehealth.dto.ParticipantProfile;
import com.ai.telehealth.entity.Appointment;
import com.ai.telehealth.entity.Consultation;
import com.ai.telehealth.exception.ResourceNotFoundException;
import com.ai.telehealth.repository.AppointmentRepository;
import com.ai.telehealth.repository.ConsultationRepository;
import org.apache.commons.lang3.RandomStringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;

/**
 * Single-use numeric access codes, e-mailed to the patient, as an alternative
 * credential for joining a consultation.
 */
@Service
public class ConsultationAuthService {

    private static final Logger log = LoggerFactory.getLogger(ConsultationAuthService.class);

    static final int ACCESS_CODE_LENGTH = 6;
    private static final char[] DIGITS = "0123456789".toCharArray();

    private final ConsultationRepository consultationRepository;
    private final AppointmentRepository appointmentRepository;
    private final IdentityService identityService;
    private final EmailService emailService;
    private final Clock clock;
    private final Duration accessCodeTtl;
    private final SecureRandom random = new SecureRandom();

    public ConsultationAuthService(ConsultationRepository consultationRepository,
                                   AppointmentRepository appointmentRepository,
                                   IdentityService identityService,
                                   EmailService emailService,
                                   Clock clock,
                                   @Value("${telehealth.access-code.ttl:15m}") Duration accessCodeTtl) {
        this.consultationRepository = consultationRepository;
        this.appointmentRepository = appointmentRepository;
        this.identityService = identityService;
        this.emailService = emailService;
        this.clock = clock;
        this.accessCodeTtl = accessCodeTtl;
    }

    public Duration getAccessCodeTtl() {
        return accessCodeTtl;
    }

    /**
     * Generates a fresh access code, stores it on the consultation and e-mails it to the
     * patient. The code is kept when delivery fails.
     *
     * @return whether the e-mail went out
     */
    public boolean requestAccessCode(Long consultationId) {
        Consultation consultation = consultationRepository.findById(consultationId)
                .orElseThrow(() -> new ResourceNotFoundException("Consultation", consultationId));
        Appointment appointment = appointmentRepository.findById(consultation.getAppointmentId())
                .orElseThrow(() -> new ResourceNotFoundException("Appointment", consultation.getAppointmentId()));
        ParticipantProfile patient = identityService.patient(appointment.getPatientId());
        ParticipantProfile provider = identityService.provider(appointment.getProviderId());

        if (!patient.hasEmail()) {
            log.warn("Cannot send access code for consultation {}: patient {} has no email", consultationId, patient.id());
            return false;
        }

        String code = generateAccessCode();
        consultation.setAccessCode(code);
        consultation.setAccessCodeExpiresAt(LocalDateTime.now(clock).plus(accessCodeTtl));
        consultationRepository.save(consultation);

        boolean sent = emailService.sendAccessCode(appointment, patient, provider, code, accessCodeTtl);
        if (!sent) {
            log.warn("Access code for consultation {} stored but not delivered", consultationId);
        }
        return sent;
    }

    /**
     * Accepts the code once, before it expires. A failed attempt leaves the stored code as it was.
     */
    @Transactional
    public boolean verifyAccessCode(Long consultationId, String code) {
        Consultation consultation = consultationRepository.findByIdForUpdate(consultationId)
                .orElseThrow(() -> new ResourceNotFoundException("Consultation", consultationId));
        LocalDateTime now = LocalDateTime.now(clock);

        if (code == null || !hasValidCode(consultation, now) || !matches(consultation.getAccessCode(), code)) {
            log.info("Access code rejected for consultation {}", consultationId);
            return false;
        }

        consultation.clearAccessCode();
        consultationRepository.save(consultation);
        log.info("Access code verified for consultation {}", consultationId);
        return true;
    }

    String generateAccessCode() {
        return RandomStringUtils.random(ACCESS_CODE_LENGTH, 0, DIGITS.length, false, false, DIGITS, random);
    }

    private static boolean hasValidCode(Consultation consultation, LocalDateTime now) {
        return consultation.getAccessCode() != null
                && consultation.getAccessCodeExpiresAt() != null
                && now.isBefore(consultation.getAccessCodeExpiresAt());
    }

    private static boolean matches(String stored, String submitted) {
        return MessageDigest.isEqual(stored.getBytes(StandardCharsets.UTF_8), submitted.getBytes(StandardCharsets.UTF_8));
    }
}
