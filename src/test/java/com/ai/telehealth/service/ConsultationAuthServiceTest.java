package com.ai.telehealth.service;

import com.ai.telehealth.dto.ParticipantProfile;
import com.ai.telehealth.entity.Appointment;
import com.ai.telehealth.entity.Consultation;
import com.ai.telehealth.repository.AppointmentRepository;
import com.ai.telehealth.repository.ConsultationRepository;
import com.ai.telehealth.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class ConsultationAuthServiceTest {

    private static final Duration TTL = Duration.ofMinutes(15);
    private static final LocalDateTime NOW = LocalDateTime.of(2026, 11, 3, 9, 45);

    @Mock
    private ConsultationRepository consultationRepository;
    @Mock
    private AppointmentRepository appointmentRepository;
    @Mock
    private IdentityService identityService;
    @Mock
    private EmailService emailService;

    private final MutableClock clock = new MutableClock(NOW);
    private ConsultationAuthService authService;
    private Consultation consultation;
    private ParticipantProfile patient;

    @BeforeEach
    void setUp() {
        authService = new ConsultationAuthService(consultationRepository, appointmentRepository,
                identityService, emailService, clock, TTL);

        Appointment appointment = Appointment.builder()
                .id(7L).patientId(10L).providerId(1L)
                .scheduledTime(NOW.plusMinutes(15)).endTime(NOW.plusMinutes(45))
                .build();
        consultation = Consultation.builder().id(3L).appointmentId(7L).build();
        patient = new ParticipantProfile(10L, "Jane", "Doe", "jane@example.com");

        when(consultationRepository.findById(3L)).thenReturn(Optional.of(consultation));
        when(consultationRepository.findByIdForUpdate(3L)).thenReturn(Optional.of(consultation));
        when(appointmentRepository.findById(7L)).thenReturn(Optional.of(appointment));
        when(identityService.patient(10L)).thenAnswer(inv -> patient);
        when(identityService.provider(1L)).thenReturn(new ParticipantProfile(1L, "Gregory", "House", "house@example.com"));
        when(emailService.sendAccessCode(any(), any(), any(), anyString(), any())).thenReturn(true);
    }

    @Test
    void codeIsSixDigitsAndExpiresAfterTtl() {
        assertThat(authService.requestAccessCode(3L)).isTrue();

        assertThat(consultation.getAccessCode()).matches("\\d{6}");
        assertThat(consultation.getAccessCodeExpiresAt()).isEqualTo(NOW.plus(TTL));
        verify(consultationRepository).save(consultation);
        verify(emailService).sendAccessCode(any(), eq(patient), any(), eq(consultation.getAccessCode()), eq(TTL));
    }

    @Test
    void codeVerifiesOnceInsideTheWindow() {
        authService.requestAccessCode(3L);
        String code = consultation.getAccessCode();

        clock.advance(TTL.minusMinutes(1));
        assertThat(authService.verifyAccessCode(3L, code)).isTrue();
        assertThat(consultation.getAccessCode()).isNull();
        assertThat(consultation.getAccessCodeExpiresAt()).isNull();

        assertThat(authService.verifyAccessCode(3L, code)).isFalse();
    }

    @Test
    void expiredCodeIsRejectedAndLeftInPlace() {
        authService.requestAccessCode(3L);
        String code = consultation.getAccessCode();

        clock.advance(TTL.plusMinutes(1));

        assertThat(authService.verifyAccessCode(3L, code)).isFalse();
        assertThat(authService.verifyAccessCode(3L, code)).isFalse();
        assertThat(consultation.getAccessCode()).isEqualTo(code);
    }

    @Test
    void codeIsRejectedAtExactExpiry() {
        authService.requestAccessCode(3L);
        String code = consultation.getAccessCode();

        clock.advance(TTL);

        assertThat(authService.verifyAccessCode(3L, code)).isFalse();
    }

    @Test
    void wrongCodeDoesNotConsumeStoredCode() {
        authService.requestAccessCode(3L);
        String code = consultation.getAccessCode();
        String wrong = code.equals("000000") ? "111111" : "000000";

        assertThat(authService.verifyAccessCode(3L, wrong)).isFalse();
        assertThat(authService.verifyAccessCode(3L, code)).isTrue();
    }

    @Test
    void verifyWithoutCodeFails() {
        assertThat(authService.verifyAccessCode(3L, "123456")).isFalse();
    }

    @Test
    void codeSurvivesFailedDelivery() {
        when(emailService.sendAccessCode(any(), any(), any(), anyString(), any())).thenReturn(false);

        assertThat(authService.requestAccessCode(3L)).isFalse();

        assertThat(consultation.getAccessCode()).isNotNull();
        assertThat(authService.verifyAccessCode(3L, consultation.getAccessCode())).isTrue();
    }

    @Test
    void patientWithoutEmailGetsNoCode() {
        patient = new ParticipantProfile(10L, "Jane", "Doe", null);

        assertThat(authService.requestAccessCode(3L)).isFalse();

        assertThat(consultation.getAccessCode()).isNull();
        verify(consultationRepository, never()).save(any());
        verify(emailService, never()).sendAccessCode(any(), any(), any(), anyString(), any());
    }
}
