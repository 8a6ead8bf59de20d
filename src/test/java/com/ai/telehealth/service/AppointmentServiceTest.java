package com.ai.telehealth.service;

import com.ai.telehealth.dto.BookingRequest;
import com.ai.telehealth.entity.Appointment;
import com.ai.telehealth.entity.Consultation;
import com.ai.telehealth.event.AppointmentCancelledEvent;
import com.ai.telehealth.event.AppointmentRescheduledEvent;
import com.ai.telehealth.exception.InvalidTransitionException;
import com.ai.telehealth.exception.SlotConflictException;
import com.ai.telehealth.exception.ConflictReason;
import com.ai.telehealth.repository.AppointmentRepository;
import com.ai.telehealth.repository.ConsultationRepository;
import com.ai.telehealth.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AppointmentServiceTest {

    private static final LocalDateTime TEN = LocalDateTime.of(2026, 11, 3, 10, 0);

    @Mock
    private AppointmentRepository appointmentRepository;
    @Mock
    private ConsultationRepository consultationRepository;
    @Mock
    private BookingService bookingService;
    @Mock
    private ApplicationEventPublisher eventPublisher;

    private final MutableClock clock = new MutableClock(LocalDateTime.of(2026, 11, 1, 8, 0));
    private AppointmentService appointmentService;

    @BeforeEach
    void setUp() {
        appointmentService = new AppointmentService(appointmentRepository, consultationRepository,
                bookingService, eventPublisher, clock);
    }

    @Test
    void confirmMovesScheduledToConfirmed() {
        Appointment appt = stub(Appointment.Status.SCHEDULED);
        when(appointmentRepository.save(appt)).thenReturn(appt);

        assertThat(appointmentService.confirm(1L).getStatus()).isEqualTo(Appointment.Status.CONFIRMED);
    }

    @Test
    void confirmRejectsConfirmedAppointment() {
        stub(Appointment.Status.CONFIRMED);

        assertThatThrownBy(() -> appointmentService.confirm(1L)).isInstanceOf(InvalidTransitionException.class);
    }

    @Test
    void cancelPublishesEventOnce() {
        Appointment appt = stub(Appointment.Status.CONFIRMED);
        when(appointmentRepository.save(appt)).thenReturn(appt);

        appointmentService.cancel(1L);

        assertThat(appt.getStatus()).isEqualTo(Appointment.Status.CANCELLED);
        verify(eventPublisher).publishEvent(new AppointmentCancelledEvent(1L));
        assertThatThrownBy(() -> appointmentService.cancel(1L))
                .isInstanceOf(InvalidTransitionException.class)
                .hasMessageContaining("CANCELLED");
    }

    @Test
    void cancelRejectsCompletedAppointment() {
        stub(Appointment.Status.COMPLETED);

        assertThatThrownBy(() -> appointmentService.cancel(1L)).isInstanceOf(InvalidTransitionException.class);
        verify(eventPublisher, never()).publishEvent(any(Object.class));
    }

    @Test
    void rescheduleCreatesLinkedReplacementAndMovesConsultation() {
        Appointment original = stub(Appointment.Status.CONFIRMED);
        LocalDateTime newStart = TEN.plusDays(1);
        Appointment replacement = Appointment.builder().id(2L).patientId(10L).providerId(1L)
                .scheduledTime(newStart).endTime(newStart.plusMinutes(30)).parentAppointmentId(1L).build();
        when(bookingService.reserve(any(BookingRequest.class), eq(1L), eq(1L))).thenReturn(replacement);
        Consultation consultation = Consultation.builder().id(5L).appointmentId(1L).meetingId("m-1").build();
        when(consultationRepository.findByAppointmentId(1L)).thenReturn(Optional.of(consultation));

        Appointment result = appointmentService.reschedule(1L, newStart, newStart.plusMinutes(30));

        assertThat(result).isSameAs(replacement);
        assertThat(original.getStatus()).isEqualTo(Appointment.Status.RESCHEDULED);
        assertThat(original.getScheduledTime()).isEqualTo(TEN);
        assertThat(consultation.getAppointmentId()).isEqualTo(2L);
        verify(eventPublisher).publishEvent(new AppointmentRescheduledEvent(1L, 2L, TEN));

        ArgumentCaptor<BookingRequest> request = ArgumentCaptor.forClass(BookingRequest.class);
        verify(bookingService).reserve(request.capture(), eq(1L), eq(1L));
        assertThat(request.getValue().patientId()).isEqualTo(10L);
        assertThat(request.getValue().scheduledTime()).isEqualTo(newStart);
    }

    @Test
    void rescheduleConflictLeavesOriginalUntouched() {
        Appointment original = stub(Appointment.Status.SCHEDULED);
        when(bookingService.reserve(any(BookingRequest.class), eq(1L), eq(1L)))
                .thenThrow(new SlotConflictException(ConflictReason.OVERLAPPING_APPOINTMENT));

        assertThatThrownBy(() -> appointmentService.reschedule(1L, TEN.plusHours(2), TEN.plusHours(3)))
                .isInstanceOf(SlotConflictException.class);
        assertThat(original.getStatus()).isEqualTo(Appointment.Status.SCHEDULED);
        verify(eventPublisher, never()).publishEvent(any(Object.class));
    }

    @Test
    void rescheduleRejectsInProgressAppointment() {
        stub(Appointment.Status.IN_PROGRESS);

        assertThatThrownBy(() -> appointmentService.reschedule(1L, TEN.plusDays(1), TEN.plusDays(1).plusHours(1)))
                .isInstanceOf(InvalidTransitionException.class);
    }

    @Test
    void noShowIsAllowedFromAnyStatus() {
        Appointment appt = stub(Appointment.Status.COMPLETED);
        when(appointmentRepository.save(appt)).thenReturn(appt);

        assertThat(appointmentService.markNoShow(1L).getStatus()).isEqualTo(Appointment.Status.NO_SHOW);
    }

    @Test
    void upcomingQueriesPendingAppointmentsAfterNow() {
        Appointment appt = Appointment.builder().id(1L).patientId(10L).scheduledTime(TEN).build();
        when(appointmentRepository.findByPatientIdAndScheduledTimeAfterAndStatusInOrderByScheduledTimeAsc(
                10L, LocalDateTime.of(2026, 11, 1, 8, 0), Appointment.Status.PENDING)).thenReturn(List.of(appt));

        assertThat(appointmentService.upcoming(ParticipantRole.PATIENT, 10L)).containsExactly(appt);
    }

    private Appointment stub(Appointment.Status status) {
        Appointment appt = Appointment.builder()
                .id(1L)
                .patientId(10L)
                .providerId(1L)
                .scheduledTime(TEN)
                .endTime(TEN.plusHours(1))
                .status(status)
                .build();
        when(appointmentRepository.findByIdForUpdate(1L)).thenReturn(Optional.of(appt));
        return appt;
    }
}
