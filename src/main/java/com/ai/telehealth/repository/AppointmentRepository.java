package com.ai.telehealth.repository;

import com.ai.telehealth.entity.Appointment;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import jakarta.persistence.LockModeType;
import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface AppointmentRepository extends JpaRepository<Appointment, Long> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT a FROM Appointment a WHERE a.id = :id")
    Optional<Appointment> findByIdForUpdate(@Param("id") Long id);

    /**
     * Appointments of a provider whose [scheduledTime, endTime) range overlaps [from, to).
     */
    @Query("SELECT a FROM Appointment a WHERE a.providerId = :providerId AND a.status IN :statuses "
            + "AND a.scheduledTime < :to AND a.endTime > :from ORDER BY a.scheduledTime")
    List<Appointment> findOverlapping(@Param("providerId") Long providerId,
                                      @Param("statuses") Collection<Appointment.Status> statuses,
                                      @Param("from") LocalDateTime from,
                                      @Param("to") LocalDateTime to);

    List<Appointment> findByPatientIdAndScheduledTimeAfterAndStatusInOrderByScheduledTimeAsc(
            Long patientId,
            LocalDateTime after,
            Collection<Appointment.Status> statuses
    );

    List<Appointment> findByProviderIdAndScheduledTimeAfterAndStatusInOrderByScheduledTimeAsc(
            Long providerId,
            LocalDateTime after,
            Collection<Appointment.Status> statuses
    );

    List<Appointment> findBySendReminderTrueAndReminderSentFalseAndStatusInAndScheduledTimeBetweenOrderByScheduledTimeAsc(
            Collection<Appointment.Status> statuses,
            LocalDateTime from,
            LocalDateTime to
    );
}
