package com.ai.telehealth.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.EnumSet;
import java.util.Set;

@Entity
@Table(name = "appointment", indexes = {
    @Index(name = "idx_appointment_provider_time", columnList = "provider_id, scheduled_time"),
    @Index(name = "idx_appointment_patient_time", columnList = "patient_id, scheduled_time")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Appointment {

    public enum Status {
        SCHEDULED, CONFIRMED, IN_PROGRESS, COMPLETED, CANCELLED, NO_SHOW, RESCHEDULED;

        /** Statuses that hold the provider's time and block overlapping bookings. */
        public static final Set<Status> ACTIVE = EnumSet.of(SCHEDULED, CONFIRMED, IN_PROGRESS);

        /** Statuses that still lie ahead of the patient: cancellable, reschedulable, remindable. */
        public static final Set<Status> PENDING = EnumSet.of(SCHEDULED, CONFIRMED);

        public boolean isActive() {
            return ACTIVE.contains(this);
        }

        public boolean isPending() {
            return PENDING.contains(this);
        }
    }

    public enum Type {
        VIDEO_CONSULTATION("Video Consultation"),
        PHONE_CONSULTATION("Phone Consultation"),
        IN_PERSON("In-Person Visit"),
        FOLLOW_UP("Follow-up"),
        URGENT_CARE("Urgent Care"),
        SPECIALIST_REFERRAL("Specialist Referral");

        private final String displayName;

        Type(String displayName) {
            this.displayName = displayName;
        }

        public String getDisplayName() {
            return displayName;
        }

        /**
         * Whether the appointment is held as a remote session and therefore gets a
         * consultation bound to an external meeting.
         */
        public boolean requiresSession() {
            switch (this) {
                case VIDEO_CONSULTATION:
                    return true;
                default:
                    return false;
            }
        }
    }

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "patient_id", nullable = false)
    private Long patientId;

    @Column(name = "provider_id", nullable = false)
    private Long providerId;

    @Column(name = "scheduled_time", nullable = false)
    private LocalDateTime scheduledTime;

    @Column(name = "end_time", nullable = false)
    private LocalDateTime endTime;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private Status status = Status.SCHEDULED;

    @Enumerated(EnumType.STRING)
    @Column(name = "appointment_type", nullable = false, length = 50)
    @Builder.Default
    private Type appointmentType = Type.VIDEO_CONSULTATION;

    @Column(length = 2000)
    private String reason;

    /** Set on the replacement of a rescheduled appointment and on follow-ups. */
    @Column(name = "parent_appointment_id")
    private Long parentAppointmentId;

    // Recurrence is advisory only; no instances are generated from it.
    @Column(name = "is_recurring", nullable = false)
    @Builder.Default
    private boolean recurring = false;

    @Column(name = "recurrence_pattern", length = 50)
    private String recurrencePattern;

    @Column(name = "recurrence_end_date")
    private LocalDate recurrenceEndDate;

    @Column(name = "send_reminder", nullable = false)
    @Builder.Default
    private boolean sendReminder = true;

    @Column(name = "reminder_sent", nullable = false)
    @Builder.Default
    private boolean reminderSent = false;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Version
    private Long version;

    public long durationMinutes() {
        return Duration.between(scheduledTime, endTime).toMinutes();
    }

    @PrePersist
    protected void onCreate() {
        Instant now = Instant.now();
        if (createdAt == null) createdAt = now;
        updatedAt = now;
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }
}
