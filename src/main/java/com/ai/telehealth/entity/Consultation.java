package com.ai.telehealth.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Duration;
import java.time.LocalDateTime;

@Entity
@Table(name = "consultation", uniqueConstraints = {
    @UniqueConstraint(name = "uk_consultation_appointment", columnNames = {"appointment_id"})
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Consultation {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "appointment_id", nullable = false)
    private Long appointmentId;

    @Column(name = "start_time")
    private LocalDateTime startTime;

    @Column(name = "end_time")
    private LocalDateTime endTime;

    private Duration duration;

    @Column(name = "meeting_id", length = 255)
    private String meetingId;

    @Column(name = "meeting_password", length = 255)
    private String meetingPassword;

    @Column(name = "join_url", length = 1024)
    private String joinUrl;

    /** Host link; handed out to the provider only. */
    @Column(name = "start_url", length = 2048)
    private String startUrl;

    @Column(name = "access_code", length = 6)
    private String accessCode;

    @Column(name = "access_code_expires_at")
    private LocalDateTime accessCodeExpiresAt;

    @Column(length = 4000)
    private String notes;

    @Version
    private Long version;

    public boolean hasMeeting() {
        return meetingId != null;
    }

    public boolean isStarted() {
        return startTime != null;
    }

    public boolean isEnded() {
        return endTime != null;
    }

    public void clearAccessCode() {
        accessCode = null;
        accessCodeExpiresAt = null;
    }

    @PrePersist
    @PreUpdate
    public void recomputeDuration() {
        if (startTime != null && endTime != null) {
            duration = Duration.between(startTime, endTime);
        }
    }
}
