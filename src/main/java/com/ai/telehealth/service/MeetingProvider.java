package com.ai.telehealth.service;

import com.ai.telehealth.dto.MeetingDetails;
import com.ai.telehealth.dto.MeetingRequest;
import com.ai.telehealth.exception.ExternalProviderException;

import java.time.LocalDateTime;

/**
 * External platform hosting the real-time session of a consultation.
 * Every method throws {@link ExternalProviderException} when the platform call fails.
 */
public interface MeetingProvider {

    MeetingDetails createMeeting(MeetingRequest request);

    /**
     * @param startTime       new start, or null to keep it
     * @param durationMinutes new duration, or null to keep it
     */
    void updateMeeting(String meetingId, LocalDateTime startTime, Integer durationMinutes);

    void deleteMeeting(String meetingId);

    MeetingDetails getMeeting(String meetingId);
}
