package com.ai.telehealth.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record JoinInfo(
        String meetingId,
        String meetingPassword,
        String joinUrl,
        String startUrl,
        boolean requiresAccessCode) {

    /**
     * Same details once the patient has presented a valid access code.
     */
    public JoinInfo verified() {
        return new JoinInfo(meetingId, meetingPassword, joinUrl, startUrl, false);
    }
}
