package com.ai.telehealth.dto;

import org.apache.commons.lang3.StringUtils;

/**
 * Read-only view of a patient or provider as the identity directory knows them.
 */
public record ParticipantProfile(Long id, String firstName, String lastName, String email) {

    public String fullName() {
        return StringUtils.normalizeSpace(StringUtils.defaultString(firstName) + " " + StringUtils.defaultString(lastName));
    }

    public boolean hasEmail() {
        return StringUtils.isNotBlank(email);
    }
}
