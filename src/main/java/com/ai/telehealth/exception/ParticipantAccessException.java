package com.ai.telehealth.exception;

public class ParticipantAccessException extends SchedulingException {

    public ParticipantAccessException(String message) {
        super(message);
    }
}
