package com.ai.telehealth.exception;

public class InvalidTransitionException extends SchedulingException {

    public InvalidTransitionException(String message) {
        super(message);
    }
}
