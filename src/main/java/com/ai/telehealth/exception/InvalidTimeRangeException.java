package com.ai.telehealth.exception;

public class InvalidTimeRangeException extends SchedulingException {

    public InvalidTimeRangeException(String message) {
        super(message);
    }
}
