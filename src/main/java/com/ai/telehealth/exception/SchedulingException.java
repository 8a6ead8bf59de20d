package com.ai.telehealth.exception;

/**
 * Base of every error the scheduling engine reports to its callers.
 */
public abstract class SchedulingException extends RuntimeException {

    protected SchedulingException(String message) {
        super(message);
    }

    protected SchedulingException(String message, Throwable cause) {
        super(message, cause);
    }
}
