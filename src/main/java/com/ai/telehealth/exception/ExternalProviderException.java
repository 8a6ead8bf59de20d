package com.ai.telehealth.exception;

/**
 * A call to the meeting provider failed. Most callers log and degrade instead of
 * propagating this.
 */
public class ExternalProviderException extends SchedulingException {

    public ExternalProviderException(String message) {
        super(message);
    }

    public ExternalProviderException(String message, Throwable cause) {
        super(message, cause);
    }
}
