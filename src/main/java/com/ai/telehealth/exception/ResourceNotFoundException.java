package com.ai.telehealth.exception;

public class ResourceNotFoundException extends SchedulingException {

    public ResourceNotFoundException(String resource, Long id) {
        super(resource + " " + id + " not found.");
    }
}
