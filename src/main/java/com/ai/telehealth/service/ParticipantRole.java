package com.ai.telehealth.service;

public enum ParticipantRole {
    PATIENT, PROVIDER
}
