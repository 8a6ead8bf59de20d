package com.ai.telehealth.dto;

public record NotesRequest(String notes) {
}
