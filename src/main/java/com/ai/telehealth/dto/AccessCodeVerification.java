package com.ai.telehealth.dto;

import jakarta.validation.constraints.NotBlank;

public record AccessCodeVerification(@NotBlank String code) {
}
