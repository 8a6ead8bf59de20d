package com.ai.telehealth.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record MeetingDetails(
        @JsonProperty("id") String id,
        @JsonProperty("password") String password,
        @JsonProperty("join_url") String joinUrl,
        @JsonProperty("start_url") String startUrl) {
}
