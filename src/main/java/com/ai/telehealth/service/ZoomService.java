package com.ai.telehealth.service;

import com.ai.telehealth.dto.MeetingDetails;
import com.ai.telehealth.dto.MeetingRequest;
import com.ai.telehealth.exception.ExternalProviderException;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.SignatureAlgorithm;
import io.jsonwebtoken.security.Keys;
import org.apache.commons.lang3.RandomStringUtils;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Zoom REST client. Meetings are scheduled on behalf of the provider with hardened
 * defaults: waiting room, authenticated entry, no recording.
 */
@Service
public class ZoomService implements MeetingProvider {

    private static final Logger log = LoggerFactory.getLogger(ZoomService.class);

    private static final DateTimeFormatter ZOOM_TIME = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss");
    private static final Duration TOKEN_TTL = Duration.ofHours(1);
    private static final char[] PASSWORD_CHARS =
            "abcdefghijklmnopqrstuvwxyzABCDEFGHIJKLMNOPQRSTUVWXYZ0123456789!@#$%^&*()".toCharArray();
    private static final int PASSWORD_LENGTH = 10;
    private static final int SCHEDULED_MEETING = 2;

    private final RestTemplate restTemplate;
    private final Clock clock;
    private final SecureRandom random = new SecureRandom();
    private final String apiKey;
    private final String apiSecret;
    private final String baseUrl;

    public ZoomService(RestTemplateBuilder builder,
                       Clock clock,
                       @Value("${zoom.api-key:}") String apiKey,
                       @Value("${zoom.api-secret:}") String apiSecret,
                       @Value("${zoom.base-url:https://api.zoom.us/v2}") String baseUrl,
                       @Value("${zoom.connect-timeout:5s}") Duration connectTimeout,
                       @Value("${zoom.read-timeout:10s}") Duration readTimeout) {
        // The JDK client supports PATCH, which meeting updates need.
        HttpClient httpClient = HttpClient.newBuilder().connectTimeout(connectTimeout).build();
        JdkClientHttpRequestFactory requestFactory = new JdkClientHttpRequestFactory(httpClient);
        requestFactory.setReadTimeout(readTimeout);
        this.restTemplate = builder.requestFactory(() -> requestFactory).build();
        this.clock = clock;
        this.apiKey = apiKey;
        this.apiSecret = apiSecret;
        this.baseUrl = StringUtils.removeEnd(baseUrl.trim(), "/");
    }

    @Override
    public MeetingDetails createMeeting(MeetingRequest request) {
        Map<String, Object> settings = new LinkedHashMap<>();
        settings.put("host_video", true);
        settings.put("participant_video", true);
        settings.put("join_before_host", false);
        settings.put("mute_upon_entry", true);
        settings.put("waiting_room", true);
        settings.put("meeting_authentication", true);
        settings.put("encryption_type", "enhanced");
        settings.put("audio", "both");
        settings.put("auto_recording", "none");

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("topic", request.topic());
        body.put("type", SCHEDULED_MEETING);
        body.put("start_time", request.startTime().format(ZOOM_TIME));
        body.put("duration", request.durationMinutes());
        body.put("timezone", "UTC");
        body.put("password", generatePassword());
        body.put("settings", settings);
        body.put("schedule_for", request.hostEmail());

        String url = baseUrl + "/users/" + request.hostEmail() + "/meetings";
        try {
            ResponseEntity<MeetingDetails> response = restTemplate.exchange(
                    url, HttpMethod.POST, new HttpEntity<>(body, jsonHeaders()), MeetingDetails.class);
            MeetingDetails meeting = response.getBody();
            if (meeting == null || meeting.id() == null) {
                throw new ExternalProviderException("Zoom returned no meeting for host " + request.hostEmail());
            }
            log.info("Created Zoom meeting {} for host {}", meeting.id(), request.hostEmail());
            return meeting;
        } catch (RestClientException e) {
            throw new ExternalProviderException("Failed to create Zoom meeting: " + e.getMessage(), e);
        }
    }

    @Override
    public void updateMeeting(String meetingId, LocalDateTime startTime, Integer durationMinutes) {
        Map<String, Object> body = new LinkedHashMap<>();
        if (startTime != null) {
            body.put("start_time", startTime.format(ZOOM_TIME));
        }
        if (durationMinutes != null) {
            body.put("duration", durationMinutes);
        }
        try {
            restTemplate.exchange(baseUrl + "/meetings/" + meetingId, HttpMethod.PATCH,
                    new HttpEntity<>(body, jsonHeaders()), Void.class);
            log.info("Updated Zoom meeting {}", meetingId);
        } catch (RestClientException e) {
            throw new ExternalProviderException("Failed to update Zoom meeting " + meetingId + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void deleteMeeting(String meetingId) {
        try {
            restTemplate.exchange(baseUrl + "/meetings/" + meetingId, HttpMethod.DELETE,
                    new HttpEntity<>(authHeaders()), Void.class);
            log.info("Deleted Zoom meeting {}", meetingId);
        } catch (RestClientException e) {
            throw new ExternalProviderException("Failed to delete Zoom meeting " + meetingId + ": " + e.getMessage(), e);
        }
    }

    @Override
    public MeetingDetails getMeeting(String meetingId) {
        try {
            ResponseEntity<MeetingDetails> response = restTemplate.exchange(baseUrl + "/meetings/" + meetingId,
                    HttpMethod.GET, new HttpEntity<>(authHeaders()), MeetingDetails.class);
            if (response.getBody() == null) {
                throw new ExternalProviderException("Zoom returned no body for meeting " + meetingId);
            }
            return response.getBody();
        } catch (RestClientException e) {
            throw new ExternalProviderException("Failed to get Zoom meeting " + meetingId + ": " + e.getMessage(), e);
        }
    }

    /**
     * Short-lived HS256 bearer token signed with the API secret.
     */
    String generateToken() {
        if (StringUtils.isAnyBlank(apiKey, apiSecret)) {
            throw new ExternalProviderException("Zoom credentials are not configured");
        }
        try {
            return Jwts.builder()
                    .setIssuer(apiKey)
                    .setExpiration(Date.from(clock.instant().plus(TOKEN_TTL)))
                    .signWith(Keys.hmacShaKeyFor(apiSecret.getBytes(StandardCharsets.UTF_8)), SignatureAlgorithm.HS256)
                    .compact();
        } catch (JwtException e) {
            throw new ExternalProviderException("Cannot sign Zoom token: " + e.getMessage(), e);
        }
    }

    private String generatePassword() {
        return RandomStringUtils.random(PASSWORD_LENGTH, 0, PASSWORD_CHARS.length, false, false, PASSWORD_CHARS, random);
    }

    private HttpHeaders authHeaders() {
        HttpHeaders headers = new HttpHeaders();
        headers.setBearerAuth(generateToken());
        return headers;
    }

    private HttpHeaders jsonHeaders() {
        HttpHeaders headers = authHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        return headers;
    }
}
