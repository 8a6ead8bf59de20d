package com.ai.telehealth.service;

import com.ai.telehealth.dto.MeetingDetails;
import com.ai.telehealth.dto.MeetingRequest;
import com.ai.telehealth.exception.ExternalProviderException;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.web.client.MockServerRestTemplateCustomizer;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Date;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.hamcrest.Matchers.startsWith;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class ZoomServiceTest {

    private static final String BASE = "https://zoom.test/v2";
    private static final String KEY = "test-api-key";
    private static final String SECRET = "test-api-secret-that-is-at-least-32-bytes-long";

    private MockRestServiceServer server;
    private ZoomService zoomService;

    @BeforeEach
    void setUp() {
        MockServerRestTemplateCustomizer customizer = new MockServerRestTemplateCustomizer();
        zoomService = new ZoomService(new RestTemplateBuilder(customizer), Clock.systemUTC(),
                KEY, SECRET, BASE + "/", Duration.ofSeconds(1), Duration.ofSeconds(1));
        server = customizer.getServer();
    }

    @Test
    void createMeetingPostsHardenedSettingsForHost() {
        server.expect(requestTo(BASE + "/users/house@example.com/meetings"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(header("Authorization", startsWith("Bearer ")))
                .andExpect(jsonPath("$.type").value(2))
                .andExpect(jsonPath("$.start_time").value("2026-11-03T10:00:00"))
                .andExpect(jsonPath("$.duration").value(30))
                .andExpect(jsonPath("$.timezone").value("UTC"))
                .andExpect(jsonPath("$.schedule_for").value("house@example.com"))
                .andExpect(jsonPath("$.settings.waiting_room").value(true))
                .andExpect(jsonPath("$.settings.join_before_host").value(false))
                .andExpect(jsonPath("$.settings.auto_recording").value("none"))
                .andExpect(jsonPath("$.password").isString())
                .andRespond(withSuccess("{\"id\":81234567890,\"password\":\"abc\","
                        + "\"join_url\":\"https://zoom.test/j/81234567890\","
                        + "\"start_url\":\"https://zoom.test/s/81234567890\",\"uuid\":\"x\"}", MediaType.APPLICATION_JSON));

        MeetingDetails meeting = zoomService.createMeeting(new MeetingRequest("Medical Consultation",
                LocalDateTime.of(2026, 11, 3, 10, 0), 30, "house@example.com"));

        assertThat(meeting.id()).isEqualTo("81234567890");
        assertThat(meeting.joinUrl()).isEqualTo("https://zoom.test/j/81234567890");
        assertThat(meeting.startUrl()).isEqualTo("https://zoom.test/s/81234567890");
        server.verify();
    }

    @Test
    void updateMeetingPatchesTimes() {
        server.expect(requestTo(BASE + "/meetings/812"))
                .andExpect(method(HttpMethod.PATCH))
                .andExpect(jsonPath("$.start_time").value("2026-11-04T14:00:00"))
                .andExpect(jsonPath("$.duration").value(60))
                .andRespond(withStatus(HttpStatus.NO_CONTENT));

        zoomService.updateMeeting("812", LocalDateTime.of(2026, 11, 4, 14, 0), 60);

        server.verify();
    }

    @Test
    void getMeetingReadsDetails() {
        server.expect(requestTo(BASE + "/meetings/812"))
                .andExpect(method(HttpMethod.GET))
                .andExpect(header("Authorization", startsWith("Bearer ")))
                .andRespond(withSuccess("{\"id\":812,\"join_url\":\"https://zoom.test/j/812\"}", MediaType.APPLICATION_JSON));

        MeetingDetails meeting = zoomService.getMeeting("812");

        assertThat(meeting.id()).isEqualTo("812");
        assertThat(meeting.startUrl()).isNull();
    }

    @Test
    void providerErrorsBecomeExternalProviderException() {
        server.expect(requestTo(BASE + "/meetings/812"))
                .andExpect(method(HttpMethod.DELETE))
                .andRespond(withStatus(HttpStatus.NOT_FOUND));

        assertThatThrownBy(() -> zoomService.deleteMeeting("812"))
                .isInstanceOf(ExternalProviderException.class)
                .hasMessageContaining("812");
    }

    @Test
    void tokenIsSignedWithSecretAndIssuedByApiKey() {
        String token = zoomService.generateToken();

        Claims claims = Jwts.parserBuilder()
                .setSigningKey(Keys.hmacShaKeyFor(SECRET.getBytes(StandardCharsets.UTF_8)))
                .build()
                .parseClaimsJws(token)
                .getBody();
        assertThat(claims.getIssuer()).isEqualTo(KEY);
        assertThat(claims.getExpiration()).isAfter(new Date());
    }

    @Test
    void missingCredentialsFailFast() {
        ZoomService unconfigured = new ZoomService(new RestTemplateBuilder(), Clock.systemUTC(),
                "", "", BASE, Duration.ofSeconds(1), Duration.ofSeconds(1));

        assertThatThrownBy(unconfigured::generateToken).isInstanceOf(ExternalProviderException.class);
    }
}
