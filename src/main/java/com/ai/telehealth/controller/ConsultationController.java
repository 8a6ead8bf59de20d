package com.ai.telehealth.controller;

import com.ai.telehealth.dto.AccessCodeVerification;
import com.ai.telehealth.dto.ConsultationRequest;
import com.ai.telehealth.dto.ConsultationView;
import com.ai.telehealth.dto.JoinInfo;
import com.ai.telehealth.dto.NotesRequest;
import com.ai.telehealth.exception.ParticipantAccessException;
import com.ai.telehealth.service.ConsultationAuthService;
import com.ai.telehealth.service.ConsultationService;
import com.ai.telehealth.service.ParticipantRole;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Participant identity arrives in the {@code X-Participant-Role} and
 * {@code X-Participant-Id} headers, set by the authenticating gateway in front of this
 * service. Patient and provider ids are numbered independently, so the role is required.
 */
@RestController
@RequestMapping("/api/consultations")
public class ConsultationController {

    static final String PARTICIPANT_HEADER = "X-Participant-Id";
    static final String ROLE_HEADER = "X-Participant-Role";

    private final ConsultationService consultationService;
    private final ConsultationAuthService authService;

    public ConsultationController(ConsultationService consultationService, ConsultationAuthService authService) {
        this.consultationService = consultationService;
        this.authService = authService;
    }

    @PostMapping
    public ResponseEntity<ConsultationView> create(@Valid @RequestBody ConsultationRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ConsultationView.of(consultationService.create(request.appointmentId())));
    }

    @GetMapping("/{id}")
    public ConsultationView get(@PathVariable Long id) {
        return ConsultationView.of(consultationService.get(id));
    }

    /**
     * Retries meeting creation for a consultation whose first attempt failed.
     */
    @PostMapping("/{id}/meeting")
    public ConsultationView bindMeeting(@PathVariable Long id) {
        return ConsultationView.of(consultationService.bindMeeting(id));
    }

    @PostMapping("/{id}/start")
    public ConsultationView start(@PathVariable Long id) {
        return ConsultationView.of(consultationService.start(id));
    }

    @PostMapping("/{id}/end")
    public ConsultationView end(@PathVariable Long id) {
        return ConsultationView.of(consultationService.end(id));
    }

    @PutMapping("/{id}/notes")
    public ConsultationView notes(@PathVariable Long id, @RequestBody NotesRequest request) {
        return ConsultationView.of(consultationService.updateNotes(id, request.notes()));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable Long id) {
        consultationService.delete(id);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/{id}/join-info")
    public JoinInfo joinInfo(@PathVariable Long id,
                             @RequestHeader(ROLE_HEADER) ParticipantRole role,
                             @RequestHeader(PARTICIPANT_HEADER) Long participantId) {
        return consultationService.joinInfo(id, role, participantId);
    }

    @PostMapping("/{id}/access-code")
    public ResponseEntity<Map<String, Object>> requestAccessCode(@PathVariable Long id) {
        boolean sent = authService.requestAccessCode(id);
        if (!sent) {
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                    .body(Map.of("sent", false, "detail", "Access code could not be delivered. Try again later."));
        }
        return ResponseEntity.ok(Map.of("sent", true, "validForMinutes", authService.getAccessCodeTtl().toMinutes()));
    }

    @PostMapping("/{id}/access-code/verify")
    public ResponseEntity<?> verifyAccessCode(@PathVariable Long id,
                                              @RequestHeader(ROLE_HEADER) ParticipantRole role,
                                              @RequestHeader(PARTICIPANT_HEADER) Long participantId,
                                              @Valid @RequestBody AccessCodeVerification request) {
        // the code is single-use, so the caller is checked before it is spent
        if (role != ParticipantRole.PATIENT) {
            throw new ParticipantAccessException("Only the patient joins with an access code.");
        }
        consultationService.requireParticipant(id, role, participantId);
        if (!authService.verifyAccessCode(id, request.code())) {
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED)
                    .body(Map.of("error", "INVALID_ACCESS_CODE", "detail", "Invalid or expired access code."));
        }
        return ResponseEntity.ok(consultationService.joinInfo(id, role, participantId).verified());
    }
}
