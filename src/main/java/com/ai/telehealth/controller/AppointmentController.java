package com.ai.telehealth.controller;

import com.ai.telehealth.dto.AvailabilityCheck;
import com.ai.telehealth.dto.BookingRequest;
import com.ai.telehealth.dto.FollowUpRequest;
import com.ai.telehealth.dto.RescheduleRequest;
import com.ai.telehealth.entity.Appointment;
import com.ai.telehealth.service.AppointmentService;
import com.ai.telehealth.service.BookingService;
import com.ai.telehealth.service.ParticipantRole;
import jakarta.validation.Valid;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDateTime;
import java.util.List;

@RestController
@RequestMapping("/api/appointments")
public class AppointmentController {

    private final BookingService bookingService;
    private final AppointmentService appointmentService;

    public AppointmentController(BookingService bookingService, AppointmentService appointmentService) {
        this.bookingService = bookingService;
        this.appointmentService = appointmentService;
    }

    @PostMapping
    public ResponseEntity<Appointment> create(@Valid @RequestBody BookingRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(bookingService.createAppointment(request));
    }

    @GetMapping("/{id}")
    public Appointment get(@PathVariable Long id) {
        return appointmentService.get(id);
    }

    @GetMapping("/availability")
    public AvailabilityCheck checkAvailability(
            @RequestParam Long providerId,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime start,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime end) {
        return bookingService.checkAvailable(providerId, start, end);
    }

    @GetMapping("/upcoming")
    public ResponseEntity<List<Appointment>> upcoming(@RequestParam(required = false) Long patientId,
                                                      @RequestParam(required = false) Long providerId) {
        if ((patientId == null) == (providerId == null)) {
            return ResponseEntity.badRequest().build();
        }
        return patientId != null
                ? ResponseEntity.ok(appointmentService.upcoming(ParticipantRole.PATIENT, patientId))
                : ResponseEntity.ok(appointmentService.upcoming(ParticipantRole.PROVIDER, providerId));
    }

    @PostMapping("/{id}/confirm")
    public Appointment confirm(@PathVariable Long id) {
        return appointmentService.confirm(id);
    }

    @PostMapping("/{id}/cancel")
    public Appointment cancel(@PathVariable Long id) {
        return appointmentService.cancel(id);
    }

    @PostMapping("/{id}/no-show")
    public Appointment noShow(@PathVariable Long id) {
        return appointmentService.markNoShow(id);
    }

    @PostMapping("/{id}/reschedule")
    public ResponseEntity<Appointment> reschedule(@PathVariable Long id, @Valid @RequestBody RescheduleRequest request) {
        Appointment replacement = appointmentService.reschedule(id, request.scheduledTime(), request.endTime());
        return ResponseEntity.status(HttpStatus.CREATED).body(replacement);
    }

    @PostMapping("/{id}/follow-up")
    public ResponseEntity<Appointment> followUp(@PathVariable Long id, @Valid @RequestBody FollowUpRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(bookingService.createFollowUp(id, request));
    }
}
