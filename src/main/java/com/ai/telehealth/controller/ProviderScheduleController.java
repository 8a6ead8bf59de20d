package com.ai.telehealth.controller;

import com.ai.telehealth.dto.AvailabilityRequest;
import com.ai.telehealth.dto.TimeOffRequest;
import com.ai.telehealth.dto.TimeSlot;
import com.ai.telehealth.entity.ProviderAvailability;
import com.ai.telehealth.entity.ProviderTimeOff;
import com.ai.telehealth.service.AvailabilityService;
import com.ai.telehealth.service.SlotService;
import jakarta.validation.Valid;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;
import java.util.List;

@RestController
@RequestMapping("/api/providers/{providerId}")
public class ProviderScheduleController {

    private final SlotService slotService;
    private final AvailabilityService availabilityService;

    public ProviderScheduleController(SlotService slotService, AvailabilityService availabilityService) {
        this.slotService = slotService;
        this.availabilityService = availabilityService;
    }

    @GetMapping("/slots")
    public List<TimeSlot> slots(@PathVariable Long providerId,
                                @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        return slotService.getAvailableSlots(providerId, date);
    }

    @GetMapping("/availability")
    public List<ProviderAvailability> availability(@PathVariable Long providerId) {
        return availabilityService.listAvailability(providerId);
    }

    @PostMapping("/availability")
    public ResponseEntity<ProviderAvailability> addAvailability(@PathVariable Long providerId,
                                                                @Valid @RequestBody AvailabilityRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(availabilityService.addAvailability(providerId, request));
    }

    @PutMapping("/availability/{availabilityId}")
    public ProviderAvailability updateAvailability(@PathVariable Long providerId, @PathVariable Long availabilityId,
                                                   @Valid @RequestBody AvailabilityRequest request) {
        return availabilityService.updateAvailability(providerId, availabilityId, request);
    }

    @DeleteMapping("/availability/{availabilityId}")
    public ResponseEntity<Void> deleteAvailability(@PathVariable Long providerId, @PathVariable Long availabilityId) {
        availabilityService.deleteAvailability(providerId, availabilityId);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/time-off")
    public List<ProviderTimeOff> timeOff(@PathVariable Long providerId) {
        return availabilityService.listTimeOff(providerId);
    }

    @PostMapping("/time-off")
    public ResponseEntity<ProviderTimeOff> addTimeOff(@PathVariable Long providerId,
                                                      @Valid @RequestBody TimeOffRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(availabilityService.addTimeOff(providerId, request));
    }

    @DeleteMapping("/time-off/{timeOffId}")
    public ResponseEntity<Void> deleteTimeOff(@PathVariable Long providerId, @PathVariable Long timeOffId) {
        availabilityService.deleteTimeOff(providerId, timeOffId);
        return ResponseEntity.noContent().build();
    }
}
