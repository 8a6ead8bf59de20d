package com.ai.telehealth.service;

import com.ai.telehealth.dto.AvailabilityRequest;
import com.ai.telehealth.dto.TimeOffRequest;
import com.ai.telehealth.entity.ProviderAvailability;
import com.ai.telehealth.entity.ProviderTimeOff;
import com.ai.telehealth.exception.InvalidTimeRangeException;
import com.ai.telehealth.exception.ResourceNotFoundException;
import com.ai.telehealth.repository.ProviderAvailabilityRepository;
import com.ai.telehealth.repository.ProviderTimeOffRepository;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Objects;

/**
 * Provider-managed weekly availability windows and time off.
 */
@Service
@RequiredArgsConstructor
public class AvailabilityService {

    private static final Logger log = LoggerFactory.getLogger(AvailabilityService.class);

    private final ProviderAvailabilityRepository availabilityRepository;
    private final ProviderTimeOffRepository timeOffRepository;
    private final IdentityService identityService;

    @Transactional(readOnly = true)
    public List<ProviderAvailability> listAvailability(Long providerId) {
        return availabilityRepository.findByProviderIdOrderByDayOfWeekAscStartTimeAsc(providerId);
    }

    @Transactional
    public ProviderAvailability addAvailability(Long providerId, AvailabilityRequest request) {
        identityService.requireProvider(providerId);
        validateWindow(request);
        ProviderAvailability row = ProviderAvailability.builder()
                .providerId(providerId)
                .dayOfWeek(request.dayOfWeek())
                .startTime(request.startTime())
                .endTime(request.endTime())
                .enabled(request.enabled() == null || request.enabled())
                .build();
        row = availabilityRepository.save(row);
        log.info("Added availability {} for provider {}: day {} {} - {}", row.getId(), providerId,
                row.getDayOfWeek(), row.getStartTime(), row.getEndTime());
        return row;
    }

    @Transactional
    public ProviderAvailability updateAvailability(Long providerId, Long availabilityId, AvailabilityRequest request) {
        validateWindow(request);
        ProviderAvailability row = ownAvailability(providerId, availabilityId);
        row.setDayOfWeek(request.dayOfWeek());
        row.setStartTime(request.startTime());
        row.setEndTime(request.endTime());
        if (request.enabled() != null) {
            row.setEnabled(request.enabled());
        }
        return availabilityRepository.save(row);
    }

    @Transactional
    public void deleteAvailability(Long providerId, Long availabilityId) {
        availabilityRepository.delete(ownAvailability(providerId, availabilityId));
        log.info("Deleted availability {} of provider {}", availabilityId, providerId);
    }

    @Transactional(readOnly = true)
    public List<ProviderTimeOff> listTimeOff(Long providerId) {
        return timeOffRepository.findByProviderIdOrderByStartTimeAsc(providerId);
    }

    @Transactional
    public ProviderTimeOff addTimeOff(Long providerId, TimeOffRequest request) {
        identityService.requireProvider(providerId);
        if (request.startTime() == null || request.endTime() == null || request.endTime().isBefore(request.startTime())) {
            throw new InvalidTimeRangeException("Time off must end at or after its start.");
        }
        ProviderTimeOff timeOff = timeOffRepository.save(ProviderTimeOff.builder()
                .providerId(providerId)
                .startTime(request.startTime())
                .endTime(request.endTime())
                .reason(request.reason())
                .build());
        log.info("Added time off {} for provider {}: {} - {}", timeOff.getId(), providerId,
                timeOff.getStartTime(), timeOff.getEndTime());
        return timeOff;
    }

    @Transactional
    public void deleteTimeOff(Long providerId, Long timeOffId) {
        ProviderTimeOff timeOff = timeOffRepository.findById(timeOffId)
                .filter(t -> Objects.equals(t.getProviderId(), providerId))
                .orElseThrow(() -> new ResourceNotFoundException("Time off", timeOffId));
        timeOffRepository.delete(timeOff);
        log.info("Deleted time off {} of provider {}", timeOffId, providerId);
    }

    private ProviderAvailability ownAvailability(Long providerId, Long availabilityId) {
        return availabilityRepository.findById(availabilityId)
                .filter(a -> Objects.equals(a.getProviderId(), providerId))
                .orElseThrow(() -> new ResourceNotFoundException("Availability", availabilityId));
    }

    private static void validateWindow(AvailabilityRequest request) {
        if (request.dayOfWeek() < 0 || request.dayOfWeek() > 6) {
            throw new InvalidTimeRangeException("Day of week must be between 0 (Monday) and 6 (Sunday).");
        }
        if (request.startTime() == null || request.endTime() == null || !request.endTime().isAfter(request.startTime())) {
            throw new InvalidTimeRangeException("Availability window must end after it starts.");
        }
    }
}
