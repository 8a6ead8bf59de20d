package com.ai.telehealth.service;

import com.ai.telehealth.dto.TimeSlot;
import com.ai.telehealth.entity.Appointment;
import com.ai.telehealth.entity.ProviderAvailability;
import com.ai.telehealth.entity.ProviderTimeOff;
import com.ai.telehealth.repository.AppointmentRepository;
import com.ai.telehealth.repository.ProviderAvailabilityRepository;
import com.ai.telehealth.repository.ProviderTimeOffRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.List;

/**
 * Open 30-minute slots per provider and day. The store is the only source of truth;
 * nothing is cached or pre-generated.
 */
@Service
public class SlotService {

    private static final Logger log = LoggerFactory.getLogger(SlotService.class);

    private final IdentityService identityService;
    private final ProviderAvailabilityRepository availabilityRepository;
    private final ProviderTimeOffRepository timeOffRepository;
    private final AppointmentRepository appointmentRepository;

    public SlotService(IdentityService identityService,
                       ProviderAvailabilityRepository availabilityRepository,
                       ProviderTimeOffRepository timeOffRepository,
                       AppointmentRepository appointmentRepository) {
        this.identityService = identityService;
        this.availabilityRepository = availabilityRepository;
        this.timeOffRepository = timeOffRepository;
        this.appointmentRepository = appointmentRepository;
    }

    @Transactional(readOnly = true)
    public List<TimeSlot> getAvailableSlots(Long providerId, LocalDate date) {
        identityService.requireProvider(providerId);

        LocalDateTime dayStart = date.atStartOfDay();
        // the database may round the end-of-day bound up to the next midnight, so the rows are
        // only candidates and coversDay decides
        List<ProviderTimeOff> timeOff = timeOffRepository.findTouching(providerId, dayStart, date.atTime(LocalTime.MAX));
        if (timeOff.stream().anyMatch(t -> SlotCalculator.coversDay(t, date))) {
            log.debug("Provider {} is on time off on {}", providerId, date);
            return List.of();
        }

        List<ProviderAvailability> rows = availabilityRepository
                .findByProviderIdAndDayOfWeekAndEnabledTrueOrderByStartTimeAsc(providerId, SlotCalculator.dayIndex(date));
        if (rows.isEmpty()) {
            return List.of();
        }

        List<Appointment> booked = appointmentRepository.findOverlapping(
                providerId, Appointment.Status.ACTIVE, dayStart, date.plusDays(1).atStartOfDay());

        List<TimeSlot> slots = SlotCalculator.resolveSlots(date, rows, timeOff, booked);
        log.debug("Resolved {} open slots for provider {} on {}", slots.size(), providerId, date);
        return slots;
    }
}
