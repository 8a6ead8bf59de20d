package com.ai.telehealth.service;

import com.ai.telehealth.dto.TimeSlot;
import com.ai.telehealth.entity.Appointment;
import com.ai.telehealth.entity.ProviderAvailability;
import com.ai.telehealth.entity.ProviderTimeOff;
import com.ai.telehealth.exception.ConflictReason;
import com.ai.telehealth.exception.InvalidTimeRangeException;

import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Availability rules as pure functions over availability rows, time-off rows and
 * appointments. Callers load the rows; nothing here touches the store.
 */
public final class SlotCalculator {

    public static final Duration SLOT_DURATION = Duration.ofMinutes(30);

    private SlotCalculator() {
    }

    /**
     * Open slots of one provider on {@code date}, in chronological order.
     * Rows for other weekdays, disabled rows and non-blocking appointments are ignored,
     * so callers may pass wider collections than strictly needed.
     */
    public static List<TimeSlot> resolveSlots(LocalDate date,
                                              Collection<ProviderAvailability> availability,
                                              Collection<ProviderTimeOff> timeOff,
                                              Collection<Appointment> appointments) {
        if (timeOff.stream().anyMatch(t -> coversDay(t, date))) {
            return List.of();
        }

        int dayOfWeek = dayIndex(date);
        List<ProviderAvailability> rows = availability.stream()
                .filter(ProviderAvailability::isEnabled)
                .filter(r -> r.getDayOfWeek() == dayOfWeek)
                .toList();
        if (rows.isEmpty()) {
            return List.of();
        }

        SortedSet<TimeSlot> candidates = new TreeSet<>(
                Comparator.comparing(TimeSlot::start).thenComparing(TimeSlot::end));
        for (ProviderAvailability row : rows) {
            LocalDateTime rowEnd = date.atTime(row.getEndTime());
            for (LocalDateTime t = date.atTime(row.getStartTime());
                 !t.plus(SLOT_DURATION).isAfter(rowEnd);
                 t = t.plus(SLOT_DURATION)) {
                candidates.add(new TimeSlot(t.toLocalTime(), t.plus(SLOT_DURATION).toLocalTime()));
            }
        }

        List<Appointment> blocking = appointments.stream()
                .filter(a -> a.getStatus().isActive())
                .toList();
        List<TimeSlot> open = new ArrayList<>();
        for (TimeSlot slot : candidates) {
            LocalDateTime slotStart = date.atTime(slot.start());
            LocalDateTime slotEnd = slotStart.plus(SLOT_DURATION);
            boolean taken = blocking.stream()
                    .anyMatch(a -> overlaps(a.getScheduledTime(), a.getEndTime(), slotStart, slotEnd));
            if (!taken) {
                open.add(slot);
            }
        }
        return open;
    }

    /**
     * First rule the range [start, end) breaks, or empty when it can be booked.
     *
     * @param ignoreAppointmentId appointment whose own slot does not count as a conflict; may be null
     */
    public static Optional<ConflictReason> findConflict(LocalDateTime start,
                                                        LocalDateTime end,
                                                        Collection<ProviderAvailability> availability,
                                                        Collection<ProviderTimeOff> timeOff,
                                                        Collection<Appointment> appointments,
                                                        Long ignoreAppointmentId) {
        if (!withinSingleWindow(start, end, availability)) {
            return Optional.of(ConflictReason.OUTSIDE_AVAILABILITY);
        }
        boolean onTimeOff = timeOff.stream()
                .anyMatch(t -> t.getStartTime().isBefore(end) && !t.getEndTime().isBefore(start));
        if (onTimeOff) {
            return Optional.of(ConflictReason.TIME_OFF);
        }
        boolean overlapping = appointments.stream()
                .filter(a -> a.getStatus().isActive())
                .filter(a -> ignoreAppointmentId == null || !Objects.equals(a.getId(), ignoreAppointmentId))
                .anyMatch(a -> overlaps(a.getScheduledTime(), a.getEndTime(), start, end));
        if (overlapping) {
            return Optional.of(ConflictReason.OVERLAPPING_APPOINTMENT);
        }
        return Optional.empty();
    }

    /**
     * Both ends of the range fall inside one enabled row for the start's weekday.
     */
    static boolean withinSingleWindow(LocalDateTime start, LocalDateTime end,
                                      Collection<ProviderAvailability> availability) {
        if (!start.toLocalDate().equals(end.toLocalDate())) {
            return false;
        }
        int dayOfWeek = dayIndex(start.toLocalDate());
        LocalTime from = start.toLocalTime();
        LocalTime to = end.toLocalTime();
        return availability.stream()
                .filter(ProviderAvailability::isEnabled)
                .filter(r -> r.getDayOfWeek() == dayOfWeek)
                .anyMatch(r -> !r.getStartTime().isAfter(from) && !to.isAfter(r.getEndTime()));
    }

    /**
     * Half-open interval test: [aStart, aEnd) and [bStart, bEnd) share an instant.
     */
    public static boolean overlaps(LocalDateTime aStart, LocalDateTime aEnd,
                                   LocalDateTime bStart, LocalDateTime bEnd) {
        return aStart.isBefore(bEnd) && aEnd.isAfter(bStart);
    }

    public static boolean coversDay(ProviderTimeOff timeOff, LocalDate date) {
        return !timeOff.getStartTime().isAfter(date.atTime(LocalTime.MAX))
                && !timeOff.getEndTime().isBefore(date.atStartOfDay());
    }

    /**
     * 0 = Monday .. 6 = Sunday, the numbering availability rows use.
     */
    public static int dayIndex(LocalDate date) {
        return date.getDayOfWeek().getValue() - 1;
    }

    public static void requireValidRange(LocalDateTime start, LocalDateTime end) {
        if (start == null || end == null) {
            throw new InvalidTimeRangeException("Start and end time are required.");
        }
        if (!end.isAfter(start)) {
            throw new InvalidTimeRangeException("End time must be after start time.");
        }
    }
}
