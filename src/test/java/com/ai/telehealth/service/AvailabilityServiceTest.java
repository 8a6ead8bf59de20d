package com.ai.telehealth.service;

import com.ai.telehealth.dto.AvailabilityRequest;
import com.ai.telehealth.dto.TimeOffRequest;
import com.ai.telehealth.entity.ProviderAvailability;
import com.ai.telehealth.entity.ProviderTimeOff;
import com.ai.telehealth.exception.InvalidTimeRangeException;
import com.ai.telehealth.exception.ResourceNotFoundException;
import com.ai.telehealth.repository.ProviderAvailabilityRepository;
import com.ai.telehealth.repository.ProviderTimeOffRepository;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AvailabilityServiceTest {

    @Mock
    private ProviderAvailabilityRepository availabilityRepository;
    @Mock
    private ProviderTimeOffRepository timeOffRepository;
    @Mock
    private IdentityService identityService;

    @InjectMocks
    private AvailabilityService availabilityService;

    @Test
    void addsEnabledWindowByDefault() {
        when(availabilityRepository.save(any(ProviderAvailability.class))).thenAnswer(inv -> inv.getArgument(0));

        ProviderAvailability row = availabilityService.addAvailability(1L,
                new AvailabilityRequest(1, LocalTime.of(9, 0), LocalTime.of(17, 0), null));

        assertThat(row.getProviderId()).isEqualTo(1L);
        assertThat(row.getDayOfWeek()).isEqualTo(1);
        assertThat(row.isEnabled()).isTrue();
    }

    @Test
    void rejectsEmptyWindow() {
        assertThatThrownBy(() -> availabilityService.addAvailability(1L,
                new AvailabilityRequest(1, LocalTime.of(9, 0), LocalTime.of(9, 0), true)))
                .isInstanceOf(InvalidTimeRangeException.class);
        verify(availabilityRepository, never()).save(any());
    }

    @Test
    void rejectsDayOutOfRange() {
        assertThatThrownBy(() -> availabilityService.addAvailability(1L,
                new AvailabilityRequest(7, LocalTime.of(9, 0), LocalTime.of(10, 0), true)))
                .isInstanceOf(InvalidTimeRangeException.class);
    }

    @Test
    void unknownProviderCannotGetAvailability() {
        doThrow(new ResourceNotFoundException("Provider", 9L)).when(identityService).requireProvider(9L);

        assertThatThrownBy(() -> availabilityService.addAvailability(9L,
                new AvailabilityRequest(1, LocalTime.of(9, 0), LocalTime.of(10, 0), true)))
                .isInstanceOf(ResourceNotFoundException.class);
    }

    @Test
    void updateCanDisableWindow() {
        ProviderAvailability row = ProviderAvailability.builder().id(4L).providerId(1L).dayOfWeek(1)
                .startTime(LocalTime.of(9, 0)).endTime(LocalTime.of(12, 0)).build();
        when(availabilityRepository.findById(4L)).thenReturn(Optional.of(row));
        when(availabilityRepository.save(row)).thenReturn(row);

        availabilityService.updateAvailability(1L, 4L, new AvailabilityRequest(2, LocalTime.of(10, 0), LocalTime.of(12, 0), false));

        assertThat(row.getDayOfWeek()).isEqualTo(2);
        assertThat(row.getStartTime()).isEqualTo(LocalTime.of(10, 0));
        assertThat(row.isEnabled()).isFalse();
    }

    @Test
    void cannotDeleteAnotherProvidersWindow() {
        ProviderAvailability row = ProviderAvailability.builder().id(4L).providerId(2L).build();
        when(availabilityRepository.findById(4L)).thenReturn(Optional.of(row));

        assertThatThrownBy(() -> availabilityService.deleteAvailability(1L, 4L))
                .isInstanceOf(ResourceNotFoundException.class);
        verify(availabilityRepository, never()).delete(any());
    }

    @Test
    void instantaneousTimeOffIsAllowed() {
        LocalDateTime at = LocalDateTime.of(2026, 11, 4, 12, 0);
        when(timeOffRepository.save(any(ProviderTimeOff.class))).thenAnswer(inv -> inv.getArgument(0));

        ProviderTimeOff timeOff = availabilityService.addTimeOff(1L, new TimeOffRequest(at, at, "Training"));

        assertThat(timeOff.getReason()).isEqualTo("Training");
    }

    @Test
    void timeOffEndingBeforeStartIsRejected() {
        LocalDateTime at = LocalDateTime.of(2026, 11, 4, 12, 0);

        assertThatThrownBy(() -> availabilityService.addTimeOff(1L, new TimeOffRequest(at, at.minusHours(1), null)))
                .isInstanceOf(InvalidTimeRangeException.class);
    }
}
