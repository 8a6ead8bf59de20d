package com.ai.telehealth.controller;

import com.ai.telehealth.dto.AvailabilityRequest;
import com.ai.telehealth.dto.TimeSlot;
import com.ai.telehealth.exception.InvalidTimeRangeException;
import com.ai.telehealth.service.AvailabilityService;
import com.ai.telehealth.service.SlotService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(ProviderScheduleController.class)
class ProviderScheduleControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private SlotService slotService;
    @MockBean
    private AvailabilityService availabilityService;

    @Test
    void slotsAreRenderedAsClockTimes() throws Exception {
        when(slotService.getAvailableSlots(1L, LocalDate.of(2026, 11, 3)))
                .thenReturn(List.of(new TimeSlot(LocalTime.of(9, 0), LocalTime.of(9, 30))));

        mockMvc.perform(get("/api/providers/1/slots").param("date", "2026-11-03"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].start").value("09:00"))
                .andExpect(jsonPath("$[0].end").value("09:30"));
    }

    @Test
    void dayOfWeekOutOfRangeFailsValidation() throws Exception {
        mockMvc.perform(post("/api/providers/1/availability")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"dayOfWeek\":9,\"startTime\":\"09:00:00\",\"endTime\":\"17:00:00\"}"))
                .andExpect(status().isBadRequest());
        verifyNoInteractions(availabilityService);
    }

    @Test
    void invertedWindowIsRejectedByService() throws Exception {
        when(availabilityService.addAvailability(eq(1L), any(AvailabilityRequest.class)))
                .thenThrow(new InvalidTimeRangeException("Availability window must end after it starts."));

        mockMvc.perform(post("/api/providers/1/availability")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"dayOfWeek\":1,\"startTime\":\"17:00:00\",\"endTime\":\"09:00:00\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("INVALID_TIME_RANGE"));
    }
}
