package com.ai.leasing.controller;

import com.ai.leasing.entity.Appointment;
import com.ai.leasing.entity.Unit;
import com.ai.leasing.exception.NotFoundException;
import com.ai.leasing.exception.SchedulingException;
import com.ai.leasing.service.LeadQualificationService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(AppointmentController.class)
@TestPropertySource(properties = {"leasing.api-key=test-key", "leasing.scheduling.enabled=false"})
class AppointmentControllerTest {

    @Autowired
    private MockMvc mvc;

    @MockBean
    private LeadQualificationService qualificationService;

    @Test
    void cancelReturnsCanceledAppointment() throws Exception {
        when(qualificationService.cancelAppointment(9L)).thenReturn(appointment(Appointment.Status.CANCELED));

        mvc.perform(post("/api/appointments/{id}/cancel", 9L).header("X-Api-Key", "test-key"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.id").value(9))
                .andExpect(jsonPath("$.unitId").value(3))
                .andExpect(jsonPath("$.status").value("canceled"))
                .andExpect(jsonPath("$.externalEventId").value("EVT-9"));
    }

    @Test
    void completingCanceledTourIsConflict() throws Exception {
        when(qualificationService.completeAppointment(9L)).thenThrow(new SchedulingException(
                SchedulingException.Reason.INVALID_STATE, "Appointment 9 is canceled"));

        mvc.perform(post("/api/appointments/{id}/complete", 9L).header("X-Api-Key", "test-key"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.reason").value("INVALID_STATE"))
                .andExpect(jsonPath("$.message").value("Appointment 9 is canceled"));
    }

    @Test
    void noShowOfUnknownAppointmentIsNotFound() throws Exception {
        when(qualificationService.markNoShow(404L)).thenThrow(new NotFoundException("Appointment 404 not found"));

        mvc.perform(post("/api/appointments/{id}/no-show", 404L).header("X-Api-Key", "test-key"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.status").value(404));
    }

    @Test
    void calendarTimeoutIsGatewayTimeout() throws Exception {
        when(qualificationService.cancelAppointment(9L)).thenThrow(new SchedulingException(
                SchedulingException.Reason.CALENDAR_TIMEOUT, "Calendar did not answer"));

        mvc.perform(post("/api/appointments/{id}/cancel", 9L).header("X-Api-Key", "test-key"))
                .andExpect(status().isGatewayTimeout())
                .andExpect(jsonPath("$.reason").value("CALENDAR_TIMEOUT"));
    }

    @Test
    void calendarRejectionIsBadGateway() throws Exception {
        when(qualificationService.cancelAppointment(9L)).thenThrow(new SchedulingException(
                SchedulingException.Reason.CALENDAR_REJECTED, "Calendar refused the cancel"));

        mvc.perform(post("/api/appointments/{id}/cancel", 9L).header("X-Api-Key", "test-key"))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.reason").value("CALENDAR_REJECTED"));
    }

    @Test
    void missingApiKeyIsUnauthorized() throws Exception {
        mvc.perform(post("/api/appointments/{id}/cancel", 9L))
                .andExpect(status().isUnauthorized());
    }

    private static Appointment appointment(Appointment.Status status) {
        return Appointment.builder()
                .id(9L)
                .unit(Unit.builder().id(3L).unitNumber("B1").build())
                .externalEventId("EVT-9")
                .scheduledTime(Instant.parse("2025-03-12T12:00:00Z"))
                .status(status)
                .build();
    }
}
