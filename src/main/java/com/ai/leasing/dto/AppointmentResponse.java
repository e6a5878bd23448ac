package com.ai.leasing.dto;

import com.ai.leasing.entity.Appointment;
import lombok.Builder;
import lombok.Getter;

import java.time.Instant;

@Getter
@Builder
public class AppointmentResponse {

    private final Long id;
    private final Long unitId;
    private final Instant scheduledTime;
    private final int durationMinutes;
    private final String status;
    private final String externalEventId;
    private final String leadStage;
    private final String reply;

    public static AppointmentResponse of(Appointment appointment, String leadStage, String reply) {
        return AppointmentResponse.builder()
                .id(appointment.getId())
                .unitId(appointment.getUnit() != null ? appointment.getUnit().getId() : null)
                .scheduledTime(appointment.getScheduledTime())
                .durationMinutes(appointment.getDurationMinutes())
                .status(appointment.getStatus().code())
                .externalEventId(appointment.getExternalEventId())
                .leadStage(leadStage)
                .reply(reply)
                .build();
    }
}
