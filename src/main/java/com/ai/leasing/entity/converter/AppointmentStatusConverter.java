package com.ai.leasing.entity.converter;

import com.ai.leasing.entity.Appointment;
import jakarta.persistence.Converter;

@Converter
public class AppointmentStatusConverter extends CodedEnumConverter<Appointment.Status> {

    public AppointmentStatusConverter() {
        super(Appointment.Status.class);
    }
}
