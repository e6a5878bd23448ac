package com.ai.leasing.controller;

import com.ai.leasing.dto.AppointmentResponse;
import com.ai.leasing.entity.Appointment;
import com.ai.leasing.service.LeadQualificationService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/appointments")
public class AppointmentController {

    private final LeadQualificationService qualificationService;

    public AppointmentController(LeadQualificationService qualificationService) {
        this.qualificationService = qualificationService;
    }

    @PostMapping("/{id}/cancel")
    public ResponseEntity<AppointmentResponse> cancel(@PathVariable Long id) {
        return ok(qualificationService.cancelAppointment(id));
    }

    @PostMapping("/{id}/complete")
    public ResponseEntity<AppointmentResponse> complete(@PathVariable Long id) {
        return ok(qualificationService.completeAppointment(id));
    }

    @PostMapping("/{id}/no-show")
    public ResponseEntity<AppointmentResponse> noShow(@PathVariable Long id) {
        return ok(qualificationService.markNoShow(id));
    }

    private static ResponseEntity<AppointmentResponse> ok(Appointment appointment) {
        return ResponseEntity.ok(AppointmentResponse.of(appointment, null, null));
    }
}
