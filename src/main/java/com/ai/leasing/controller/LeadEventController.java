package com.ai.leasing.controller;

import com.ai.leasing.dto.AppointmentResponse;
import com.ai.leasing.dto.InboundEventRequest;
import com.ai.leasing.dto.QualificationResponse;
import com.ai.leasing.dto.TourRequest;
import com.ai.leasing.service.InboundContext;
import com.ai.leasing.service.LeadQualificationService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/leads")
public class LeadEventController {

    private static final Logger log = LoggerFactory.getLogger(LeadEventController.class);

    private final LeadQualificationService qualificationService;

    public LeadEventController(LeadQualificationService qualificationService) {
        this.qualificationService = qualificationService;
    }

    @PostMapping("/{phone}/events")
    public ResponseEntity<QualificationResponse> event(@PathVariable String phone,
                                                       @RequestBody InboundEventRequest request) {
        log.debug("Inbound {} for {}", request.getType(), phone);
        QualificationResponse response = qualificationService.handleEvent(phone, request.toEvent(),
                new InboundContext(request.getMessageId(), request.getName(), request.getText()));
        return ResponseEntity.ok(response);
    }

    @PostMapping("/{phone}/tours")
    public ResponseEntity<AppointmentResponse> tour(@PathVariable String phone, @RequestBody TourRequest request) {
        if (request.getScheduledTime() == null) {
            throw new IllegalArgumentException("scheduledTime is required");
        }
        return ResponseEntity.ok(qualificationService.requestTour(
                phone, request.getUnitId(), request.getScheduledTime().toInstant()));
    }
}
