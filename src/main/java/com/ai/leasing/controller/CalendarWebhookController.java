package com.ai.leasing.controller;

import com.ai.leasing.service.LeadQualificationService;
import com.fasterxml.jackson.databind.JsonNode;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Calendly-style notifications: {@code {"event": "...", "payload": {"event": {"uri": ".../<id>"}}}}.
 * Unknown events are acknowledged so the sender does not retry them.
 */
@RestController
public class CalendarWebhookController {

    private static final Logger log = LoggerFactory.getLogger(CalendarWebhookController.class);

    private final LeadQualificationService qualificationService;

    public CalendarWebhookController(LeadQualificationService qualificationService) {
        this.qualificationService = qualificationService;
    }

    @PostMapping("/webhooks/calendar")
    public ResponseEntity<Map<String, Object>> notification(@RequestBody JsonNode body) {
        String type = body.path("event").asText("");
        String eventId = externalEventId(body.path("payload"));
        log.info("Calendar webhook {} for event {}", type, eventId);
        boolean applied = qualificationService.handleCalendarEvent(type, eventId);
        Map<String, Object> result = Map.of("status", "OK", "applied", applied);
        return ResponseEntity.ok(result);
    }

    static String externalEventId(JsonNode payload) {
        String uri = payload.path("event").path("uri").asText("");
        if (StringUtils.isBlank(uri)) {
            uri = payload.path("scheduled_event").path("uri").asText("");
        }
        if (StringUtils.isBlank(uri)) {
            return StringUtils.trimToNull(payload.path("event_id").asText(""));
        }
        return StringUtils.trimToNull(StringUtils.substringAfterLast(StringUtils.removeEnd(uri, "/"), "/"));
    }
}
