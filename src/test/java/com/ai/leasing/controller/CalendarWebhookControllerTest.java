package com.ai.leasing.controller;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class CalendarWebhookControllerTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void eventIdFromEventUri() throws Exception {
        JsonNode payload = mapper.readTree("{\"event\":{\"uri\":\"https://api.calendly.com/scheduled_events/AAA111\"}}");

        assertThat(CalendarWebhookController.externalEventId(payload)).isEqualTo("AAA111");
    }

    @Test
    void eventIdFromScheduledEventUriWithTrailingSlash() throws Exception {
        JsonNode payload = mapper.readTree("{\"scheduled_event\":{\"uri\":\"https://cal.test/scheduled_events/BBB222/\"}}");

        assertThat(CalendarWebhookController.externalEventId(payload)).isEqualTo("BBB222");
    }

    @Test
    void eventIdFieldAsLastResort() throws Exception {
        assertThat(CalendarWebhookController.externalEventId(mapper.readTree("{\"event_id\":\" CCC333 \"}")))
                .isEqualTo("CCC333");
        assertThat(CalendarWebhookController.externalEventId(mapper.readTree("{}"))).isNull();
    }
}
