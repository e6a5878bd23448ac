package com.ai.leasing.integration;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.web.client.MockServerRestTemplateCustomizer;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class HttpCalendarClientTest {

    private static final TourBooking BOOKING = new TourBooking(
            Instant.parse("2025-03-12T12:00:00Z"), 30,
            new TourBooking.Attendee("Dana", "dana@example.com", "+972501234567"),
            "12 Herzl St", "Apartment tour - unit A1");

    private MockRestServiceServer server;
    private HttpCalendarClient client;

    @BeforeEach
    void setUp() {
        MockServerRestTemplateCustomizer customizer = new MockServerRestTemplateCustomizer();
        client = new HttpCalendarClient(new RestTemplateBuilder(customizer), new ObjectMapper(),
                "https://calendar.test/", "secret", Duration.ofSeconds(1), Duration.ofSeconds(1));
        server = customizer.getServer();
    }

    @Test
    void createEventReturnsId() throws Exception {
        server.expect(requestTo("https://calendar.test/scheduled_events"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(header("Authorization", "Bearer secret"))
                .andExpect(jsonPath("$.start_time").value("2025-03-12T12:00:00Z"))
                .andExpect(jsonPath("$.end_time").value("2025-03-12T12:30:00Z"))
                .andExpect(jsonPath("$.invitee.email").value("dana@example.com"))
                .andRespond(withSuccess("{\"id\":\"evt-1\"}", MediaType.APPLICATION_JSON));

        assertThat(client.createEvent(BOOKING)).isEqualTo("evt-1");
        server.verify();
    }

    @Test
    void createEventFallsBackToUriSuffix() throws Exception {
        server.expect(requestTo("https://calendar.test/scheduled_events"))
                .andRespond(withSuccess("{\"uri\":\"https://calendar.test/scheduled_events/ABC123\"}",
                        MediaType.APPLICATION_JSON));

        assertThat(client.createEvent(BOOKING)).isEqualTo("ABC123");
    }

    @Test
    void clientErrorIsRejected() {
        server.expect(requestTo("https://calendar.test/scheduled_events"))
                .andRespond(withStatus(HttpStatus.CONFLICT));

        assertThatThrownBy(() -> client.createEvent(BOOKING))
                .isInstanceOf(CalendarException.class)
                .extracting("kind").isEqualTo(CalendarException.Kind.REJECTED);
    }

    @Test
    void serverErrorIsUnavailable() {
        server.expect(requestTo("https://calendar.test/scheduled_events/evt-1/cancellation"))
                .andRespond(withStatus(HttpStatus.SERVICE_UNAVAILABLE));

        assertThatThrownBy(() -> client.cancelEvent("evt-1", "Canceled by lead"))
                .isInstanceOf(CalendarException.class)
                .satisfies(e -> assertThat(((CalendarException) e).isTransient()).isTrue());
    }

    @Test
    void cancelPostsReason() throws Exception {
        server.expect(requestTo("https://calendar.test/scheduled_events/evt-1/cancellation"))
                .andExpect(jsonPath("$.reason").value("Rescheduled"))
                .andRespond(withSuccess());

        client.cancelEvent("evt-1", "Rescheduled");
        server.verify();
    }

    @Test
    void missingBaseUrlIsUnavailable() {
        HttpCalendarClient unconfigured = new HttpCalendarClient(new RestTemplateBuilder(), new ObjectMapper(),
                " ", "", Duration.ofSeconds(1), Duration.ofSeconds(1));

        assertThatThrownBy(() -> unconfigured.createEvent(BOOKING))
                .isInstanceOf(CalendarException.class)
                .extracting("kind").isEqualTo(CalendarException.Kind.UNAVAILABLE);
    }
}
