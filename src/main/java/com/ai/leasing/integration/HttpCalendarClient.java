package com.ai.leasing.integration;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.io.IOException;
import java.net.SocketTimeoutException;
import java.time.Duration;

/**
 * JSON-over-HTTP calendar client. Expects {@code POST /scheduled_events} to answer
 * with the created event's {@code id} (or a {@code uri} ending in it) and
 * {@code POST /scheduled_events/{id}/cancellation} to cancel.
 */
@Component
public class HttpCalendarClient implements CalendarClient {

    private static final Logger log = LoggerFactory.getLogger(HttpCalendarClient.class);

    private final RestTemplate restTemplate;
    private final ObjectMapper mapper;
    private final String baseUrl;
    private final String apiToken;

    public HttpCalendarClient(RestTemplateBuilder builder,
                              ObjectMapper mapper,
                              @Value("${calendar.base-url:}") String baseUrl,
                              @Value("${calendar.api-token:}") String apiToken,
                              @Value("${calendar.connect-timeout:3s}") Duration connectTimeout,
                              @Value("${calendar.read-timeout:10s}") Duration readTimeout) {
        this.restTemplate = builder
                .setConnectTimeout(connectTimeout)
                .setReadTimeout(readTimeout)
                .build();
        this.mapper = mapper;
        this.baseUrl = StringUtils.removeEnd(StringUtils.trimToEmpty(baseUrl), "/");
        this.apiToken = apiToken;
    }

    @Override
    public String createEvent(TourBooking booking) throws CalendarException {
        ObjectNode body = mapper.createObjectNode();
        body.put("start_time", booking.start().toString());
        body.put("end_time", booking.end().toString());
        body.put("name", booking.title());
        body.put("location", booking.location());
        ObjectNode invitee = body.putObject("invitee");
        invitee.put("name", booking.attendee().name());
        invitee.put("email", booking.attendee().email());
        invitee.put("phone", booking.attendee().phone());

        JsonNode response = post("/scheduled_events", body);
        String id = response.path("id").asText("");
        if (StringUtils.isBlank(id)) {
            id = StringUtils.substringAfterLast(response.path("uri").asText(""), "/");
        }
        if (StringUtils.isBlank(id)) {
            throw new CalendarException(CalendarException.Kind.REJECTED, "Calendar response carried no event id");
        }
        log.info("Calendar event {} created for {}", id, booking.start());
        return id;
    }

    @Override
    public void cancelEvent(String externalEventId, String reason) throws CalendarException {
        ObjectNode body = mapper.createObjectNode();
        body.put("reason", StringUtils.defaultString(reason));
        post("/scheduled_events/" + externalEventId + "/cancellation", body);
        log.info("Calendar event {} canceled", externalEventId);
    }

    private JsonNode post(String path, ObjectNode body) throws CalendarException {
        if (StringUtils.isBlank(baseUrl)) {
            throw new CalendarException(CalendarException.Kind.UNAVAILABLE, "calendar.base-url is not configured");
        }
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        if (StringUtils.isNotBlank(apiToken)) {
            headers.setBearerAuth(apiToken.trim());
        }
        try {
            ResponseEntity<String> response = restTemplate.postForEntity(
                    baseUrl + path, new HttpEntity<>(mapper.writeValueAsString(body), headers), String.class);
            String raw = response.getBody();
            return StringUtils.isBlank(raw) ? mapper.createObjectNode() : mapper.readTree(raw);
        } catch (HttpStatusCodeException e) {
            CalendarException.Kind kind = e.getStatusCode().is4xxClientError()
                    ? CalendarException.Kind.REJECTED
                    : CalendarException.Kind.UNAVAILABLE;
            throw new CalendarException(kind, "Calendar returned " + e.getStatusCode().value() + " for " + path, e);
        } catch (ResourceAccessException e) {
            CalendarException.Kind kind = e.getCause() instanceof SocketTimeoutException
                    ? CalendarException.Kind.TIMEOUT
                    : CalendarException.Kind.UNAVAILABLE;
            throw new CalendarException(kind, "Calendar unreachable: " + e.getMessage(), e);
        } catch (RestClientException | IOException e) {
            throw new CalendarException(CalendarException.Kind.UNAVAILABLE, "Calendar call failed: " + e.getMessage(), e);
        }
    }
}
