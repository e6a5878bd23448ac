package com.ai.leasing.integration;

import com.twilio.exception.ApiConnectionException;
import com.twilio.exception.ApiException;
import com.twilio.exception.TwilioException;
import com.twilio.http.TwilioRestClient;
import com.twilio.rest.api.v2010.account.Message;
import com.twilio.type.PhoneNumber;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Sends WhatsApp messages through Twilio. Holds no delivery state: repeated sends are
 * prevented by the caller's persisted task status, and the dedup key is only used to
 * trace a message through the logs.
 */
@Component
public class TwilioMessageSender implements MessageSender {

    private static final Logger log = LoggerFactory.getLogger(TwilioMessageSender.class);

    private final String accountSid;
    private final String authToken;
    private final String from;

    private volatile TwilioRestClient client;

    @Autowired
    public TwilioMessageSender(@Value("${twilio.account-sid:}") String accountSid,
                               @Value("${twilio.auth-token:}") String authToken,
                               @Value("${twilio.whatsapp-from:}") String from) {
        this(accountSid, authToken, from, null);
    }

    TwilioMessageSender(String accountSid, String authToken, String from, TwilioRestClient client) {
        this.accountSid = accountSid;
        this.authToken = authToken;
        this.from = from;
        this.client = client;
    }

    @Override
    public DeliveryResult send(OutboundMessage message) {
        if (StringUtils.isAnyBlank(accountSid, authToken, from)) {
            log.error("Twilio credentials not set; cannot deliver {}", message.dedupKey());
            return DeliveryResult.permanentFailure("Twilio credentials not configured");
        }
        if (StringUtils.isBlank(message.phone())) {
            return DeliveryResult.permanentFailure("Lead has no phone number");
        }
        try {
            Message sent = Message.creator(whatsapp(message.phone()), whatsapp(from), message.content())
                    .create(client());
            log.info("Delivered {} to {} as {}", message.dedupKey(), message.phone(), sent.getSid());
            return DeliveryResult.success(sent.getSid());
        } catch (ApiConnectionException e) {
            log.warn("Twilio unreachable for {}: {}", message.dedupKey(), e.getMessage());
            return DeliveryResult.transientFailure(e.getMessage());
        } catch (ApiException e) {
            Integer status = e.getStatusCode();
            if (status == null || status >= 500 || status == 429) {
                log.warn("Twilio returned {} for {}: {}", status, message.dedupKey(), e.getMessage());
                return DeliveryResult.transientFailure("Twilio " + status + ": " + e.getMessage());
            }
            log.error("Twilio rejected {} with {}: {}", message.dedupKey(), status, e.getMessage());
            return DeliveryResult.permanentFailure("Twilio " + status + ": " + e.getMessage());
        } catch (TwilioException e) {
            log.warn("Twilio error for {}: {}", message.dedupKey(), e.getMessage());
            return DeliveryResult.transientFailure(e.getMessage());
        }
    }

    private TwilioRestClient client() {
        TwilioRestClient c = client;
        if (c == null) {
            synchronized (this) {
                if (client == null) {
                    client = new TwilioRestClient.Builder(accountSid, authToken).build();
                }
                c = client;
            }
        }
        return c;
    }

    private static PhoneNumber whatsapp(String phone) {
        String p = phone.trim();
        return new PhoneNumber(p.startsWith("whatsapp:") ? p : "whatsapp:" + p);
    }
}
