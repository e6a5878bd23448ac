package com.ai.leasing.integration;

/**
 * Outbound channel to leads. Implementations classify failures instead of throwing.
 */
public interface MessageSender {

    DeliveryResult send(OutboundMessage message);
}
