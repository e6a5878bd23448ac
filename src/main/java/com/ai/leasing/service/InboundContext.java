package com.ai.leasing.service;

/**
 * Transport details that travel with an inbound event.
 *
 * @param messageId transport id used to drop redelivered messages, may be null
 * @param name      display name the channel reported for the sender, may be null
 * @param text      original message text, may be null
 */
public record InboundContext(String messageId, String name, String text) {

    public static InboundContext none() {
        return new InboundContext(null, null, null);
    }
}
