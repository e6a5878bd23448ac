package com.ai.leasing.integration;

/**
 * @param dedupKey stable per logical message, derived from the persisted followup id
 */
public record OutboundMessage(String phone, String content, String dedupKey) {
}
