package com.ai.leasing.service;

import com.ai.leasing.entity.ConversationMessage;
import com.ai.leasing.entity.Lead;
import com.ai.leasing.repository.ConversationMessageRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

@Service
@RequiredArgsConstructor
public class ConversationLogService {

    private final ConversationMessageRepository repository;
    private final ObjectMapper mapper;
    private final Clock clock;

    @Transactional(readOnly = true)
    public boolean isDuplicate(Lead lead, String messageId) {
        if (lead.getId() == null || StringUtils.isBlank(messageId)) return false;
        return repository.existsByLead_IdAndMessageId(lead.getId(), messageId);
    }

    @Transactional
    public ConversationMessage logUser(Lead lead, String content, String messageId, Map<String, Object> metadata) {
        return append(lead, ConversationMessage.Direction.USER, content, messageId, metadata);
    }

    @Transactional
    public ConversationMessage logBot(Lead lead, String content, Map<String, Object> metadata) {
        return append(lead, ConversationMessage.Direction.BOT, content, null, metadata);
    }

    /** Events raised by the booking flow itself. Stored on the bot side, tagged with their source. */
    @Transactional
    public ConversationMessage logSystem(Lead lead, String content, Map<String, Object> metadata) {
        Map<String, Object> tagged = new LinkedHashMap<>();
        tagged.put("source", "system");
        if (metadata != null) tagged.putAll(metadata);
        return append(lead, ConversationMessage.Direction.BOT, content, null, tagged);
    }

    private ConversationMessage append(Lead lead, ConversationMessage.Direction direction, String content,
                                       String messageId, Map<String, Object> metadata) {
        return repository.save(ConversationMessage.builder()
                .lead(lead)
                .direction(direction)
                .content(StringUtils.defaultString(content))
                .messageId(StringUtils.trimToNull(messageId))
                .timestamp(clock.instant())
                .metadata(toJson(metadata))
                .build());
    }

    private String toJson(Map<String, Object> metadata) {
        if (metadata == null || metadata.isEmpty()) return null;
        try {
            return mapper.writeValueAsString(metadata);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Conversation metadata is not serializable", e);
        }
    }
}
