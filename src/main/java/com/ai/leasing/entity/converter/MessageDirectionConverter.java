package com.ai.leasing.entity.converter;

import com.ai.leasing.entity.ConversationMessage;
import jakarta.persistence.Converter;

@Converter
public class MessageDirectionConverter extends CodedEnumConverter<ConversationMessage.Direction> {

    public MessageDirectionConverter() {
        super(ConversationMessage.Direction.class);
    }
}
