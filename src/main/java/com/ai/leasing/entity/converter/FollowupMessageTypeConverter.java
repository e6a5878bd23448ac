package com.ai.leasing.entity.converter;

import com.ai.leasing.entity.FollowupMessageType;
import jakarta.persistence.Converter;

@Converter
public class FollowupMessageTypeConverter extends CodedEnumConverter<FollowupMessageType> {

    public FollowupMessageTypeConverter() {
        super(FollowupMessageType.class);
    }
}
