package com.ai.leasing.entity.converter;

import com.ai.leasing.conversation.LeadStage;
import jakarta.persistence.Converter;

@Converter
public class LeadStageConverter extends CodedEnumConverter<LeadStage> {

    public LeadStageConverter() {
        super(LeadStage.class);
    }
}
