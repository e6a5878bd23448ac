package com.ai.leasing.entity.converter;

import com.ai.leasing.entity.FollowupTask;
import jakarta.persistence.Converter;

@Converter
public class FollowupStatusConverter extends CodedEnumConverter<FollowupTask.Status> {

    public FollowupStatusConverter() {
        super(FollowupTask.Status.class);
    }
}
