package com.ai.leasing.entity.converter;

import com.ai.leasing.entity.Unit;
import jakarta.persistence.Converter;

@Converter
public class UnitStatusConverter extends CodedEnumConverter<Unit.Status> {

    public UnitStatusConverter() {
        super(Unit.Status.class);
    }
}
