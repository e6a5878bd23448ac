package com.ai.leasing.entity.converter;

import com.ai.leasing.entity.CodedEnum;
import jakarta.persistence.AttributeConverter;

/**
 * Maps a closed enumeration to the exact string codes stored in the database.
 * Unknown codes fail loudly instead of producing a value outside the enumeration.
 */
public abstract class CodedEnumConverter<E extends Enum<E> & CodedEnum> implements AttributeConverter<E, String> {

    private final Class<E> type;

    protected CodedEnumConverter(Class<E> type) {
        this.type = type;
    }

    @Override
    public String convertToDatabaseColumn(E attribute) {
        return attribute == null ? null : attribute.code();
    }

    @Override
    public E convertToEntityAttribute(String dbData) {
        if (dbData == null) return null;
        for (E constant : type.getEnumConstants()) {
            if (constant.code().equals(dbData)) {
                return constant;
            }
        }
        throw new IllegalStateException("Unknown " + type.getSimpleName() + " code: " + dbData);
    }
}
