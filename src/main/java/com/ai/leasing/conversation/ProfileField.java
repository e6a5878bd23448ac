package com.ai.leasing.conversation;

/**
 * Preference fields collected after the gates pass. Declaration order is the order
 * the bot asks for them.
 */
public enum ProfileField {
    ROOMS,
    BUDGET,
    HAS_PARKING,
    PREFERRED_AREA,
    FLOOR_RANGE,
    NEEDS_FURNISHED,
    PET_OWNER
}
