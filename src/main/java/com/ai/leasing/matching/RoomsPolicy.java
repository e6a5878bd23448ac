package com.ai.leasing.matching;

/** How a unit's room count is compared with the requested one. */
public enum RoomsPolicy {
    AT_LEAST,
    EXACT;

    public boolean accepts(int unitRooms, int requested) {
        return this == EXACT ? unitRooms == requested : unitRooms >= requested;
    }
}
