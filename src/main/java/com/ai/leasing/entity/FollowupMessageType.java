package com.ai.leasing.entity;

public enum FollowupMessageType implements CodedEnum {
    EVENING_BEFORE_REMINDER("evening_before_reminder"),
    MORNING_OF_REMINDER("morning_of_reminder"),
    THREE_HOURS_BEFORE_REMINDER("three_hours_before_reminder"),
    FOLLOW_UP_AFTER_TOUR("follow_up_after_tour"),
    NO_SHOW_FOLLOW_UP("no_show_follow_up"),
    ABANDONED_LEAD_NUDGE("abandoned_lead_nudge"),
    TOUR_CANCELED_NOTICE("tour_canceled_notice");

    private final String code;

    FollowupMessageType(String code) {
        this.code = code;
    }

    @Override
    public String code() {
        return code;
    }
}
