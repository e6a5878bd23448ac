package com.ai.leasing.conversation;

import com.ai.leasing.entity.CodedEnum;

/**
 * Funnel position of a lead. {@link #NEW} is the only initial stage;
 * gate failure, no fit, future fit and a booked tour end the qualification flow.
 */
public enum LeadStage implements CodedEnum {
    NEW("new"),
    GATE_QUESTION_PAYSLIPS("gate_question_payslips"),
    GATE_QUESTION_DEPOSIT("gate_question_deposit"),
    GATE_QUESTION_MOVE_DATE("gate_question_move_date"),
    COLLECTING_PROFILE("collecting_profile"),
    QUALIFIED("qualified"),
    SCHEDULING_IN_PROGRESS("scheduling_in_progress"),
    TOUR_SCHEDULED("tour_scheduled"),
    GATE_FAILED("gate_failed"),
    NO_FIT("no_fit"),
    FUTURE_FIT("future_fit");

    private final String code;

    LeadStage(String code) {
        this.code = code;
    }

    @Override
    public String code() {
        return code;
    }

    public boolean isTerminal() {
        switch (this) {
            case GATE_FAILED:
            case NO_FIT:
            case FUTURE_FIT:
            case TOUR_SCHEDULED:
                return true;
            default:
                return false;
        }
    }
}
