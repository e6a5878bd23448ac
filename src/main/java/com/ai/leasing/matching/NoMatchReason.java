package com.ai.leasing.matching;

import com.ai.leasing.conversation.LeadStage;

/**
 * Why matching came back empty. Only a late availability date keeps the lead
 * as a future fit; everything else is a plain no fit.
 */
public enum NoMatchReason {
    AVAILABILITY_DATE(LeadStage.FUTURE_FIT),
    BUDGET(LeadStage.NO_FIT),
    OTHER_CONSTRAINTS(LeadStage.NO_FIT),
    NO_INVENTORY(LeadStage.NO_FIT);

    private final LeadStage outcome;

    NoMatchReason(LeadStage outcome) {
        this.outcome = outcome;
    }

    public LeadStage outcome() {
        return outcome;
    }
}
