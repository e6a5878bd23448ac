package com.ai.leasing.conversation;

/**
 * Work requested by a transition. The state machine only describes it; the
 * transactional service carries it out.
 */
public interface SideEffect {

    record AskGateQuestion(Gate gate) implements SideEffect {
    }

    record AskProfileField(ProfileField field) implements SideEffect {
    }

    record RunUnitMatching() implements SideEffect {
    }

    record AnnounceOutcome(LeadStage outcome) implements SideEffect {
    }

    record OfferAnotherSlot() implements SideEffect {
    }
}
