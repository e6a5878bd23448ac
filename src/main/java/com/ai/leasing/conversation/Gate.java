package com.ai.leasing.conversation;

/**
 * The three qualifying questions, asked in declaration order.
 */
public enum Gate {
    PAYSLIPS(LeadStage.GATE_QUESTION_PAYSLIPS),
    DEPOSIT(LeadStage.GATE_QUESTION_DEPOSIT),
    MOVE_IN_DATE(LeadStage.GATE_QUESTION_MOVE_DATE);

    private final LeadStage stage;

    Gate(LeadStage stage) {
        this.stage = stage;
    }

    public LeadStage stage() {
        return stage;
    }
}
