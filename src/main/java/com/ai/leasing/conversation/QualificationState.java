package com.ai.leasing.conversation;

import java.time.LocalDate;

/**
 * Value snapshot of the mutable part of a lead. The state machine only ever sees
 * this record, never the entity.
 */
public record QualificationState(
        LeadStage stage,
        Boolean hasPayslips,
        Boolean canPayDeposit,
        LocalDate moveInDate,
        LeadProfile profile
) {

    public QualificationState {
        if (stage == null) throw new IllegalArgumentException("stage is required");
        if (profile == null) profile = LeadProfile.empty();
    }

    public static QualificationState initial() {
        return new QualificationState(LeadStage.NEW, null, null, null, LeadProfile.empty());
    }

    public QualificationState withStage(LeadStage next) {
        return new QualificationState(next, hasPayslips, canPayDeposit, moveInDate, profile);
    }

    public QualificationState withHasPayslips(boolean value) {
        return new QualificationState(stage, value, canPayDeposit, moveInDate, profile);
    }

    public QualificationState withCanPayDeposit(boolean value) {
        return new QualificationState(stage, hasPayslips, value, moveInDate, profile);
    }

    public QualificationState withMoveInDate(LocalDate value) {
        return new QualificationState(stage, hasPayslips, canPayDeposit, value, profile);
    }

    public QualificationState withProfile(LeadProfile value) {
        return new QualificationState(stage, hasPayslips, canPayDeposit, moveInDate, value);
    }
}
