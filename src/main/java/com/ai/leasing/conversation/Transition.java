package com.ai.leasing.conversation;

import java.util.List;

public record Transition(LeadStage from, QualificationState next, List<SideEffect> effects) {

    public Transition {
        effects = effects == null ? List.of() : List.copyOf(effects);
    }

    public LeadStage to() {
        return next.stage();
    }

    public boolean stageChanged() {
        return from != next.stage();
    }

    public boolean has(Class<? extends SideEffect> type) {
        return effects.stream().anyMatch(type::isInstance);
    }
}
