package com.ai.leasing.exception;

import com.ai.leasing.conversation.LeadStage;
import lombok.Getter;

/**
 * An event that is malformed, out of order, or arrives after the lead reached a
 * terminal stage. The lead is left untouched.
 */
@Getter
public class InvalidTransitionException extends RuntimeException {

    private final LeadStage currentStage;

    public InvalidTransitionException(LeadStage currentStage, String message) {
        super(message);
        this.currentStage = currentStage;
    }
}
