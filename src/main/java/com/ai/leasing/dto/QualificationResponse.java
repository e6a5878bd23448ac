package com.ai.leasing.dto;

import lombok.Builder;
import lombok.Getter;

import java.time.LocalDate;
import java.util.List;

/**
 * Result of one inbound event: where the lead moved and what the bot answers.
 */
@Getter
@Builder
public class QualificationResponse {

    private final String phone;
    private final String previousStage;
    private final String stage;
    private final boolean duplicate;
    @Builder.Default
    private final List<String> replies = List.of();
    @Builder.Default
    private final List<UnitSummary> recommendations = List.of();
    private final String noMatchReason;
    private final LocalDate earliestAvailable;
}
