package com.skillbench.core.model;

/**
 * Short description of the last finished task, carried on progress events.
 */
public record TaskOutcome(
    String skillId,
    String caseId,
    ResultStatus status,
    Integer score
) {
}
