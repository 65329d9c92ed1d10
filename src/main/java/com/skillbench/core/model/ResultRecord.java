package com.skillbench.core.model;

import java.time.Instant;

/**
 * Persisted outcome of one Task. Written once per attempt; a retry overwrites the
 * previous record for the same (skill, case).
 * <p>
 * A record with status {@link ResultStatus#FAILED} never carries a score.
 */
public record ResultRecord(
    String caseId,
    String skillId,
    String skillVersion,
    String baselineId,
    String baselineVersion,
    Instant executedAt,
    ResultStatus status,
    String input,
    String expectedOutput,
    String actualOutput,
    long durationMs,
    String modelVersion,
    String error,
    String errorCode,
    Score scores,
    String scoreReasoning,
    Instant scoreEvaluatedAt
) {

    public ResultRecord {
        if (status == ResultStatus.FAILED) {
            scores = null;
        }
    }

    public boolean isCompleted() {
        return status == ResultStatus.COMPLETED;
    }

    public boolean isScored() {
        return isCompleted() && scores != null;
    }
}
