package com.skillbench.core.model;

import java.time.Instant;
import java.util.List;

/**
 * The finalized Iteration Run. Written once at loop exit and never mutated.
 */
public record IterationReport(
    String projectId,
    String iterationId,
    Instant generatedAt,
    int totalRounds,
    StopReason stopReason,
    Double stopThreshold,
    int bestRound,
    String bestSkillId,
    String bestSkillName,
    double bestAvgScore,
    List<Round> rounds
) {

    public IterationReport {
        rounds = rounds == null ? List.of() : List.copyOf(rounds);
    }
}
