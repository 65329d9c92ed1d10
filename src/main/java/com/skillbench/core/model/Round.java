package com.skillbench.core.model;

import java.time.Instant;

/**
 * One iteration of the outer optimization loop. Also the shape of the per-round
 * snapshot document written under {@code iterations/round_<n>/config.json}.
 *
 * @param round          1-based round number
 * @param strategy       strategy that produced the tested skill (GREEDY for the starting skill)
 * @param skillId        skill tested this round
 * @param skillName      display name of that skill
 * @param retentionRules retention rules in force
 * @param avgScore       the skill's average score (null while running)
 * @param scoreDelta     change vs. the previous round (null for the first round)
 * @param scoreBreakdown per-dimension averages (null while running)
 * @param plateauLevel   plateau level computed after this round
 * @param status         snapshot status
 * @param startedAt      when the round started
 * @param completedAt    when the round completed (null unless completed)
 * @param error          failure reason when status is failed
 */
public record Round(
    int round,
    Strategy strategy,
    String skillId,
    String skillName,
    String retentionRules,
    Double avgScore,
    Double scoreDelta,
    ScoreBreakdown scoreBreakdown,
    Integer plateauLevel,
    RoundStatus status,
    Instant startedAt,
    Instant completedAt,
    String error
) {

    public static Round running(int round, Strategy strategy, String skillId, String skillName,
                                String retentionRules, Instant startedAt) {
        return new Round(round, strategy, skillId, skillName, retentionRules,
                null, null, null, null, RoundStatus.RUNNING, startedAt, null, null);
    }

    public Round completed(double avgScore, Double scoreDelta, ScoreBreakdown breakdown,
                           int plateauLevel, Instant completedAt) {
        return new Round(round, strategy, skillId, skillName, retentionRules,
                avgScore, scoreDelta, breakdown, plateauLevel, RoundStatus.COMPLETED, startedAt, completedAt, null);
    }

    public Round failed(String reason) {
        return new Round(round, strategy, skillId, skillName, retentionRules,
                avgScore, scoreDelta, scoreBreakdown, plateauLevel, RoundStatus.FAILED, startedAt, null, reason);
    }
}
