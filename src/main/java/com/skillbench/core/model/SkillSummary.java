package com.skillbench.core.model;

/**
 * One ranked entry of the run summary.
 */
public record SkillSummary(
    String skillId,
    String skillName,
    String skillVersion,
    int completedCases,
    int failedCases,
    int scoredCases,
    double avgScore,
    ScoreBreakdown scoreBreakdown,
    int rank
) {
}
