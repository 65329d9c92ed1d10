package com.skillbench.core.model;

/**
 * Rubric score of one task output. {@code total} is always the sum of the six sub-scores.
 */
public record Score(
    int functionalCorrectness,
    int robustness,
    int readability,
    int conciseness,
    int complexityControl,
    int formatCompliance,
    int total
) {

    /**
     * Builds a score from the six sub-scores, clamping each to its dimension's range
     * and deriving the total.
     */
    public static Score of(int functionalCorrectness, int robustness, int readability,
                           int conciseness, int complexityControl, int formatCompliance) {
        int fc = clamp(functionalCorrectness, ScoreDimension.FUNCTIONAL_CORRECTNESS);
        int rb = clamp(robustness, ScoreDimension.ROBUSTNESS);
        int rd = clamp(readability, ScoreDimension.READABILITY);
        int cn = clamp(conciseness, ScoreDimension.CONCISENESS);
        int cc = clamp(complexityControl, ScoreDimension.COMPLEXITY_CONTROL);
        int fm = clamp(formatCompliance, ScoreDimension.FORMAT_COMPLIANCE);
        return new Score(fc, rb, rd, cn, cc, fm, fc + rb + rd + cn + cc + fm);
    }

    public int get(ScoreDimension dimension) {
        return switch (dimension) {
            case FUNCTIONAL_CORRECTNESS -> functionalCorrectness;
            case ROBUSTNESS -> robustness;
            case READABILITY -> readability;
            case CONCISENESS -> conciseness;
            case COMPLEXITY_CONTROL -> complexityControl;
            case FORMAT_COMPLIANCE -> formatCompliance;
        };
    }

    private static int clamp(int value, ScoreDimension dimension) {
        return Math.max(0, Math.min(dimension.max(), value));
    }
}
