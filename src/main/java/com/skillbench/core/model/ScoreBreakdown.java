package com.skillbench.core.model;

/**
 * Per-dimension averages for a skill (or a round), rounded to one decimal.
 */
public record ScoreBreakdown(
    double functionalCorrectness,
    double robustness,
    double readability,
    double conciseness,
    double complexityControl,
    double formatCompliance
) {

    public static final ScoreBreakdown EMPTY = new ScoreBreakdown(0, 0, 0, 0, 0, 0);

    public double get(ScoreDimension dimension) {
        return switch (dimension) {
            case FUNCTIONAL_CORRECTNESS -> functionalCorrectness;
            case ROBUSTNESS -> robustness;
            case READABILITY -> readability;
            case CONCISENESS -> conciseness;
            case COMPLEXITY_CONTROL -> complexityControl;
            case FORMAT_COMPLIANCE -> formatCompliance;
        };
    }

    /** Achieved / maximum for one dimension. */
    public double ratio(ScoreDimension dimension) {
        return get(dimension) / dimension.max();
    }
}
