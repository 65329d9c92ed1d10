package com.skillbench.core.model;

/**
 * One strategy-specific skill variant produced and tested during beam exploration.
 * Failed candidates carry a null skill id and score plus the error.
 */
public record Candidate(
    Strategy strategy,
    String skillId,
    Double avgScore,
    ScoreBreakdown scoreBreakdown,
    boolean won,
    String error
) {

    public static Candidate failed(Strategy strategy, String error) {
        return new Candidate(strategy, null, null, null, false, error);
    }

    public boolean succeeded() {
        return skillId != null && error == null;
    }

    public Candidate markWon(boolean won) {
        return new Candidate(strategy, skillId, avgScore, scoreBreakdown, won, error);
    }
}
