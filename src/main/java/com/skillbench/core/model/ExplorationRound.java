package com.skillbench.core.model;

import java.util.List;

/**
 * Exploration-log entry for one inter-round beam step, losers included.
 */
public record ExplorationRound(
    int round,
    int plateauLevel,
    List<Strategy> strategiesTried,
    String focusDimension,
    List<Candidate> candidates,
    String winnerSkillId,
    String warning
) {

    public ExplorationRound {
        strategiesTried = strategiesTried == null ? List.of() : List.copyOf(strategiesTried);
        candidates = candidates == null ? List.of() : List.copyOf(candidates);
    }
}
