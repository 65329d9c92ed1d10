package com.skillbench.core.model;

import java.util.List;

/**
 * Parameters of an iteration run.
 *
 * @param recomposedSkillId         skill tested in round 1
 * @param maxRounds                 upper bound on rounds (default 3)
 * @param stopThreshold             stop early once a round's average reaches this (nullable)
 * @param retentionRules            free-text rules passed to recomposition
 * @param selectedSegmentIds        advantage segments to recompose from (empty = all)
 * @param beamWidth                 candidates tried between rounds (default 1)
 * @param plateauThreshold          |delta| below this counts as "no improvement" (default 1.0)
 * @param plateauRoundsBeforeEscape plateau run length before escalating (default 2)
 */
public record IterationParams(
    String recomposedSkillId,
    Integer maxRounds,
    Double stopThreshold,
    String retentionRules,
    List<String> selectedSegmentIds,
    Integer beamWidth,
    Double plateauThreshold,
    Integer plateauRoundsBeforeEscape
) {

    public IterationParams {
        maxRounds = maxRounds == null ? 3 : maxRounds;
        retentionRules = retentionRules == null ? "" : retentionRules;
        selectedSegmentIds = selectedSegmentIds == null ? List.of() : List.copyOf(selectedSegmentIds);
        beamWidth = beamWidth == null ? 1 : beamWidth;
        plateauThreshold = plateauThreshold == null ? 1.0 : plateauThreshold;
        plateauRoundsBeforeEscape = plateauRoundsBeforeEscape == null ? 2 : plateauRoundsBeforeEscape;
    }

    public static IterationParams of(String skillId, int maxRounds, int beamWidth, Double stopThreshold) {
        return new IterationParams(skillId, maxRounds, stopThreshold, null, null, beamWidth, null, null);
    }
}
