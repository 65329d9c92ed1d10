package com.skillbench.core.model;

import java.util.List;

/**
 * Iteration progress assembled from the round snapshots on disk.
 *
 * @param status       running, paused, stopped or completed
 * @param currentRound round currently running, or the number of completed rounds when idle
 * @param totalRounds  snapshots found so far
 * @param currentPhase phase of the round in flight ("test", "analysis", "explore") or "idle"
 * @param rounds       per-round status
 */
public record IterationProgress(
    String status,
    int currentRound,
    int totalRounds,
    String currentPhase,
    List<RoundProgress> rounds
) {

    public record RoundProgress(int round, RoundStatus status, Double avgScore) {
    }
}
