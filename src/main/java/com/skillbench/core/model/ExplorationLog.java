package com.skillbench.core.model;

import java.time.Instant;
import java.util.List;

/**
 * Full candidate history of an iteration run.
 */
public record ExplorationLog(
    String projectId,
    String iterationId,
    Instant startedAt,
    Instant completedAt,
    IterationParams params,
    List<String> originalSkillIds,
    List<ExplorationRound> rounds,
    BestEver bestEver
) {

    public ExplorationLog {
        originalSkillIds = originalSkillIds == null ? List.of() : List.copyOf(originalSkillIds);
        rounds = rounds == null ? List.of() : List.copyOf(rounds);
    }

    public record BestEver(int round, Strategy strategy, String skillId, double avgScore) {
    }
}
