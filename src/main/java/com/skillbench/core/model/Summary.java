package com.skillbench.core.model;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Derived per-skill ranking for a run. Never authoritative: it can always be
 * rebuilt from the result records on disk.
 */
public record Summary(
    String projectId,
    Instant generatedAt,
    int totalCases,
    List<SkillSummary> ranking
) {

    public Summary {
        ranking = ranking == null ? List.of() : List.copyOf(ranking);
    }

    public Optional<SkillSummary> find(String skillId) {
        return ranking.stream().filter(r -> r.skillId().equals(skillId)).findFirst();
    }
}
