package com.skillbench.core.execution;

import com.skillbench.core.model.Score;

/**
 * Parsed rubric verdict for one task output.
 */
public record ScoringResult(Score score, String reasoning) {
}
