package com.skillbench.core.recompose;

import com.skillbench.core.model.Round;
import com.skillbench.core.model.ScoreDimension;
import com.skillbench.core.model.Strategy;

import java.util.List;

/**
 * Inputs for one recomposition.
 *
 * @param retentionRules     free-text rules the new skill must honour
 * @param selectedSegmentIds advantage segments to fuse; empty means all of them
 * @param strategy           exploration strategy steering the rewrite
 * @param focusDimension     dimension to improve, only meaningful for DIMENSION_FOCUS
 * @param scoreHistory       completed rounds so far, oldest first
 */
public record RecomposeRequest(
    String retentionRules,
    List<String> selectedSegmentIds,
    Strategy strategy,
    ScoreDimension focusDimension,
    List<Round> scoreHistory
) {

    public RecomposeRequest {
        retentionRules = retentionRules == null ? "" : retentionRules;
        selectedSegmentIds = selectedSegmentIds == null ? List.of() : List.copyOf(selectedSegmentIds);
        strategy = strategy == null ? Strategy.GREEDY : strategy;
        scoreHistory = scoreHistory == null ? List.of() : List.copyOf(scoreHistory);
    }
}
