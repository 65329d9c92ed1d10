package com.skillbench.core.analysis;

import java.util.concurrent.CompletableFuture;

/**
 * Compares the skills of a project after a run and derives dimension leaders and
 * advantage segments. The iteration loop only waits for completion.
 */
public interface AnalysisCollaborator {

    /**
     * Starts the analysis in the background.
     *
     * @return completes with the persisted report, or exceptionally when the analysis fails
     */
    CompletableFuture<AnalysisReport> analyze(String projectId);
}
