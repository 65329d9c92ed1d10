package com.skillbench.core.scheduler;

import com.skillbench.core.model.RunProgress;

/**
 * Port used by the iteration loop to run a project's full Skill x Case matrix
 * and wait for it.
 */
public interface EvaluationRunner {

    /**
     * Starts a run and blocks until it completes. A pause keeps the caller waiting
     * until the run is resumed or stopped.
     *
     * @return the final progress, status completed
     * @throws RunInterruptedException if the run is stopped
     * @throws com.skillbench.core.state.EvaluationStateException if a run could not be started
     */
    RunProgress runToCompletion(String projectId);
}
