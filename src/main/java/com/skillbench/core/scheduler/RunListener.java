package com.skillbench.core.scheduler;

import com.skillbench.core.model.RunProgress;

/**
 * Receives progress of a test run through the {@link com.skillbench.core.events.EventBus}:
 * one call per finished task, then one terminal
 * call with status completed, paused or interrupted. Invoked from execution-stream threads.
 */
@FunctionalInterface
public interface RunListener {

    RunListener NONE = progress -> { };

    void onProgress(RunProgress progress);
}
