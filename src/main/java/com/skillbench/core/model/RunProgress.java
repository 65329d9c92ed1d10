package com.skillbench.core.model;

/**
 * Snapshot of a run's progress, delivered to listeners and returned by progress queries.
 * Always carries both completed and failed counts so callers can tell
 * "done with failures" from "done cleanly".
 */
public record RunProgress(
    String projectId,
    RunStatus status,
    int totalTasks,
    int completedTasks,
    int failedTasks,
    TaskOutcome lastResult
) {

    public int remainingTasks() {
        return totalTasks - completedTasks - failedTasks;
    }
}
