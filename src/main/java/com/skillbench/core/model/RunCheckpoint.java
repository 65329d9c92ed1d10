package com.skillbench.core.model;

/**
 * Progress counters persisted in the project config after every task.
 */
public record RunCheckpoint(
    int totalTasks,
    int completedTasks,
    int failedTasks,
    int lastCheckpoint
) {

    public static RunCheckpoint of(int total, int completed, int failed) {
        return new RunCheckpoint(total, completed, failed, completed + failed);
    }
}
