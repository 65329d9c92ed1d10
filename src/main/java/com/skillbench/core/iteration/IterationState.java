package com.skillbench.core.iteration;

/**
 * Mutable flags of one in-flight iteration. The loop polls them at round and
 * candidate boundaries.
 */
final class IterationState {

    private final String iterationId;
    private final String projectId;
    private volatile boolean paused;
    private volatile boolean stopped;
    private volatile String phase = "idle";

    IterationState(String iterationId, String projectId) {
        this.iterationId = iterationId;
        this.projectId = projectId;
    }

    String iterationId() {
        return iterationId;
    }

    String projectId() {
        return projectId;
    }

    boolean isPaused() {
        return paused;
    }

    boolean isStopped() {
        return stopped;
    }

    boolean isHalted() {
        return paused || stopped;
    }

    void pause() {
        paused = true;
    }

    void stop() {
        stopped = true;
    }

    String phase() {
        return phase;
    }

    void phase(String phase) {
        this.phase = phase;
    }
}
