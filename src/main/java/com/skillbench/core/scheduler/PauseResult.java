package com.skillbench.core.scheduler;

/**
 * @param checkpoint completed + failed tasks at the moment of the pause
 */
public record PauseResult(boolean paused, int checkpoint) {
}
