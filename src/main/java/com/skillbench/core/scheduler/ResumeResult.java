package com.skillbench.core.scheduler;

public record ResumeResult(boolean resumed, int remainingTasks) {
}
