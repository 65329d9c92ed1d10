package com.skillbench.core.scheduler;

public record RetryResult(String taskId) {
}
