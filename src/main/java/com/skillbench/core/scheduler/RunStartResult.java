package com.skillbench.core.scheduler;

public record RunStartResult(boolean started, int totalTasks) {
}
