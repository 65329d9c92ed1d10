package com.skillbench.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Lifecycle of a project's test run:
 * pending -> running -> {paused <-> running} -> {completed | interrupted}.
 */
public enum RunStatus {
    @JsonProperty("pending") PENDING,
    @JsonProperty("running") RUNNING,
    @JsonProperty("paused") PAUSED,
    @JsonProperty("interrupted") INTERRUPTED,
    @JsonProperty("completed") COMPLETED;

    public boolean isTerminal() {
        return this == COMPLETED || this == INTERRUPTED;
    }
}
