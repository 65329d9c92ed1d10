package com.skillbench.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Outcome of a single task execution.
 */
public enum ResultStatus {
    @JsonProperty("completed") COMPLETED,
    @JsonProperty("failed") FAILED
}
