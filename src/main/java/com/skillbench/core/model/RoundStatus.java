package com.skillbench.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum RoundStatus {
    @JsonProperty("running") RUNNING,
    @JsonProperty("completed") COMPLETED,
    @JsonProperty("failed") FAILED
}
