package com.skillbench.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Why an iteration run ended.
 */
public enum StopReason {
    @JsonProperty("max_rounds") MAX_ROUNDS,
    @JsonProperty("threshold_reached") THRESHOLD_REACHED,
    @JsonProperty("manual") MANUAL,
    @JsonProperty("paused") PAUSED,
    @JsonProperty("error") ERROR
}
