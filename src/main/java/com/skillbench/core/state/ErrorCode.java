package com.skillbench.core.state;

/**
 * Caller-contract violations surfaced synchronously by the run scheduler,
 * the round controller and the file store.
 */
public enum ErrorCode {
    ALREADY_RUNNING,
    NOT_RUNNING,
    NOT_PAUSED,
    NOT_FOUND,
    INVALID_PARAMS
}
