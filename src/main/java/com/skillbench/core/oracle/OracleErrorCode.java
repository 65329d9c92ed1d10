package com.skillbench.core.oracle;

/**
 * Typed failures of an oracle call.
 */
public enum OracleErrorCode {
    TIMEOUT,
    RATE_LIMITED,
    EXECUTION_ERROR,
    MODEL_ERROR,
    OUTPUT_PARSE_ERROR,
    NOT_AVAILABLE
}
