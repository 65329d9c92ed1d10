package com.skillbench.core.results;

import com.skillbench.core.state.ErrorCode;
import com.skillbench.core.state.EvaluationStateException;

public enum ExportFormat {
    JSON,
    CSV;

    public static ExportFormat parse(String value) {
        if (value == null || value.isBlank()) {
            return JSON;
        }
        try {
            return valueOf(value.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new EvaluationStateException(ErrorCode.INVALID_PARAMS, "Unsupported export format: " + value);
        }
    }
}
