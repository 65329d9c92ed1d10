package com.skillbench.core.oracle;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Per-call settings of an oracle invocation.
 *
 * @param systemInstructions optional system context (the skill text for task execution)
 * @param workingContext     directory the call runs in; null for the workspace default
 * @param timeout            upper bound on the call
 * @param model              model name; null for the configured default
 */
public record OracleOptions(
    String systemInstructions,
    Path workingContext,
    Duration timeout,
    String model
) {

    public static OracleOptions of(Path workingContext, Duration timeout, String model) {
        return new OracleOptions(null, workingContext, timeout, model);
    }

    public OracleOptions withSystemInstructions(String instructions) {
        return new OracleOptions(instructions, workingContext, timeout, model);
    }
}
