package com.skillbench.core.oracle;

/**
 * Successful oracle output.
 *
 * @param text       generated text
 * @param durationMs wall time reported by the oracle (or measured by the client)
 * @param model      model that produced the text
 */
public record OracleResponse(
    String text,
    long durationMs,
    String model
) {
}
