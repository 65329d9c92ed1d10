package com.skillbench.core.model;

/**
 * One (input, expected-output description) pair within a Baseline.
 */
public record TestCase(
    String caseId,
    String input,
    String expectedOutput
) {
}
