package com.skillbench.core.model;

/**
 * Per-project oracle overrides. Either field may be null to use the global default.
 */
public record CliConfig(
    String model,
    Integer timeoutSeconds
) {
}
