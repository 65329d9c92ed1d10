package com.skillbench.core.execution;

import java.time.Duration;

/**
 * Oracle settings in force for one run: the project's model and timeout,
 * falling back to the global defaults.
 */
public record RunSettings(String model, Duration timeout) {
}
