package com.skillbench.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for test runs and iterations.
 */
@Service
public class SkillbenchMetrics {

    private final MeterRegistry registry;

    public SkillbenchMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordTaskExecution(String status, long ms) {
        Timer.builder("skillbench.task.duration")
                .tag("status", status)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordScoringFailure() {
        Counter.builder("skillbench.task.scoring_failures")
                .description("Tasks that executed but could not be scored")
                .register(registry)
                .increment();
    }

    public void recordOracleFailure(String code) {
        Counter.builder("skillbench.oracle.failures")
                .tag("code", code)
                .register(registry)
                .increment();
    }

    public void recordRunResult(String status) {
        Counter.builder("skillbench.runs.total")
                .tag("status", status)
                .register(registry)
                .increment();
    }

    public void recordRoundCompleted() {
        Counter.builder("skillbench.iteration.rounds")
                .register(registry)
                .increment();
    }

    /**
     * Records one tested beam candidate.
     *
     * @param strategy strategy that produced it
     * @param won      whether it was carried into the next round
     */
    public void recordCandidate(String strategy, boolean won) {
        Counter.builder("skillbench.iteration.candidates")
                .description("Beam candidates tested between rounds")
                .tag("strategy", strategy)
                .tag("won", String.valueOf(won))
                .register(registry)
                .increment();
    }

    public void recordIterationResult(String stopReason) {
        Counter.builder("skillbench.iteration.total")
                .tag("stop_reason", stopReason)
                .register(registry)
                .increment();
    }
}
