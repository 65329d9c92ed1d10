package com.skillbench.dispatch.cli;

import com.skillbench.core.iteration.IterationListener;
import com.skillbench.core.iteration.RoundController;
import com.skillbench.core.model.IterationParams;
import com.skillbench.core.model.IterationReport;
import com.skillbench.core.model.Round;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

/**
 * CLI command: skillbench iterate &lt;project-id&gt; --skill &lt;skill-id&gt;
 * <p>
 * Runs the optimization loop in the foreground and prints each round.
 */
@Command(name = "iterate", mixinStandardHelpOptions = true,
        description = "Iteratively recompose and re-test a skill")
@Component
public class IterateCommand implements Runnable {

    @Parameters(index = "0", description = "Project ID")
    private String projectId;

    @Option(names = "--skill", required = true, description = "Skill tested in round 1")
    private String skillId;

    @Option(names = "--max-rounds", defaultValue = "3", description = "Maximum rounds (default: ${DEFAULT-VALUE})")
    private int maxRounds;

    @Option(names = "--beam-width", defaultValue = "1", description = "Candidates per round (default: ${DEFAULT-VALUE})")
    private int beamWidth;

    @Option(names = "--stop-threshold", description = "Stop once a round's average reaches this")
    private Double stopThreshold;

    @Option(names = "--plateau-threshold", defaultValue = "1.0",
            description = "Score delta below which a round counts as flat (default: ${DEFAULT-VALUE})")
    private double plateauThreshold;

    @Option(names = "--plateau-rounds", defaultValue = "2",
            description = "Flat rounds before escalating strategies (default: ${DEFAULT-VALUE})")
    private int plateauRounds;

    @Option(names = "--retention-rules", description = "Rules the recomposed skill must keep")
    private String retentionRules;

    private final RoundController rounds;

    public IterateCommand(RoundController rounds) {
        this.rounds = rounds;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        var params = new IterationParams(skillId, maxRounds, stopThreshold, retentionRules, null,
                beamWidth, plateauThreshold, plateauRounds);
        var done = new CompletableFuture<IterationReport>();
        try {
            String iterationId = rounds.startIteration(projectId, params, new IterationListener() {
                @Override
                public void onRoundCompleted(Round round) {
                    ConsoleOutput.round(round);
                }

                @Override
                public void onCompleted(IterationReport report) {
                    done.complete(report);
                }
            });
            ConsoleOutput.info("Iteration " + iterationId + " started");
            IterationReport report = done.get();
            ConsoleOutput.success(String.format("Iteration finished (%s): best round %d, %s, avg %.1f",
                    report.stopReason().name().toLowerCase(), report.bestRound(),
                    report.bestSkillName(), report.bestAvgScore()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            ConsoleOutput.error("Interrupted while following the iteration");
        } catch (ExecutionException | RuntimeException e) {
            ConsoleOutput.error("Iteration failed: " + ConsoleOutput.rootCauseMessage(e));
        }
    }
}
