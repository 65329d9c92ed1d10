package com.skillbench.dispatch.cli;

import com.skillbench.core.iteration.RoundController;
import com.skillbench.core.model.IterationProgress;
import com.skillbench.core.model.RunProgress;
import com.skillbench.core.model.RunStatus;
import com.skillbench.core.scheduler.RunScheduler;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

/**
 * CLI command: skillbench status &lt;project-id&gt;
 */
@Command(name = "status", mixinStandardHelpOptions = true, description = "Show run and iteration progress")
@Component
public class StatusCommand implements Runnable {

    @Parameters(index = "0", description = "Project ID")
    private String projectId;

    private final RunScheduler scheduler;
    private final RoundController rounds;

    public StatusCommand(RunScheduler scheduler, RoundController rounds) {
        this.scheduler = scheduler;
        this.rounds = rounds;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        try {
            RunProgress run = scheduler.getProgress(projectId);
            String line = "Run: " + run.status().name().toLowerCase() + " " + run.completedTasks() + " completed, "
                    + run.failedTasks() + " failed of " + run.totalTasks();
            if (run.status() == RunStatus.COMPLETED) {
                ConsoleOutput.success(line);
            } else if (run.status() == RunStatus.INTERRUPTED) {
                ConsoleOutput.error(line);
            } else {
                ConsoleOutput.info(line);
            }

            IterationProgress iteration = rounds.getProgress(projectId);
            if (iteration.totalRounds() > 0) {
                ConsoleOutput.info("Iteration: " + iteration.status() + ", round " + iteration.currentRound()
                        + " (" + iteration.currentPhase() + ")");
                for (IterationProgress.RoundProgress r : iteration.rounds()) {
                    System.out.printf("  round %d  %-9s %s%n", r.round(), r.status().name().toLowerCase(),
                            r.avgScore() == null ? "-" : String.format("%.1f", r.avgScore()));
                }
            }
        } catch (RuntimeException e) {
            ConsoleOutput.error(ConsoleOutput.rootCauseMessage(e));
        }
    }
}
