package com.skillbench.dispatch.cli;

import com.skillbench.core.iteration.RoundController;
import com.skillbench.core.model.Candidate;
import com.skillbench.core.model.ExplorationLog;
import com.skillbench.core.model.ExplorationRound;
import com.skillbench.core.model.IterationReport;
import com.skillbench.core.persistence.ProjectStore;
import com.skillbench.core.state.EvaluationStateException;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * CLI command: skillbench report &lt;project-id&gt; [--exploration]
 * <p>
 * Prints the run ranking and, when present, the last iteration report.
 */
@Command(name = "report", mixinStandardHelpOptions = true, description = "Show the ranking and iteration report")
@Component
public class ReportCommand implements Runnable {

    @Parameters(index = "0", description = "Project ID")
    private String projectId;

    @Option(names = "--exploration", description = "Also list every beam candidate")
    private boolean exploration;

    private final ProjectStore store;
    private final RoundController rounds;

    public ReportCommand(ProjectStore store, RoundController rounds) {
        this.store = store;
        this.rounds = rounds;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        try {
            store.readSummary(projectId).ifPresentOrElse(summary -> {
                ConsoleOutput.info("Ranking (" + summary.totalCases() + " cases)");
                summary.ranking().forEach(ConsoleOutput::ranking);
            }, () -> ConsoleOutput.info("No summary yet; run the project first."));

            if (!store.hasDocument(projectId, ProjectStore.ITERATION_REPORT)) {
                return;
            }
            IterationReport report = rounds.getReport(projectId);
            System.out.println();
            ConsoleOutput.info(String.format("Iteration %s: %d rounds, stop reason %s",
                    report.iterationId(), report.totalRounds(), report.stopReason().name().toLowerCase()));
            report.rounds().forEach(ConsoleOutput::round);
            ConsoleOutput.success(String.format("Best: round %d, %s (%.1f)",
                    report.bestRound(), report.bestSkillName(), report.bestAvgScore()));

            if (exploration) {
                printExploration(rounds.getExplorationLog(projectId));
            }
        } catch (EvaluationStateException e) {
            ConsoleOutput.error(e.getMessage());
        }
    }

    private static void printExploration(ExplorationLog log) {
        System.out.println();
        for (ExplorationRound step : log.rounds()) {
            ConsoleOutput.info("After round " + step.round() + " (plateau " + step.plateauLevel() + "): "
                    + step.strategiesTried());
            for (Candidate c : step.candidates()) {
                String score = c.avgScore() == null ? "failed: " + c.error() : String.format("%.1f", c.avgScore());
                System.out.println("  " + (c.won() ? "*" : " ") + " " + c.strategy() + "  "
                        + (c.skillId() == null ? "-" : c.skillId()) + "  " + score);
            }
            if (step.warning() != null) {
                ConsoleOutput.error(step.warning());
            }
        }
    }
}
