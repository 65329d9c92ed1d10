package com.skillbench.dispatch.cli;

import com.skillbench.core.model.RunProgress;
import com.skillbench.core.model.RunStatus;
import com.skillbench.core.model.Summary;
import com.skillbench.core.persistence.ProjectStore;
import com.skillbench.core.scheduler.RunScheduler;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

/**
 * CLI command: skillbench run &lt;project-id&gt;
 * <p>
 * Starts a test run and follows it to its terminal state, printing one line per task.
 */
@Command(name = "run", mixinStandardHelpOptions = true, description = "Run every skill against every case")
@Component
public class RunCommand implements Runnable {

    @Parameters(index = "0", description = "Project ID")
    private String projectId;

    private final RunScheduler scheduler;
    private final ProjectStore store;

    public RunCommand(RunScheduler scheduler, ProjectStore store) {
        this.scheduler = scheduler;
        this.store = store;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        var terminal = new CompletableFuture<RunProgress>();
        try {
            var started = scheduler.start(projectId, progress -> {
                if (progress.status() == RunStatus.RUNNING) {
                    ConsoleOutput.progress(progress);
                } else if (progress.status() != RunStatus.PENDING) {
                    terminal.complete(progress);
                }
            });
            ConsoleOutput.info("Run started: " + started.totalTasks() + " tasks");
            RunProgress last = terminal.get();
            if (last.status() == RunStatus.COMPLETED) {
                ConsoleOutput.success("Run completed: " + last.completedTasks() + " completed, "
                        + last.failedTasks() + " failed");
                store.readSummary(projectId).map(Summary::ranking)
                        .ifPresent(ranking -> ranking.forEach(ConsoleOutput::ranking));
            } else {
                ConsoleOutput.error("Run ended with status " + last.status());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            ConsoleOutput.error("Interrupted while following the run");
        } catch (ExecutionException | RuntimeException e) {
            ConsoleOutput.error("Run failed: " + ConsoleOutput.rootCauseMessage(e));
        }
    }
}
