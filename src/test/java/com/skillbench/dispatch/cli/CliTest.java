package com.skillbench.dispatch.cli;

import com.skillbench.core.iteration.RoundController;
import com.skillbench.core.model.IterationProgress;
import com.skillbench.core.model.RunProgress;
import com.skillbench.core.model.RunStatus;
import com.skillbench.core.model.ScoreBreakdown;
import com.skillbench.core.model.SkillSummary;
import com.skillbench.core.model.Summary;
import com.skillbench.core.persistence.ProjectStore;
import com.skillbench.core.results.ExportFormat;
import com.skillbench.core.results.ResultQueryService;
import com.skillbench.core.scheduler.RunScheduler;
import com.skillbench.core.state.EvaluationStateException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * Exercises the picocli command tree directly, without a Spring context.
 */
class CliTest {

    private record CliResult(int exitCode, String output) {}

    private final RunScheduler scheduler = mock(RunScheduler.class);
    private final RoundController rounds = mock(RoundController.class);
    private final ProjectStore store = mock(ProjectStore.class);
    private final ResultQueryService results = mock(ResultQueryService.class);

    private CommandLine.IFactory factory() {
        return new CommandLine.IFactory() {
            @Override
            @SuppressWarnings("unchecked")
            public <K> K create(Class<K> cls) throws Exception {
                if (cls == RunCommand.class) {
                    return (K) new RunCommand(scheduler, store);
                }
                if (cls == IterateCommand.class) {
                    return (K) new IterateCommand(rounds);
                }
                if (cls == StatusCommand.class) {
                    return (K) new StatusCommand(scheduler, rounds);
                }
                if (cls == ReportCommand.class) {
                    return (K) new ReportCommand(store, rounds);
                }
                if (cls == ExportCommand.class) {
                    return (K) new ExportCommand(results);
                }
                return CommandLine.defaultFactory().create(cls);
            }
        };
    }

    private CliResult execute(String... args) {
        ByteArrayOutputStream capture = new ByteArrayOutputStream();
        PrintStream capturePrintStream = new PrintStream(capture, true);
        PrintStream originalOut = System.out;
        PrintStream originalErr = System.err;
        System.setOut(capturePrintStream);
        System.setErr(capturePrintStream);
        try {
            CommandLine commandLine = new CommandLine(new SkillbenchCommand(), factory());
            int exitCode = commandLine.execute(args);
            capturePrintStream.flush();
            return new CliResult(exitCode, capture.toString());
        } finally {
            System.setOut(originalOut);
            System.setErr(originalErr);
        }
    }

    @Nested
    @DisplayName("Help output")
    class HelpTests {

        @Test
        @DisplayName("--help lists every subcommand")
        void helpListsSubcommands() {
            CliResult result = execute("--help");

            assertEquals(0, result.exitCode());
            for (String sub : List.of("run", "iterate", "status", "report", "export", "serve", "help")) {
                assertTrue(result.output().contains(sub), "Help should list '" + sub + "'");
            }
        }

        @Test
        @DisplayName("--version shows the version")
        void version() {
            CliResult result = execute("--version");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Skillbench 0.1.0"));
        }

        @Test
        @DisplayName("an unknown subcommand is rejected")
        void unknownSubcommand() {
            CliResult result = execute("launch");

            assertNotEquals(0, result.exitCode());
        }
    }

    @Nested
    @DisplayName("status")
    class StatusTests {

        @Test
        @DisplayName("prints the run counters")
        void printsRunCounters() {
            when(scheduler.getProgress("p1")).thenReturn(new RunProgress("p1", RunStatus.COMPLETED, 4, 3, 1, null));
            when(rounds.getProgress("p1")).thenReturn(new IterationProgress("idle", 0, 0, null, List.of()));

            CliResult result = execute("status", "p1");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Run: completed 3 completed, 1 failed of 4"), result.output());
        }

        @Test
        @DisplayName("reports an unknown project")
        void unknownProject() {
            when(scheduler.getProgress("nope")).thenThrow(EvaluationStateException.notFound("Project nope"));

            CliResult result = execute("status", "nope");

            assertTrue(result.output().contains("Project nope not found"));
        }
    }

    @Nested
    @DisplayName("report")
    class ReportTests {

        @Test
        @DisplayName("prints the ranking when a summary exists")
        void printsRanking() {
            var summary = new Summary("p1", Instant.now(), 2, List.of(
                    new SkillSummary("s1", "Terse reviewer", "1", 2, 0, 2, 85.0, ScoreBreakdown.EMPTY, 1)));
            when(store.readSummary("p1")).thenReturn(Optional.of(summary));
            when(store.hasDocument("p1", ProjectStore.ITERATION_REPORT)).thenReturn(false);

            CliResult result = execute("report", "p1");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Ranking (2 cases)"));
            assertTrue(result.output().contains("Terse reviewer"));
            verifyNoInteractions(rounds);
        }

        @Test
        @DisplayName("says so when nothing has run yet")
        void noSummary() {
            when(store.readSummary("p1")).thenReturn(Optional.empty());

            CliResult result = execute("report", "p1");

            assertTrue(result.output().contains("No summary yet"));
        }
    }

    @Nested
    @DisplayName("export")
    class ExportTests {

        @Test
        @DisplayName("exports in the requested format")
        void exportsCsv() {
            when(results.exportResults(anyString(), any(), any())).thenReturn(Path.of("out.csv"));

            CliResult result = execute("export", "p1", "--format", "csv", "--out", "out.csv");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Exported to out.csv"));
            verify(results).exportResults("p1", ExportFormat.CSV, Path.of("out.csv"));
        }

        @Test
        @DisplayName("reports an unsupported format")
        void unsupportedFormat() {
            CliResult result = execute("export", "p1", "--format", "xml", "--out", "out.xml");

            assertTrue(result.output().contains("Export failed"));
            verifyNoInteractions(results);
        }

        @Test
        @DisplayName("requires an output path")
        void requiresOut() {
            CliResult result = execute("export", "p1");

            assertNotEquals(0, result.exitCode());
        }
    }

    @Test
    @DisplayName("iterate requires the starting skill")
    void iterateRequiresSkill() {
        CliResult result = execute("iterate", "p1");

        assertNotEquals(0, result.exitCode());
        verifyNoInteractions(rounds);
    }
}
