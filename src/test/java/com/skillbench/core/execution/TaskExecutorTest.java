package com.skillbench.core.execution;

import com.skillbench.core.TestWorkspace;
import com.skillbench.core.metrics.SkillbenchMetrics;
import com.skillbench.core.model.ProjectConfig;
import com.skillbench.core.model.ResultRecord;
import com.skillbench.core.model.ResultStatus;
import com.skillbench.core.model.Task;
import com.skillbench.core.model.TestCase;
import com.skillbench.core.oracle.OracleClient;
import com.skillbench.core.oracle.OracleErrorCode;
import com.skillbench.core.oracle.OracleException;
import com.skillbench.core.oracle.OracleProperties;
import com.skillbench.core.oracle.OracleResponse;
import com.skillbench.core.oracle.StructuredOutputParser;
import com.skillbench.core.persistence.ProjectStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TaskExecutorTest {

    private static final String VERDICT = """
            {"scores": {"functional_correctness": 28, "robustness": 18, "readability": 14,
             "conciseness": 13, "complexity_control": 9, "format_compliance": 9}, "reasoning": "good"}""";

    @TempDir
    Path root;

    private ProjectStore store;
    private Task task;
    private SimpleMeterRegistry registry;

    @BeforeEach
    void setUp() {
        store = TestWorkspace.store(root);
        ProjectConfig config = TestWorkspace.createProject(store, "p1", List.of("s1"), TestWorkspace.cases(1));
        TestCase testCase = store.readCases("p1", config.getBaselines().get(0)).get(0);
        task = new Task(config.getSkills().get(0), "instructions for s1", store.workingDir("p1", "s1"),
                config.getBaselines().get(0), testCase, store.resultPath("p1", "s1", testCase.caseId()));
        registry = new SimpleMeterRegistry();
    }

    private TaskExecutor executor(OracleClient oracle) {
        var scorer = new RubricScorer(oracle, new StructuredOutputParser(), new OracleProperties());
        return new TaskExecutor(oracle, scorer, store, new SkillbenchMetrics(registry));
    }

    private static final RunSettings SETTINGS = new RunSettings("m", Duration.ofSeconds(5));

    @Test
    @DisplayName("a successful execution is scored and persisted")
    void completedAndScored() {
        OracleClient oracle = (prompt, options) -> options.systemInstructions() != null
                ? new OracleResponse("class Answer {}", 420, "m")
                : new OracleResponse(VERDICT, 30, "m");

        ResultRecord record = executor(oracle).execute("p1", task, SETTINGS);

        assertEquals(ResultStatus.COMPLETED, record.status());
        assertEquals("class Answer {}", record.actualOutput());
        assertEquals(420, record.durationMs());
        assertEquals(91, record.scores().total());
        assertEquals("b1", record.baselineId());
        assertNotNull(record.scoreEvaluatedAt());
        assertEquals(91, store.readResult("p1", "s1", "case_001").orElseThrow().scores().total());
    }

    @Test
    @DisplayName("an execution failure produces a failed record without scores")
    void executionFailure() {
        OracleClient oracle = (prompt, options) -> {
            throw new OracleException(OracleErrorCode.TIMEOUT, "no answer within 5s");
        };

        ResultRecord record = executor(oracle).execute("p1", task, SETTINGS);

        assertEquals(ResultStatus.FAILED, record.status());
        assertEquals("TIMEOUT", record.errorCode());
        assertEquals("no answer within 5s", record.error());
        assertNull(record.scores());
        assertTrue(store.hasResult("p1", "s1", "case_001"));
    }

    @Test
    @DisplayName("a scoring failure keeps the record completed but unscored")
    void scoringFailureIsNonFatal() {
        OracleClient oracle = (prompt, options) -> options.systemInstructions() != null
                ? new OracleResponse("output", 10, "m")
                : new OracleResponse("I cannot grade this.", 10, "m");

        ResultRecord record = executor(oracle).execute("p1", task, SETTINGS);

        assertEquals(ResultStatus.COMPLETED, record.status());
        assertNull(record.scores());
        assertFalse(record.isScored());
        assertEquals(1.0, registry.find("skillbench.task.scoring_failures").counter().count());
    }
}
