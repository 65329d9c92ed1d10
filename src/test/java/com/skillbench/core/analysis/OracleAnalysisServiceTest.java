package com.skillbench.core.analysis;

import com.skillbench.core.TestWorkspace;
import com.skillbench.core.model.ScoreBreakdown;
import com.skillbench.core.model.SkillSummary;
import com.skillbench.core.model.Summary;
import com.skillbench.core.oracle.OracleClient;
import com.skillbench.core.oracle.OracleErrorCode;
import com.skillbench.core.oracle.OracleException;
import com.skillbench.core.oracle.OracleProperties;
import com.skillbench.core.oracle.OracleResponse;
import com.skillbench.core.oracle.StructuredOutputParser;
import com.skillbench.core.persistence.ProjectStore;
import com.skillbench.core.state.ErrorCode;
import com.skillbench.core.state.EvaluationStateException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class OracleAnalysisServiceTest {

    private static final String REPORT = """
            Analysis below.
            ```json
            {"best_skill_id": "s1", "best_skill_name": "Skill s1",
             "dimension_leaders": {"functional_correctness": "s1", "robustness": "s2"},
             "advantage_segments": [
               {"id": "seg_001", "skill_id": "s1", "skill_name": "Skill s1", "type": "role",
                "content": "instructions for s1", "reason": "clear role", "dimension": "readability"}],
             "issues": [{"skill_id": "s2", "skill_name": "Skill s2", "dimension": "robustness",
                         "description": "ignores empty input"}]}
            ```""";

    @TempDir
    Path root;

    private ProjectStore store;
    private OracleAnalysisService service;
    private final AtomicReference<String> lastPrompt = new AtomicReference<>();
    private volatile OracleClient oracle;

    @BeforeEach
    void setUp() {
        store = TestWorkspace.store(root);
        TestWorkspace.createProject(store, "p1", List.of("s1", "s2"), TestWorkspace.cases(2));
        oracle = (prompt, options) -> {
            lastPrompt.set(prompt);
            return new OracleResponse(REPORT, 10, options.model());
        };
        service = new OracleAnalysisService(store, (prompt, options) -> oracle.generate(prompt, options),
                new StructuredOutputParser(), new OracleProperties());
    }

    @AfterEach
    void tearDown() {
        service.shutdown();
    }

    private void writeSummary() {
        store.writeSummary("p1", new Summary("p1", Instant.now(), 2, List.of(
                new SkillSummary("s1", "Skill s1", "v1", 2, 0, 2, 81.0, ScoreBreakdown.EMPTY, 1),
                new SkillSummary("s2", "Skill s2", "v1", 2, 0, 2, 70.0, ScoreBreakdown.EMPTY, 2))));
    }

    @Test
    @DisplayName("parses and persists the report")
    void analyzes() throws Exception {
        writeSummary();

        AnalysisReport report = service.analyze("p1").get(10, TimeUnit.SECONDS);

        assertEquals("p1", report.projectId());
        assertEquals("s1", report.bestSkillId());
        assertEquals("s2", report.dimensionLeaders().get("robustness"));
        assertEquals(1, report.advantageSegments().size());
        assertEquals("ignores empty input", report.issues().get(0).description());
        assertNotNull(report.generatedAt());
        assertEquals("s1", service.getReport("p1").orElseThrow().bestSkillId());
        assertTrue(lastPrompt.get().contains("instructions for s2"));
    }

    @Test
    @DisplayName("fails without a summary")
    void requiresSummary() {
        var future = service.analyze("p1");

        var ex = assertThrows(CompletionException.class, future::join);
        var cause = assertInstanceOf(EvaluationStateException.class, ex.getCause());
        assertEquals(ErrorCode.NOT_FOUND, cause.getCode());
        assertTrue(service.getReport("p1").isEmpty());
    }

    @Test
    @DisplayName("an unparsable answer fails the analysis")
    void unparsableAnswer() {
        writeSummary();
        oracle = (prompt, options) -> new OracleResponse("I would rather not.", 10, options.model());

        var ex = assertThrows(CompletionException.class, () -> service.analyze("p1").join());
        var cause = assertInstanceOf(OracleException.class, ex.getCause());
        assertEquals(OracleErrorCode.OUTPUT_PARSE_ERROR, cause.getCode());
    }

    @Test
    @DisplayName("an unknown project is rejected synchronously")
    void unknownProject() {
        var ex = assertThrows(EvaluationStateException.class, () -> service.analyze("nope"));
        assertEquals(ErrorCode.NOT_FOUND, ex.getCode());
    }
}
