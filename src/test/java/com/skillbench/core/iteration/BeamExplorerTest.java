package com.skillbench.core.iteration;

import com.skillbench.core.metrics.SkillbenchMetrics;
import com.skillbench.core.model.ExplorationRound;
import com.skillbench.core.model.IterationParams;
import com.skillbench.core.model.ProjectConfig;
import com.skillbench.core.model.Round;
import com.skillbench.core.model.RoundStatus;
import com.skillbench.core.model.ScoreBreakdown;
import com.skillbench.core.model.ScoreDimension;
import com.skillbench.core.model.SkillSummary;
import com.skillbench.core.model.Strategy;
import com.skillbench.core.model.Summary;
import com.skillbench.core.oracle.OracleProperties;
import com.skillbench.core.persistence.ProjectStore;
import com.skillbench.core.persistence.SkillLibrary;
import com.skillbench.core.recompose.RecomposeCollaborator;
import com.skillbench.core.scheduler.EvaluationRunner;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class BeamExplorerTest {

    @Nested
    @DisplayName("selectStrategies")
    class SelectStrategiesTests {

        @Test
        @DisplayName("a beam of one always stays greedy")
        void narrowBeam() {
            for (int level = 0; level <= 3; level++) {
                assertEquals(List.of(Strategy.GREEDY), BeamExplorer.selectStrategies(2, level, 1));
            }
        }

        @Test
        @DisplayName("wider beams pick two strategies per plateau level")
        void perLevel() {
            assertEquals(List.of(Strategy.GREEDY, Strategy.DIMENSION_FOCUS), BeamExplorer.selectStrategies(1, 0, 2));
            assertEquals(List.of(Strategy.GREEDY, Strategy.SEGMENT_EXPLORE), BeamExplorer.selectStrategies(1, 1, 2));
            assertEquals(List.of(Strategy.CROSS_POLLINATE, Strategy.DIMENSION_FOCUS),
                    BeamExplorer.selectStrategies(1, 2, 3));
            assertEquals(List.of(Strategy.RANDOM_SUBSET, Strategy.SEGMENT_EXPLORE),
                    BeamExplorer.selectStrategies(1, 3, 2));
        }

        @Test
        @DisplayName("three flat rounds with an escape limit of two switch to cross-pollination")
        void plateauEscalation() {
            List<Round> history = PlateauDetectorTest.rounds(0.4, 0.2, 0.1);

            int level = PlateauDetector.level(history, 1.0, 2);

            assertTrue(level >= 2);
            assertEquals(List.of(Strategy.CROSS_POLLINATE, Strategy.DIMENSION_FOCUS),
                    BeamExplorer.selectStrategies(4, 2, 2));
        }
    }

    @Test
    @DisplayName("the weakest dimension is the lowest achieved ratio")
    void weakestDimension() {
        var breakdown = new ScoreBreakdown(27, 18, 9, 13, 9, 9);
        var round = new Round(1, Strategy.GREEDY, "s", "S", "", 85.0, null, breakdown, 0,
                RoundStatus.COMPLETED, Instant.now(), Instant.now(), null);

        assertEquals(ScoreDimension.READABILITY, BeamExplorer.weakestDimension(List.of(round)));
        assertEquals(ScoreDimension.FUNCTIONAL_CORRECTNESS, BeamExplorer.weakestDimension(List.of()));
    }

    @Test
    @DisplayName("ratio ties go to the earlier declared dimension")
    void weakestDimensionTie() {
        var breakdown = new ScoreBreakdown(15, 10, 15, 15, 10, 10);
        var round = new Round(1, Strategy.GREEDY, "s", "S", "", 75.0, null, breakdown, 0,
                RoundStatus.COMPLETED, Instant.now(), Instant.now(), null);

        assertEquals(ScoreDimension.FUNCTIONAL_CORRECTNESS, BeamExplorer.weakestDimension(List.of(round)));
    }

    @Test
    @DisplayName("scoreOf prefers the skill's own entry, then the first non-original")
    void scoreOf() {
        var config = new ProjectConfig();
        config.setOriginalSkillIds(List.of("orig"));
        var summary = new Summary("p1", Instant.now(), 2, List.of(
                new SkillSummary("orig", "Original", "v1", 2, 0, 2, 90.0, ScoreBreakdown.EMPTY, 1),
                new SkillSummary("cand", "Candidate", "v1", 2, 0, 2, 80.0, ScoreBreakdown.EMPTY, 2)));

        assertEquals("orig", BeamExplorer.scoreOf(summary, config, "orig").orElseThrow().skillId());
        assertEquals("cand", BeamExplorer.scoreOf(summary, config, "renamed").orElseThrow().skillId());
        assertTrue(BeamExplorer.scoreOf(new Summary("p1", Instant.now(), 0, List.of()), config, "x").isEmpty());
    }

    @Test
    @DisplayName("a halted exploration tries no candidate and carries the current skill")
    void haltedBeforeFirstCandidate() {
        EvaluationRunner runner = mock(EvaluationRunner.class);
        RecomposeCollaborator recompose = mock(RecomposeCollaborator.class);
        SkillLibrary library = mock(SkillLibrary.class);
        var explorer = new BeamExplorer(runner, recompose, library, mock(ProjectStore.class),
                new SkillbenchMetrics(new SimpleMeterRegistry()), new OracleProperties());

        ExplorationRound step = explorer.explore("p1", 1, 0, IterationParams.of("s", 3, 2, null),
                PlateauDetectorTest.rounds(), () -> true);

        assertTrue(step.candidates().isEmpty());
        assertNull(step.winnerSkillId());
        assertEquals("All beam candidates failed at round 1; carrying the current skill forward", step.warning());
        assertEquals("functional_correctness", step.focusDimension());
        verifyNoInteractions(runner, recompose, library);
    }
}
