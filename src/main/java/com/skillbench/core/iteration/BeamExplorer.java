package com.skillbench.core.iteration;

import com.skillbench.core.metrics.SkillbenchMetrics;
import com.skillbench.core.model.Candidate;
import com.skillbench.core.model.ExplorationRound;
import com.skillbench.core.model.IterationParams;
import com.skillbench.core.model.ProjectConfig;
import com.skillbench.core.model.Round;
import com.skillbench.core.model.ScoreBreakdown;
import com.skillbench.core.model.ScoreDimension;
import com.skillbench.core.model.SkillSummary;
import com.skillbench.core.model.Strategy;
import com.skillbench.core.model.Summary;
import com.skillbench.core.oracle.OracleProperties;
import com.skillbench.core.persistence.ProjectStore;
import com.skillbench.core.persistence.SkillLibrary;
import com.skillbench.core.recompose.RecomposeCollaborator;
import com.skillbench.core.recompose.RecomposeRequest;
import com.skillbench.core.recompose.RecomposeResult;
import com.skillbench.core.scheduler.EvaluationRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.BooleanSupplier;

/**
 * Produces and tests next round's skill candidates.
 * <p>
 * One candidate per selected strategy: recompose, save, register as the sole
 * non-original skill, run. Candidates run one after another so every run owns
 * the project's working context. The best candidate wins; only it is carried
 * into the next round.
 */
@Service
public class BeamExplorer {

    private static final Logger log = LoggerFactory.getLogger(BeamExplorer.class);

    private final EvaluationRunner runner;
    private final RecomposeCollaborator recompose;
    private final SkillLibrary library;
    private final ProjectStore store;
    private final SkillbenchMetrics metrics;
    private final OracleProperties oracleProperties;

    public BeamExplorer(EvaluationRunner runner, RecomposeCollaborator recompose, SkillLibrary library,
                        ProjectStore store, SkillbenchMetrics metrics, OracleProperties oracleProperties) {
        this.runner = runner;
        this.recompose = recompose;
        this.library = library;
        this.store = store;
        this.metrics = metrics;
        this.oracleProperties = oracleProperties;
    }

    /**
     * Strategies to try after {@code round}. Exactly two for any beam wider than one.
     */
    public static List<Strategy> selectStrategies(int round, int plateauLevel, int beamWidth) {
        if (beamWidth <= 1) {
            return List.of(Strategy.GREEDY);
        }
        return switch (plateauLevel) {
            case 0 -> List.of(Strategy.GREEDY, Strategy.DIMENSION_FOCUS);
            case 1 -> List.of(Strategy.GREEDY, Strategy.SEGMENT_EXPLORE);
            case 2 -> List.of(Strategy.CROSS_POLLINATE, Strategy.DIMENSION_FOCUS);
            default -> List.of(Strategy.RANDOM_SUBSET, Strategy.SEGMENT_EXPLORE);
        };
    }

    /**
     * Lowest achieved/maximum ratio in the latest round; earlier declared dimensions win ties.
     */
    public static ScoreDimension weakestDimension(List<Round> rounds) {
        if (rounds.isEmpty() || rounds.get(rounds.size() - 1).scoreBreakdown() == null) {
            return ScoreDimension.FUNCTIONAL_CORRECTNESS;
        }
        ScoreBreakdown latest = rounds.get(rounds.size() - 1).scoreBreakdown();
        ScoreDimension weakest = ScoreDimension.FUNCTIONAL_CORRECTNESS;
        double lowest = Double.POSITIVE_INFINITY;
        for (ScoreDimension d : ScoreDimension.values()) {
            double ratio = latest.ratio(d);
            if (ratio < lowest) {
                lowest = ratio;
                weakest = d;
            }
        }
        return weakest;
    }

    /**
     * Score of the skill tested by the last run: its own summary entry, else the
     * first non-original entry, else the top-ranked one.
     */
    static Optional<SkillSummary> scoreOf(Summary summary, ProjectConfig config, String skillId) {
        Optional<SkillSummary> own = summary.find(skillId);
        if (own.isPresent()) {
            return own;
        }
        return summary.ranking().stream()
                .filter(s -> !config.isOriginal(s.skillId()))
                .findFirst()
                .or(() -> summary.ranking().stream().findFirst());
    }

    /**
     * Runs one exploration step after {@code round}.
     *
     * @param history completed rounds so far, {@code round} included
     * @param halted  polled before each candidate; stops the step early when true
     * @return the log entry; its winner is null when every candidate failed
     */
    public ExplorationRound explore(String projectId, int round, int plateauLevel, IterationParams params,
                                    List<Round> history, BooleanSupplier halted) {
        List<Strategy> strategies = selectStrategies(round, plateauLevel, params.beamWidth());
        ScoreDimension focus = weakestDimension(history);
        log.info("Exploring after round {} of project {}: plateau level {}, strategies {}",
                round, projectId, plateauLevel, strategies);

        List<Candidate> candidates = new ArrayList<>();
        for (int i = 0; i < strategies.size(); i++) {
            if (halted.getAsBoolean()) {
                log.info("Exploration after round {} halted before candidate {}", round, i + 1);
                break;
            }
            Strategy strategy = strategies.get(i);
            try {
                candidates.add(runCandidate(projectId, round, i + 1, strategy, focus, params, history));
            } catch (RuntimeException e) {
                log.warn("Beam candidate {} ({}) after round {} failed: {}", i + 1, strategy, round, e.getMessage());
                candidates.add(Candidate.failed(strategy, String.valueOf(e.getMessage())));
            }
        }

        Candidate winner = null;
        for (Candidate c : candidates) {
            if (c.succeeded() && (winner == null || c.avgScore() > winner.avgScore())) {
                winner = c;
            }
        }

        String warning = null;
        String winnerId = null;
        if (winner != null) {
            winnerId = winner.skillId();
            library.registerIterationCandidate(projectId, winnerId, round + 1);
            log.info("Beam winner for round {}: {} ({}, {})", round + 1, winnerId, winner.strategy(), winner.avgScore());
        } else {
            warning = "All beam candidates failed at round " + round + "; carrying the current skill forward";
            log.warn(warning);
        }

        List<Candidate> marked = new ArrayList<>();
        for (Candidate c : candidates) {
            boolean won = winnerId != null && winnerId.equals(c.skillId());
            marked.add(c.markWon(won));
            metrics.recordCandidate(c.strategy().name(), won);
        }
        return new ExplorationRound(round, plateauLevel, strategies,
                strategies.contains(Strategy.DIMENSION_FOCUS) ? focus.key() : null,
                marked, winnerId, warning);
    }

    private Candidate runCandidate(String projectId, int round, int number, Strategy strategy,
                                   ScoreDimension focus, IterationParams params, List<Round> history) {
        var request = new RecomposeRequest(params.retentionRules(), params.selectedSegmentIds(), strategy,
                strategy == Strategy.DIMENSION_FOCUS ? focus : null, history);
        RecomposeResult result = RoundFailedException.await(recompose.recompose(projectId, request), "Recompose",
                oracleProperties.collaboratorBudget());

        int nextRound = round + 1;
        String skillId = recompose.saveRecomposedSkill(projectId, result.content(),
                "Iteration skill v" + nextRound + "-c" + number, "general", "iteration", params.retentionRules());
        library.registerIterationCandidate(projectId, skillId, nextRound);

        runner.runToCompletion(projectId);

        Summary summary = store.readSummary(projectId)
                .orElseThrow(() -> new RoundFailedException("No summary after testing candidate " + skillId));
        SkillSummary entry = scoreOf(summary, store.readConfig(projectId), skillId)
                .orElseThrow(() -> new RoundFailedException("Candidate " + skillId + " missing from summary"));
        log.info("Beam candidate {} ({}) scored {}", number, strategy, entry.avgScore());
        return new Candidate(strategy, skillId, entry.avgScore(), entry.scoreBreakdown(), false, null);
    }
}
