package com.skillbench.core.iteration;

import com.skillbench.core.analysis.AnalysisCollaborator;
import com.skillbench.core.events.EventBus;
import com.skillbench.core.events.SkillbenchEvent;
import com.skillbench.core.logging.MdcContext;
import com.skillbench.core.metrics.SkillbenchMetrics;
import com.skillbench.core.model.Candidate;
import com.skillbench.core.model.ExplorationLog;
import com.skillbench.core.model.ExplorationRound;
import com.skillbench.core.model.IterationParams;
import com.skillbench.core.model.IterationProgress;
import com.skillbench.core.model.IterationReport;
import com.skillbench.core.model.ProjectConfig;
import com.skillbench.core.model.Round;
import com.skillbench.core.model.RoundStatus;
import com.skillbench.core.model.SkillRef;
import com.skillbench.core.model.SkillSummary;
import com.skillbench.core.model.StopReason;
import com.skillbench.core.model.Strategy;
import com.skillbench.core.model.Summary;
import com.skillbench.core.oracle.OracleProperties;
import com.skillbench.core.persistence.ProjectStore;
import com.skillbench.core.persistence.SkillLibrary;
import com.skillbench.core.scheduler.EvaluationRunner;
import com.skillbench.core.state.ErrorCode;
import com.skillbench.core.state.EvaluationStateException;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * Drives the outer optimization loop: test the current skill, analyse, record
 * the round, then explore candidates for the next one.
 * <p>
 * Rounds run strictly in sequence on a background thread. Pause and stop are
 * cooperative and observed at round and candidate boundaries. A failing round
 * ends the loop but every earlier round stays in the report.
 */
@Service
public class RoundController {

    private static final Logger log = LoggerFactory.getLogger(RoundController.class);

    private final ProjectStore store;
    private final EvaluationRunner runner;
    private final AnalysisCollaborator analysis;
    private final BeamExplorer explorer;
    private final SkillLibrary library;
    private final EventBus eventBus;
    private final SkillbenchMetrics metrics;
    private final OracleProperties oracleProperties;

    private final ConcurrentHashMap<String, IterationState> active = new ConcurrentHashMap<>();
    private final ExecutorService loops;

    public RoundController(ProjectStore store, EvaluationRunner runner, AnalysisCollaborator analysis,
                           BeamExplorer explorer, SkillLibrary library, EventBus eventBus,
                           SkillbenchMetrics metrics, OracleProperties oracleProperties) {
        this.store = store;
        this.runner = runner;
        this.analysis = analysis;
        this.explorer = explorer;
        this.library = library;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.oracleProperties = oracleProperties;
        var counter = new AtomicInteger();
        this.loops = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "iteration-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @PreDestroy
    void shutdown() {
        loops.shutdownNow();
    }

    /**
     * Starts an iteration in the background and returns its id.
     *
     * @throws EvaluationStateException NOT_FOUND for an unknown project, INVALID_PARAMS for bad
     *                                  parameters, ALREADY_RUNNING while an iteration is in flight
     */
    public String startIteration(String projectId, IterationParams params, IterationListener listener) {
        ProjectConfig config = store.readConfig(projectId);
        validate(params);

        String iterationId = UUID.randomUUID().toString();
        var state = new IterationState(iterationId, projectId);
        if (active.putIfAbsent(projectId, state) != null) {
            throw new EvaluationStateException(ErrorCode.ALREADY_RUNNING,
                    "An iteration is already running for project " + projectId);
        }

        try {
            store.clearIterationHistory(projectId);
            prepareProject(projectId, config, params.recomposedSkillId());
        } catch (RuntimeException e) {
            active.remove(projectId, state);
            throw e;
        }

        log.info("Iteration {} started for project {}: skill {}, max rounds {}, beam width {}, stop threshold {}",
                iterationId, projectId, params.recomposedSkillId(), params.maxRounds(), params.beamWidth(),
                params.stopThreshold());
        IterationListener callbacks = listener == null ? IterationListener.NONE : listener;
        loops.execute(() -> {
            try {
                runLoop(state, params, callbacks);
            } finally {
                active.remove(projectId, state);
                MdcContext.clear();
            }
        });
        return iterationId;
    }

    /** @throws EvaluationStateException NOT_RUNNING when no iteration is in flight */
    public void pauseIteration(String projectId) {
        requireActive(projectId).pause();
        log.info("Iteration pause requested for project {}", projectId);
    }

    /** @throws EvaluationStateException NOT_RUNNING when no iteration is in flight */
    public void stopIteration(String projectId) {
        requireActive(projectId).stop();
        log.info("Iteration stop requested for project {}", projectId);
    }

    public boolean isActive(String projectId) {
        return active.containsKey(projectId);
    }

    /**
     * Progress assembled from the round snapshots on disk.
     */
    public IterationProgress getProgress(String projectId) {
        store.projectDir(projectId);
        IterationState state = active.get(projectId);
        List<Round> snapshots = store.listRoundSnapshots(projectId);
        List<IterationProgress.RoundProgress> rounds = snapshots.stream()
                .map(r -> new IterationProgress.RoundProgress(r.round(), r.status(), r.avgScore()))
                .collect(Collectors.toList());

        Round running = snapshots.stream().filter(r -> r.status() == RoundStatus.RUNNING).findFirst().orElse(null);
        int completed = (int) snapshots.stream().filter(r -> r.status() == RoundStatus.COMPLETED).count();

        String status;
        if (state != null && state.isStopped()) {
            status = "stopped";
        } else if (state != null && state.isPaused()) {
            status = "paused";
        } else if (state == null && store.hasDocument(projectId, ProjectStore.ITERATION_REPORT)) {
            status = "completed";
        } else {
            status = "running";
        }
        String phase = running != null && state != null ? state.phase() : "idle";
        return new IterationProgress(status, running != null ? running.round() : completed,
                snapshots.size(), phase, rounds);
    }

    public IterationReport getReport(String projectId) {
        return store.readDocument(projectId, ProjectStore.ITERATION_REPORT, IterationReport.class)
                .orElseThrow(() -> EvaluationStateException.notFound("Iteration report of project " + projectId));
    }

    public ExplorationLog getExplorationLog(String projectId) {
        return store.readDocument(projectId, ProjectStore.EXPLORATION_LOG, ExplorationLog.class)
                .orElseThrow(() -> EvaluationStateException.notFound("Exploration log of project " + projectId));
    }

    // ── Loop ────────────────────────────────────────────────────────

    void runLoop(IterationState state, IterationParams params, IterationListener listener) {
        String projectId = state.projectId();
        Instant startedAt = Instant.now();
        List<Round> rounds = new ArrayList<>();
        List<ExplorationRound> explored = new ArrayList<>();
        String currentSkillId = params.recomposedSkillId();
        Strategy currentStrategy = Strategy.GREEDY;
        StopReason stopReason = StopReason.MAX_ROUNDS;

        for (int round = 1; round <= params.maxRounds(); round++) {
            if (state.isStopped()) {
                stopReason = StopReason.MANUAL;
                break;
            }
            if (state.isPaused()) {
                stopReason = StopReason.PAUSED;
                break;
            }
            MdcContext.setRound(projectId, state.iterationId(), round);

            Round snapshot = Round.running(round, currentStrategy, currentSkillId,
                    skillName(projectId, currentSkillId, round), params.retentionRules(), Instant.now());
            boolean recorded = false;
            try {
                store.writeRoundSnapshot(projectId, snapshot);
                Round done = testRound(state, snapshot, rounds, params);
                rounds.add(done);
                recorded = true;
                store.writeRoundSnapshot(projectId, done);
                metrics.recordRoundCompleted();
                publishRound(projectId, done);
                listener.onRoundCompleted(done);
                log.info("Round {} completed: avg {} (delta {}), plateau level {}",
                        round, done.avgScore(), done.scoreDelta(), done.plateauLevel());

                if (params.stopThreshold() != null && done.avgScore() >= params.stopThreshold()) {
                    stopReason = StopReason.THRESHOLD_REACHED;
                    break;
                }

                if (round < params.maxRounds() && !state.isHalted()) {
                    state.phase("explore");
                    ExplorationRound step = explorer.explore(projectId, round, done.plateauLevel(), params,
                            List.copyOf(rounds), state::isHalted);
                    explored.add(step);
                    if (step.winnerSkillId() != null) {
                        currentSkillId = step.winnerSkillId();
                        currentStrategy = step.candidates().stream()
                                .filter(Candidate::won)
                                .map(Candidate::strategy)
                                .findFirst()
                                .orElse(Strategy.GREEDY);
                    }
                }
            } catch (RuntimeException e) {
                log.error("Round {} of project {} failed: {}", round, projectId, e.getMessage(), e);
                if (!recorded) {
                    writeFailedSnapshot(projectId, snapshot, e);
                }
                stopReason = StopReason.ERROR;
                break;
            }
        }

        finish(state, params, startedAt, rounds, explored, stopReason, listener);
    }

    private Round testRound(IterationState state, Round snapshot, List<Round> previous, IterationParams params) {
        String projectId = state.projectId();

        state.phase("test");
        runner.runToCompletion(projectId);

        state.phase("analysis");
        RoundFailedException.await(analysis.analyze(projectId), "Analysis", oracleProperties.collaboratorBudget());

        Summary summary = store.readSummary(projectId)
                .orElseThrow(() -> new RoundFailedException("No summary after round " + snapshot.round()));
        SkillSummary entry = BeamExplorer.scoreOf(summary, store.readConfig(projectId), snapshot.skillId())
                .orElseThrow(() -> new RoundFailedException("Skill " + snapshot.skillId() + " missing from summary"));

        double avg = entry.avgScore();
        Double delta = previous.isEmpty() ? null : avg - previous.get(previous.size() - 1).avgScore();
        Round provisional = snapshot.completed(avg, delta, entry.scoreBreakdown(), 0, Instant.now());
        List<Round> withThis = new ArrayList<>(previous);
        withThis.add(provisional);
        int level = PlateauDetector.level(withThis, params.plateauThreshold(), params.plateauRoundsBeforeEscape());
        return snapshot.completed(avg, delta, entry.scoreBreakdown(), level, provisional.completedAt());
    }

    private void finish(IterationState state, IterationParams params, Instant startedAt, List<Round> rounds,
                        List<ExplorationRound> explored, StopReason stopReason, IterationListener listener) {
        String projectId = state.projectId();
        Round best = null;
        for (Round r : rounds) {
            if (best == null || r.avgScore() > best.avgScore()) {
                best = r;
            }
        }
        int bestRound = best != null ? best.round() : 1;
        String bestSkillId = best != null ? best.skillId() : params.recomposedSkillId();
        String bestSkillName = best != null ? best.skillName() : "Iteration skill v1";
        double bestAvg = best != null ? best.avgScore() : 0;
        Strategy bestStrategy = best != null && best.strategy() != null ? best.strategy() : Strategy.GREEDY;

        Instant now = Instant.now();
        var report = new IterationReport(projectId, state.iterationId(), now, rounds.size(), stopReason,
                params.stopThreshold(), bestRound, bestSkillId, bestSkillName, bestAvg, rounds);
        var explorationLog = new ExplorationLog(projectId, state.iterationId(), startedAt, now, params,
                originalSkillIds(projectId), explored,
                new ExplorationLog.BestEver(bestRound, bestStrategy, bestSkillId, bestAvg));
        try {
            store.writeDocument(projectId, ProjectStore.EXPLORATION_LOG, explorationLog);
            store.writeDocument(projectId, ProjectStore.ITERATION_REPORT, report);
        } catch (RuntimeException e) {
            log.error("Iteration report of project {} could not be written", projectId, e);
        }

        metrics.recordIterationResult(stopReason.name().toLowerCase());
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("iteration_id", state.iterationId());
        payload.put("stop_reason", stopReason.name().toLowerCase());
        payload.put("total_rounds", rounds.size());
        payload.put("best_round", bestRound);
        payload.put("best_avg_score", bestAvg);
        eventBus.publish(SkillbenchEvent.of("iteration.completed", projectId, payload));
        log.info("Iteration {} of project {} finished: {} rounds, stop reason {}, best round {} ({})",
                state.iterationId(), projectId, rounds.size(), stopReason, bestRound, bestAvg);
        listener.onCompleted(report);
    }

    // ── Helpers ─────────────────────────────────────────────────────

    private void validate(IterationParams params) {
        if (params == null || params.recomposedSkillId() == null || params.recomposedSkillId().isBlank()) {
            throw new EvaluationStateException(ErrorCode.INVALID_PARAMS, "recomposed_skill_id is required");
        }
        if (params.maxRounds() < 1) {
            throw new EvaluationStateException(ErrorCode.INVALID_PARAMS, "max_rounds must be at least 1");
        }
        if (params.beamWidth() < 1) {
            throw new EvaluationStateException(ErrorCode.INVALID_PARAMS, "beam_width must be at least 1");
        }
        if (params.plateauRoundsBeforeEscape() < 1) {
            throw new EvaluationStateException(ErrorCode.INVALID_PARAMS,
                    "plateau_rounds_before_escape must be at least 1");
        }
    }

    /**
     * Records the original skills once and makes sure the starting skill is configured.
     */
    private void prepareProject(String projectId, ProjectConfig config, String startSkillId) {
        if (config.getOriginalSkillIds().isEmpty()) {
            List<String> originals = config.getSkills().stream()
                    .map(SkillRef::refId)
                    .filter(id -> !id.equals(startSkillId))
                    .collect(Collectors.toList());
            store.updateConfig(projectId, c -> {
                c.setOriginalSkillIds(originals);
                return c;
            });
        }
        boolean configured = config.getSkills().stream().anyMatch(s -> s.refId().equals(startSkillId));
        if (!configured) {
            library.registerIterationCandidate(projectId, startSkillId, 1);
        }
    }

    private String skillName(String projectId, String skillId, int round) {
        return store.readConfig(projectId).getSkills().stream()
                .filter(s -> s.refId().equals(skillId))
                .map(SkillRef::name)
                .findFirst()
                .orElse("Iteration skill v" + round);
    }

    private List<String> originalSkillIds(String projectId) {
        try {
            return store.readConfig(projectId).getOriginalSkillIds();
        } catch (RuntimeException e) {
            log.warn("Could not read original skills of project {}: {}", projectId, e.getMessage());
            return List.of();
        }
    }

    private void writeFailedSnapshot(String projectId, Round snapshot, RuntimeException cause) {
        try {
            store.writeRoundSnapshot(projectId, snapshot.failed(String.valueOf(cause.getMessage())));
        } catch (RuntimeException e) {
            log.error("Failed snapshot of round {} could not be written", snapshot.round(), e);
        }
    }

    private void publishRound(String projectId, Round round) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("round", round.round());
        payload.put("skill_id", round.skillId());
        payload.put("avg_score", round.avgScore());
        payload.put("score_delta", round.scoreDelta());
        payload.put("plateau_level", round.plateauLevel());
        eventBus.publish(SkillbenchEvent.of("iteration.round.completed", projectId, payload));
    }

    private IterationState requireActive(String projectId) {
        IterationState state = active.get(projectId);
        if (state == null) {
            throw new EvaluationStateException(ErrorCode.NOT_RUNNING,
                    "No iteration is running for project " + projectId);
        }
        return state;
    }
}
