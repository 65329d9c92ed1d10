package com.skillbench.core.scheduler;

import com.skillbench.core.events.EventBus;
import com.skillbench.core.events.SkillbenchEvent;
import com.skillbench.core.execution.RunSettings;
import com.skillbench.core.execution.TaskExecutor;
import com.skillbench.core.logging.MdcContext;
import com.skillbench.core.metrics.SkillbenchMetrics;
import com.skillbench.core.model.BaselineRef;
import com.skillbench.core.model.CliConfig;
import com.skillbench.core.model.ProjectConfig;
import com.skillbench.core.model.ResultRecord;
import com.skillbench.core.model.RunCheckpoint;
import com.skillbench.core.model.RunProgress;
import com.skillbench.core.model.RunStatus;
import com.skillbench.core.model.SkillRef;
import com.skillbench.core.model.Summary;
import com.skillbench.core.model.Task;
import com.skillbench.core.model.TaskOutcome;
import com.skillbench.core.model.TestCase;
import com.skillbench.core.oracle.OracleProperties;
import com.skillbench.core.persistence.ProjectStore;
import com.skillbench.core.state.ErrorCode;
import com.skillbench.core.state.EvaluationStateException;
import com.skillbench.core.summary.SummaryAggregator;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs a project's Skill x Case matrix.
 * <p>
 * One execution stream per skill runs concurrently; within a stream cases run
 * strictly in case-list order. Every stream reads the run status before each task
 * and stops starting new tasks once it is no longer {@code running}; a task already
 * in flight is never preempted. A task whose result record already exists is
 * skipped, which makes resume and re-runs idempotent. After every task the
 * completed/failed counters are checkpointed into the project config.
 */
@Service
public class RunScheduler implements EvaluationRunner {

    private static final Logger log = LoggerFactory.getLogger(RunScheduler.class);

    private final ProjectStore store;
    private final TaskExecutor executor;
    private final SummaryAggregator aggregator;
    private final OracleProperties oracleProperties;
    private final EventBus eventBus;
    private final SkillbenchMetrics metrics;

    private static final Set<String> RUN_EVENTS =
            Set.of("run.progress", "run.paused", "run.completed", "run.interrupted");

    /** Active runs keyed by project id. */
    private final ConcurrentHashMap<String, RunState> runs = new ConcurrentHashMap<>();
    private final ExecutorService streams;

    public RunScheduler(ProjectStore store,
                        TaskExecutor executor,
                        SummaryAggregator aggregator,
                        OracleProperties oracleProperties,
                        EventBus eventBus,
                        SkillbenchMetrics metrics) {
        this.store = store;
        this.executor = executor;
        this.aggregator = aggregator;
        this.oracleProperties = oracleProperties;
        this.eventBus = eventBus;
        this.metrics = metrics;
        var counter = new AtomicInteger();
        this.streams = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "skill-stream-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @PreDestroy
    void shutdown() {
        streams.shutdownNow();
    }

    // ── Lifecycle ───────────────────────────────────────────────────

    /**
     * Builds the task matrix and launches the execution streams. Returns immediately.
     *
     * @throws EvaluationStateException NOT_FOUND for an unknown project,
     *                                  ALREADY_RUNNING while a run is active
     */
    public RunStartResult start(String projectId, RunListener listener) {
        ProjectConfig config = store.readConfig(projectId);
        if (runs.containsKey(projectId)) {
            throw new EvaluationStateException(ErrorCode.ALREADY_RUNNING,
                    "A run is already active for project " + projectId);
        }

        List<Task> tasks = buildTasks(projectId, config);
        int completed = 0;
        int failed = 0;
        for (Task task : tasks) {
            Optional<ResultRecord> existing = store.readResult(projectId, task.skillId(), task.caseId());
            if (existing.isPresent()) {
                if (existing.get().isCompleted()) {
                    completed++;
                } else {
                    failed++;
                }
            }
        }

        var state = new RunState(projectId, tasks, settingsFor(config), completed, failed);
        if (runs.putIfAbsent(projectId, state) != null) {
            throw new EvaluationStateException(ErrorCode.ALREADY_RUNNING,
                    "A run is already active for project " + projectId);
        }
        attach(state, listener);

        try {
            writeStatus(state, RunStatus.RUNNING);
        } catch (RuntimeException e) {
            runs.remove(projectId, state);
            state.releaseSubscriptions();
            throw e;
        }
        log.info("Test run started for project {}: {} tasks, {} already recorded",
                projectId, tasks.size(), completed + failed);
        launch(state, state.generation());
        return new RunStartResult(true, tasks.size());
    }

    /**
     * Asks every stream to stop after its in-flight task. The checkpoint is kept for resume.
     *
     * @throws EvaluationStateException NOT_RUNNING unless the run is running
     */
    public PauseResult pause(String projectId) {
        RunState state = runs.get(projectId);
        if (state == null) {
            throw new EvaluationStateException(ErrorCode.NOT_RUNNING, "No running test for project " + projectId);
        }
        synchronized (state) {
            if (!state.isRunning()) {
                throw new EvaluationStateException(ErrorCode.NOT_RUNNING, "No running test for project " + projectId);
            }
            state.status(RunStatus.PAUSED);
        }
        RunCheckpoint checkpoint = writeStatus(state, RunStatus.PAUSED);
        log.info("Test run paused for project {} at checkpoint {}/{}",
                projectId, checkpoint.lastCheckpoint(), checkpoint.totalTasks());
        return new PauseResult(true, checkpoint.lastCheckpoint());
    }

    /**
     * Restarts the streams of a paused run. The new streams start only after the
     * previous ones have drained, so no task runs twice.
     *
     * @param listener additional listener for the resumed run, may be null
     * @throws EvaluationStateException NOT_PAUSED unless the run is paused
     */
    public ResumeResult resume(String projectId, RunListener listener) {
        RunState state = runs.get(projectId);
        if (state == null) {
            throw new EvaluationStateException(ErrorCode.NOT_PAUSED, "No paused test for project " + projectId);
        }
        int generation;
        synchronized (state) {
            if (state.status() != RunStatus.PAUSED) {
                throw new EvaluationStateException(ErrorCode.NOT_PAUSED, "No paused test for project " + projectId);
            }
            state.status(RunStatus.RUNNING);
            generation = state.nextGeneration();
        }
        attach(state, listener);
        int remaining = state.remaining();
        writeStatus(state, RunStatus.RUNNING);
        log.info("Test run resumed for project {}: {} tasks remaining", projectId, remaining);

        state.loop().whenComplete((v, err) -> launch(state, generation));
        return new ResumeResult(true, remaining);
    }

    /**
     * Interrupts a running or paused run. Interrupted is terminal: the run state
     * is discarded, result records stay on disk.
     *
     * @throws EvaluationStateException NOT_RUNNING when no run is active
     */
    public void stop(String projectId) {
        RunState state = runs.remove(projectId);
        if (state == null) {
            throw new EvaluationStateException(ErrorCode.NOT_RUNNING, "No active test for project " + projectId);
        }
        synchronized (state) {
            state.status(RunStatus.INTERRUPTED);
        }
        writeStatus(state, RunStatus.INTERRUPTED);
        log.info("Test run stopped for project {}", projectId);

        state.loop().whenComplete((v, err) -> {
            settleCheckpoint(state, RunStatus.INTERRUPTED);
            metrics.recordRunResult("interrupted");
            publishTerminal(state, "run.interrupted");
            state.releaseSubscriptions();
        });
    }

    /**
     * Progress of the active run, or the last checkpoint persisted in the project config.
     */
    public RunProgress getProgress(String projectId) {
        RunState state = runs.get(projectId);
        if (state != null) {
            return state.progress(null);
        }
        ProjectConfig config = store.readConfig(projectId);
        RunCheckpoint cp = config.getProgress();
        RunStatus status = config.getStatus() == null ? RunStatus.PENDING : config.getStatus();
        if (cp == null) {
            return new RunProgress(projectId, status, 0, 0, 0, null);
        }
        return new RunProgress(projectId, status, cp.totalTasks(), cp.completedTasks(), cp.failedTasks(), null);
    }

    public boolean isActive(String projectId) {
        return runs.containsKey(projectId);
    }

    @Override
    public RunProgress runToCompletion(String projectId) {
        var done = new CompletableFuture<RunProgress>();
        start(projectId, progress -> {
            if (progress.status() == RunStatus.COMPLETED) {
                done.complete(progress);
            } else if (progress.status() == RunStatus.INTERRUPTED) {
                done.completeExceptionally(new RunInterruptedException("Test run interrupted for project " + projectId));
            }
        });
        try {
            return done.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RunInterruptedException("Interrupted while waiting for project " + projectId, e);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RunInterruptedException rie) {
                throw rie;
            }
            throw new RunInterruptedException("Test run failed for project " + projectId, e.getCause());
        }
    }

    // ── Retry ───────────────────────────────────────────────────────

    /**
     * Re-executes one task in the background, overwriting its result record, then
     * refreshes the summary.
     *
     * @throws EvaluationStateException ALREADY_RUNNING while a run is active,
     *                                  NOT_FOUND for an unknown skill/case pair
     */
    public RetryResult retryCase(String projectId, String skillId, String caseId, RunListener listener) {
        ProjectConfig config = store.readConfig(projectId);
        if (runs.containsKey(projectId)) {
            throw new EvaluationStateException(ErrorCode.ALREADY_RUNNING,
                    "Cannot retry while a run is active for project " + projectId);
        }
        List<Task> tasks = buildTasks(projectId, config);
        Task task = tasks.stream()
                .filter(t -> t.skillId().equals(skillId) && t.caseId().equals(caseId))
                .findFirst()
                .orElseThrow(() -> EvaluationStateException.notFound("Task " + skillId + "/" + caseId));

        String taskId = "retry_" + skillId + "_" + caseId + "_" + System.currentTimeMillis();
        RunSettings settings = settingsFor(config);
        log.info("Retrying task {} of project {} as {}", task.key(), projectId, taskId);
        EventBus.Subscription subscription = listener == null || listener == RunListener.NONE
                ? EventBus.Subscription.NONE
                : eventBus.subscribeRunProgress(projectId,
                        event -> taskId.equals(event.taskId()), listener::onProgress);

        CompletableFuture.runAsync(() -> {
            MdcContext.setTask(projectId, skillId, caseId);
            try {
                ResultRecord record = executor.execute(projectId, task, settings);
                refreshSummary(projectId, tasks);
                var outcome = new TaskOutcome(skillId, caseId, record.status(),
                        record.scores() == null ? null : record.scores().total());
                var progress = new RunProgress(projectId, RunStatus.COMPLETED, 1,
                        record.isCompleted() ? 1 : 0, record.isCompleted() ? 0 : 1, outcome);
                eventBus.publish(SkillbenchEvent.run("run.retry.completed", taskId, progress));
            } catch (RuntimeException e) {
                log.error("Retry {} of project {} failed", taskId, projectId, e);
                eventBus.publish(SkillbenchEvent.run("run.retry.failed", taskId,
                        new RunProgress(projectId, RunStatus.INTERRUPTED, 1, 0, 1, null)));
            } finally {
                subscription.unsubscribe();
                MdcContext.clear();
            }
        }, streams);
        return new RetryResult(taskId);
    }

    // ── Internals ───────────────────────────────────────────────────

    /**
     * Cross product of configured skills and the cases of every configured baseline,
     * in config order.
     */
    List<Task> buildTasks(String projectId, ProjectConfig config) {
        List<Task> tasks = new ArrayList<>();
        for (SkillRef skill : config.getSkills()) {
            String content = store.readSkillContent(projectId, skill);
            Path workingDir = store.workingDir(projectId, skill.refId());
            for (BaselineRef baseline : config.getBaselines()) {
                for (TestCase testCase : store.readCases(projectId, baseline)) {
                    tasks.add(new Task(skill, content, workingDir, baseline, testCase,
                            store.resultPath(projectId, skill.refId(), testCase.caseId())));
                }
            }
        }
        return tasks;
    }

    private RunSettings settingsFor(ProjectConfig config) {
        CliConfig cli = config.getCliConfig();
        String model = cli != null && cli.model() != null && !cli.model().isBlank()
                ? cli.model() : oracleProperties.getDefaultModel();
        int timeoutSeconds = cli != null && cli.timeoutSeconds() != null && cli.timeoutSeconds() > 0
                ? cli.timeoutSeconds() : oracleProperties.getDefaultTimeoutSeconds();
        return new RunSettings(model, Duration.ofSeconds(timeoutSeconds));
    }

    private void launch(RunState state, int generation) {
        Map<String, List<Task>> bySkill = new LinkedHashMap<>();
        for (Task task : state.tasks()) {
            bySkill.computeIfAbsent(task.skillId(), k -> new ArrayList<>()).add(task);
        }
        log.debug("Launching {} skill stream(s) for project {} (generation {})",
                bySkill.size(), state.projectId(), generation);

        CompletableFuture<?>[] running = bySkill.entrySet().stream()
                .map(e -> CompletableFuture.runAsync(() -> runStream(state, e.getKey(), e.getValue()), streams))
                .toArray(CompletableFuture[]::new);
        state.loop(CompletableFuture.allOf(running)
                .whenComplete((v, err) -> onDrained(state, generation, err)));
    }

    private void runStream(RunState state, String skillId, List<Task> tasks) {
        String projectId = state.projectId();
        log.info("Skill stream {} started for project {} ({} tasks)", skillId, projectId, tasks.size());
        for (Task task : tasks) {
            if (!state.isRunning()) {
                log.info("Skill stream {} halted: run is {}", skillId, state.status());
                break;
            }
            if (store.hasResult(projectId, task.skillId(), task.caseId())) {
                continue;
            }
            MdcContext.setTask(projectId, task.skillId(), task.caseId());
            try {
                ResultRecord record = executor.execute(projectId, task, state.settings());
                if (record.isCompleted()) {
                    state.recordCompleted();
                } else {
                    state.recordFailed();
                }
                saveCheckpoint(state);
                var outcome = new TaskOutcome(task.skillId(), task.caseId(), record.status(),
                        record.scores() == null ? null : record.scores().total());
                eventBus.publish(SkillbenchEvent.run("run.progress", task.key(), state.progress(outcome)));
            } catch (RuntimeException e) {
                log.error("Task {} of project {} aborted unexpectedly", task.key(), projectId, e);
            } finally {
                MdcContext.clear();
            }
        }
        log.info("Skill stream {} finished for project {}", skillId, projectId);
    }

    private void onDrained(RunState state, int generation, Throwable err) {
        String projectId = state.projectId();
        if (err != null) {
            log.error("Skill streams of project {} ended abnormally", projectId, err);
        }
        if (state.generation() != generation) {
            return;
        }
        RunStatus status;
        synchronized (state) {
            status = state.status();
            if (status == RunStatus.RUNNING) {
                state.status(RunStatus.COMPLETED);
            }
        }
        if (status == RunStatus.RUNNING) {
            RunCheckpoint checkpoint = writeStatus(state, RunStatus.COMPLETED);
            try {
                refreshSummary(projectId, state.tasks());
            } catch (RuntimeException e) {
                log.error("Summary of project {} could not be written", projectId, e);
            }
            runs.remove(projectId, state);
            metrics.recordRunResult("completed");
            log.info("Test run completed for project {}: {} completed, {} failed",
                    projectId, checkpoint.completedTasks(), checkpoint.failedTasks());
            publishTerminal(state, "run.completed");
            state.releaseSubscriptions();
        } else if (status == RunStatus.PAUSED) {
            RunCheckpoint checkpoint = settleCheckpoint(state, RunStatus.PAUSED);
            log.info("Skill streams of project {} drained after pause at checkpoint {}/{}",
                    projectId, checkpoint.lastCheckpoint(), checkpoint.totalTasks());
            publishTerminal(state, "run.paused");
        }
    }

    Summary refreshSummary(String projectId, List<Task> tasks) {
        Summary summary = aggregator.aggregate(projectId, tasks, store.listResults(projectId));
        store.writeSummary(projectId, summary);
        return summary;
    }

    private void saveCheckpoint(RunState state) {
        try {
            store.updateConfig(state.projectId(), config -> {
                config.setProgress(state.checkpoint());
                return config;
            });
        } catch (RuntimeException e) {
            RunCheckpoint checkpoint = state.checkpoint();
            log.error("Checkpoint {}/{} of project {} could not be saved",
                    checkpoint.lastCheckpoint(), checkpoint.totalTasks(), state.projectId(), e);
        }
    }

    /**
     * Persists the final counters once the streams have drained, unless the project
     * has moved on to another status in the meantime.
     */
    private RunCheckpoint settleCheckpoint(RunState state, RunStatus expected) {
        var saved = new RunCheckpoint[1];
        try {
            store.updateConfig(state.projectId(), config -> {
                saved[0] = state.checkpoint();
                if (config.getStatus() == expected) {
                    config.setProgress(saved[0]);
                }
                return config;
            });
        } catch (RuntimeException e) {
            log.error("Final checkpoint of project {} could not be saved", state.projectId(), e);
        }
        return saved[0] == null ? state.checkpoint() : saved[0];
    }

    /**
     * Writes status and counters together. The counters are read under the config lock
     * so a slower writer never replaces a newer checkpoint with an older one.
     */
    private RunCheckpoint writeStatus(RunState state, RunStatus status) {
        var written = new RunCheckpoint[1];
        store.updateConfig(state.projectId(), config -> {
            written[0] = state.checkpoint();
            config.setStatus(status);
            config.setProgress(written[0]);
            return config;
        });
        return written[0];
    }

    private void attach(RunState state, RunListener listener) {
        if (listener == null || listener == RunListener.NONE) {
            return;
        }
        state.track(eventBus.subscribeRunProgress(state.projectId(),
                event -> RUN_EVENTS.contains(event.eventType()), listener::onProgress));
    }

    private void publishTerminal(RunState state, String eventType) {
        eventBus.publish(SkillbenchEvent.run(eventType, null, state.progress(null)));
    }
}
