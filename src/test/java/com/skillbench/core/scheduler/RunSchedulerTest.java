package com.skillbench.core.scheduler;

import com.skillbench.core.TestWorkspace;
import com.skillbench.core.events.EventBus;
import com.skillbench.core.events.SkillbenchEvent;
import com.skillbench.core.execution.RubricScorer;
import com.skillbench.core.execution.TaskExecutor;
import com.skillbench.core.metrics.SkillbenchMetrics;
import com.skillbench.core.model.ProjectConfig;
import com.skillbench.core.model.ResultRecord;
import com.skillbench.core.model.ResultStatus;
import com.skillbench.core.model.RunProgress;
import com.skillbench.core.model.RunStatus;
import com.skillbench.core.model.Score;
import com.skillbench.core.oracle.OracleClient;
import com.skillbench.core.oracle.OracleErrorCode;
import com.skillbench.core.oracle.OracleException;
import com.skillbench.core.oracle.OracleOptions;
import com.skillbench.core.oracle.OracleProperties;
import com.skillbench.core.oracle.OracleResponse;
import com.skillbench.core.oracle.StructuredOutputParser;
import com.skillbench.core.persistence.ProjectStore;
import com.skillbench.core.persistence.WorkspaceProperties;
import com.skillbench.core.state.ErrorCode;
import com.skillbench.core.state.EvaluationStateException;
import com.skillbench.core.summary.SummaryAggregator;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

import static org.junit.jupiter.api.Assertions.*;

class RunSchedulerTest {

    private static final String VERDICT = """
            {"scores": {"functional_correctness": 25, "robustness": 15, "readability": 12,
             "conciseness": 12, "complexity_control": 8, "format_compliance": 8}, "reasoning": "ok"}""";

    @TempDir
    Path root;

    private ProjectStore store;
    private FakeOracle oracle;
    private EventBus eventBus;
    private RunScheduler scheduler;

    @BeforeEach
    void setUp() {
        store = TestWorkspace.store(root);
        TestWorkspace.createProject(store, "p1", List.of("s1", "s2"), TestWorkspace.cases(3));
        oracle = new FakeOracle();
        eventBus = new EventBus();
        scheduler = newScheduler();
    }

    @AfterEach
    void tearDown() {
        oracle.release();
        scheduler.shutdown();
    }

    private RunScheduler newScheduler() {
        var metrics = new SkillbenchMetrics(new SimpleMeterRegistry());
        var properties = new OracleProperties();
        var scorer = new RubricScorer(oracle, new StructuredOutputParser(), properties);
        var executor = new TaskExecutor(oracle, scorer, store, metrics);
        return new RunScheduler(store, executor, new SummaryAggregator(), properties, eventBus, metrics);
    }

    /** Completes with the first progress matching {@code terminal}. */
    private static RunListener awaiting(CompletableFuture<RunProgress> future, Predicate<RunProgress> terminal) {
        return progress -> {
            if (terminal.test(progress)) {
                future.complete(progress);
            }
        };
    }

    private static Predicate<RunProgress> status(RunStatus status) {
        return p -> p.status() == status && p.lastResult() == null;
    }

    private RunProgress runAndWait() throws Exception {
        var done = new CompletableFuture<RunProgress>();
        scheduler.start("p1", awaiting(done, status(RunStatus.COMPLETED)));
        return done.get(10, TimeUnit.SECONDS);
    }

    @Nested
    @DisplayName("start")
    class StartTests {

        @Test
        @DisplayName("runs every skill x case task and writes the summary")
        void allSucceed() throws Exception {
            RunProgress progress = runAndWait();

            assertEquals(6, progress.totalTasks());
            assertEquals(6, progress.completedTasks());
            assertEquals(0, progress.failedTasks());
            assertEquals(6, oracle.executions.get());
            assertEquals(6, store.listResults("p1").size());

            var summary = store.readSummary("p1").orElseThrow();
            assertEquals(2, summary.ranking().size());
            assertEquals(80.0, summary.ranking().get(0).avgScore());
            assertEquals(RunStatus.COMPLETED, store.readConfig("p1").getStatus());
            assertFalse(scheduler.isActive("p1"));
        }

        @Test
        @DisplayName("a failing task does not stop its stream or the other streams")
        void failuresAreIsolated() throws Exception {
            oracle.failWhen = (prompt, options) ->
                    "instructions for s1".equals(options.systemInstructions()) && prompt.equals("input 2");

            RunProgress progress = runAndWait();

            assertEquals(5, progress.completedTasks());
            assertEquals(1, progress.failedTasks());
            ResultRecord failed = store.readResult("p1", "s1", "case_002").orElseThrow();
            assertEquals(ResultStatus.FAILED, failed.status());
            assertEquals("EXECUTION_ERROR", failed.errorCode());
            assertNull(failed.scores());
            assertTrue(store.readResult("p1", "s1", "case_003").orElseThrow().isCompleted());
        }

        @Test
        @DisplayName("tasks with an existing record are skipped")
        void idempotentRerun() throws Exception {
            store.writeResult("p1", completedRecord("s1", "case_001"));
            store.writeResult("p1", completedRecord("s2", "case_003"));

            RunProgress progress = runAndWait();

            assertEquals(4, oracle.executions.get());
            assertEquals(6, progress.completedTasks());
            assertEquals("seeded", store.readResult("p1", "s1", "case_001").orElseThrow().actualOutput());
        }

        @Test
        @DisplayName("a second start while running is rejected")
        void alreadyRunning() throws Exception {
            oracle.blockFirstExecution();
            var done = new CompletableFuture<RunProgress>();
            scheduler.start("p1", awaiting(done, status(RunStatus.COMPLETED)));
            oracle.awaitBlocked();

            var ex = assertThrows(EvaluationStateException.class, () -> scheduler.start("p1", RunListener.NONE));
            assertEquals(ErrorCode.ALREADY_RUNNING, ex.getCode());

            oracle.release();
            assertEquals(6, done.get(10, TimeUnit.SECONDS).completedTasks());
        }

        @Test
        @DisplayName("an unknown project is NOT_FOUND")
        void unknownProject() {
            var ex = assertThrows(EvaluationStateException.class, () -> scheduler.start("nope", RunListener.NONE));
            assertEquals(ErrorCode.NOT_FOUND, ex.getCode());
        }

        @Test
        @DisplayName("progress events are published on the event bus")
        void publishesEvents() throws Exception {
            List<SkillbenchEvent> events = new CopyOnWriteArrayList<>();
            eventBus.subscribe("p1", events::add);

            runAndWait();

            assertEquals(6, events.stream().filter(e -> e.eventType().equals("run.progress")).count());
            assertTrue(events.stream().anyMatch(e -> e.eventType().equals("run.completed")));
        }

        @Test
        @DisplayName("run listeners are fed by the event bus and detached once the run completes")
        void listenersGoThroughTheBus() throws Exception {
            List<RunProgress> seen = new CopyOnWriteArrayList<>();
            var done = new CompletableFuture<RunProgress>();
            scheduler.start("p1", progress -> {
                seen.add(progress);
                if (status(RunStatus.COMPLETED).test(progress)) {
                    done.complete(progress);
                }
            });
            assertEquals(1, eventBus.subscriberCount("p1"));

            done.get(10, TimeUnit.SECONDS);
            long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
            while (eventBus.subscriberCount("p1") > 0 && System.nanoTime() < deadline) {
                Thread.sleep(10);
            }

            assertEquals(0, eventBus.subscriberCount("p1"));
            assertEquals(7, seen.size());
            assertEquals(6, seen.stream().filter(p -> p.lastResult() != null).count());
        }
    }

    @Nested
    @DisplayName("pause, resume and stop")
    class LifecycleTests {

        @Test
        @DisplayName("pause lets the in-flight task finish and resume runs only what is left")
        void pauseAndResume() throws Exception {
            TestWorkspace.createProject(store, "p2", List.of("solo"), TestWorkspace.cases(3));
            oracle.blockFirstExecution();
            var paused = new CompletableFuture<RunProgress>();
            scheduler.start("p2", awaiting(paused, status(RunStatus.PAUSED)));
            oracle.awaitBlocked();

            PauseResult pause = scheduler.pause("p2");
            assertTrue(pause.paused());
            assertEquals(0, pause.checkpoint());
            oracle.release();

            RunProgress atPause = paused.get(10, TimeUnit.SECONDS);
            assertEquals(1, atPause.completedTasks());
            assertEquals(1, oracle.executions.get());
            assertEquals(RunStatus.PAUSED, store.readConfig("p2").getStatus());
            assertEquals(1, store.readConfig("p2").getProgress().completedTasks());
            assertTrue(scheduler.isActive("p2"));

            var done = new CompletableFuture<RunProgress>();
            ResumeResult resume = scheduler.resume("p2", awaiting(done, status(RunStatus.COMPLETED)));
            assertEquals(2, resume.remainingTasks());

            RunProgress finished = done.get(10, TimeUnit.SECONDS);
            assertEquals(3, finished.completedTasks());
            assertEquals(3, oracle.executions.get());
            assertEquals(3, store.listResults("p2").size());
        }

        @Test
        @DisplayName("the persisted checkpoint after a pause counts every task that finished")
        void pausedCheckpointIsNotOverwrittenBySlowerStream() throws Exception {
            scheduler.shutdown();
            var properties = new WorkspaceProperties();
            properties.setRoot(root.toString());
            var slowStore = new SlowCheckpointStore(properties);
            store = slowStore;
            scheduler = newScheduler();
            TestWorkspace.createProject(store, "p3", List.of("a", "b"), TestWorkspace.cases(2));

            oracle.blockFirstExecutions(2);
            var paused = new CompletableFuture<RunProgress>();
            scheduler.start("p3", awaiting(paused, status(RunStatus.PAUSED)));
            oracle.awaitBlocked();

            assertEquals(0, scheduler.pause("p3").checkpoint());
            slowStore.delayNextStreamWrite.set(true);
            oracle.release();

            RunProgress atPause = paused.get(10, TimeUnit.SECONDS);
            assertEquals(2, atPause.completedTasks());
            var config = store.readConfig("p3");
            assertEquals(RunStatus.PAUSED, config.getStatus());
            assertEquals(2, config.getProgress().completedTasks());
            assertEquals(2, config.getProgress().lastCheckpoint());
        }

        @Test
        @DisplayName("stop interrupts the run and keeps finished records")
        void stop() throws Exception {
            oracle.blockFirstExecution();
            var interrupted = new CompletableFuture<RunProgress>();
            scheduler.start("p1", awaiting(interrupted, status(RunStatus.INTERRUPTED)));
            oracle.awaitBlocked();

            scheduler.stop("p1");
            oracle.release();

            RunProgress atStop = interrupted.get(10, TimeUnit.SECONDS);
            assertFalse(scheduler.isActive("p1"));
            assertEquals(RunStatus.INTERRUPTED, store.readConfig("p1").getStatus());
            assertEquals(atStop.completedTasks(), store.readConfig("p1").getProgress().completedTasks());
            assertTrue(store.listResults("p1").size() < 6);
        }

        @Test
        @DisplayName("state transitions that are not allowed are rejected")
        void invalidTransitions() {
            assertEquals(ErrorCode.NOT_RUNNING,
                    assertThrows(EvaluationStateException.class, () -> scheduler.pause("p1")).getCode());
            assertEquals(ErrorCode.NOT_PAUSED,
                    assertThrows(EvaluationStateException.class, () -> scheduler.resume("p1", null)).getCode());
            assertEquals(ErrorCode.NOT_RUNNING,
                    assertThrows(EvaluationStateException.class, () -> scheduler.stop("p1")).getCode());
        }

        @Test
        @DisplayName("resume of a running run is NOT_PAUSED")
        void resumeWhileRunning() throws Exception {
            oracle.blockFirstExecution();
            var done = new CompletableFuture<RunProgress>();
            scheduler.start("p1", awaiting(done, status(RunStatus.COMPLETED)));
            oracle.awaitBlocked();

            var ex = assertThrows(EvaluationStateException.class, () -> scheduler.resume("p1", null));
            assertEquals(ErrorCode.NOT_PAUSED, ex.getCode());

            oracle.release();
            done.get(10, TimeUnit.SECONDS);
        }
    }

    @Nested
    @DisplayName("progress and retry")
    class ProgressTests {

        @Test
        @DisplayName("progress falls back to the checkpoint on disk")
        void progressFromDisk() throws Exception {
            runAndWait();

            RunProgress progress = newScheduler().getProgress("p1");

            assertEquals(RunStatus.COMPLETED, progress.status());
            assertEquals(6, progress.totalTasks());
            assertEquals(6, progress.completedTasks());
        }

        @Test
        @DisplayName("a project that never ran reports pending")
        void neverRan() {
            RunProgress progress = scheduler.getProgress("p1");
            assertEquals(RunStatus.PENDING, progress.status());
            assertEquals(0, progress.totalTasks());
        }

        @Test
        @DisplayName("retry overwrites a failed record and refreshes the summary")
        void retryFailedCase() throws Exception {
            oracle.failWhen = (prompt, options) ->
                    "instructions for s2".equals(options.systemInstructions()) && prompt.equals("input 1");
            runAndWait();
            assertEquals(ResultStatus.FAILED, store.readResult("p1", "s2", "case_001").orElseThrow().status());

            oracle.failWhen = (prompt, options) -> false;
            var retried = new CompletableFuture<RunProgress>();
            RetryResult retry = scheduler.retryCase("p1", "s2", "case_001", retried::complete);

            assertTrue(retry.taskId().startsWith("retry_s2_case_001_"));
            RunProgress progress = retried.get(10, TimeUnit.SECONDS);
            assertEquals(1, progress.completedTasks());
            assertTrue(store.readResult("p1", "s2", "case_001").orElseThrow().isScored());
            assertEquals(3, store.readSummary("p1").orElseThrow().find("s2").orElseThrow().completedCases());
        }

        @Test
        @DisplayName("retry of an unknown task is NOT_FOUND")
        void retryUnknownTask() {
            var ex = assertThrows(EvaluationStateException.class,
                    () -> scheduler.retryCase("p1", "s1", "case_999", null));
            assertEquals(ErrorCode.NOT_FOUND, ex.getCode());
        }
    }

    private static ResultRecord completedRecord(String skillId, String caseId) {
        return new ResultRecord(caseId, skillId, "v1", "b1", "v1", Instant.now(), ResultStatus.COMPLETED,
                "in", "out", "seeded", 5, "m", null, null, Score.of(20, 10, 10, 10, 5, 5), "", Instant.now());
    }

    /**
     * Holds the next config write of an execution stream outside the config lock, so a
     * faster stream checkpoints first.
     */
    static final class SlowCheckpointStore extends ProjectStore {

        final AtomicBoolean delayNextStreamWrite = new AtomicBoolean();

        SlowCheckpointStore(WorkspaceProperties properties) {
            super(properties);
        }

        @Override
        public ProjectConfig updateConfig(String projectId, UnaryOperator<ProjectConfig> change) {
            if (Thread.currentThread().getName().startsWith("skill-stream-")
                    && delayNextStreamWrite.compareAndSet(true, false)) {
                try {
                    Thread.sleep(800);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
            return super.updateConfig(projectId, change);
        }
    }

    /**
     * Answers execution calls (those carrying skill instructions) with code and
     * scoring calls with a fixed verdict totalling 80.
     */
    static final class FakeOracle implements OracleClient {

        interface FailRule {
            boolean test(String prompt, OracleOptions options);
        }

        final AtomicInteger executions = new AtomicInteger();
        volatile FailRule failWhen = (prompt, options) -> false;

        private volatile CountDownLatch gate = new CountDownLatch(0);
        private volatile CountDownLatch blocked = new CountDownLatch(1);
        private volatile int toBlock;
        private final AtomicInteger blockedCalls = new AtomicInteger();

        void blockFirstExecution() {
            blockFirstExecutions(1);
        }

        /** Holds the first {@code count} executions until {@link #release()}. */
        void blockFirstExecutions(int count) {
            toBlock = count;
            blocked = new CountDownLatch(count);
            gate = new CountDownLatch(1);
        }

        void awaitBlocked() throws InterruptedException {
            assertTrue(blocked.await(10, TimeUnit.SECONDS), "no execution reached the oracle");
        }

        void release() {
            gate.countDown();
        }

        @Override
        public OracleResponse generate(String prompt, OracleOptions options) {
            if (options.systemInstructions() == null) {
                return new OracleResponse(VERDICT, 5, options.model());
            }
            executions.incrementAndGet();
            if (blockedCalls.getAndIncrement() < toBlock && gate.getCount() > 0) {
                blocked.countDown();
                try {
                    gate.await(10, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
            if (failWhen.test(prompt, options)) {
                throw new OracleException(OracleErrorCode.EXECUTION_ERROR, "simulated failure");
            }
            return new OracleResponse("class Answer {}", 20, options.model());
        }
    }
}
