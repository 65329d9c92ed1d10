package com.skillbench.core.scheduler;

import com.skillbench.core.events.EventBus;
import com.skillbench.core.execution.RunSettings;
import com.skillbench.core.model.RunCheckpoint;
import com.skillbench.core.model.RunProgress;
import com.skillbench.core.model.RunStatus;
import com.skillbench.core.model.Task;
import com.skillbench.core.model.TaskOutcome;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory state of one project's active run. The status doubles as the
 * cooperative cancellation flag read by every execution stream before each task.
 */
final class RunState {

    private final String projectId;
    private final List<Task> tasks;
    private final RunSettings settings;
    private final AtomicInteger completed;
    private final AtomicInteger failed;
    private final List<EventBus.Subscription> subscriptions = new CopyOnWriteArrayList<>();

    private volatile RunStatus status = RunStatus.RUNNING;
    /** Bumped on every resume; only the newest loop may finalize the run. */
    private int generation;
    private CompletableFuture<Void> loop = CompletableFuture.completedFuture(null);

    RunState(String projectId, List<Task> tasks, RunSettings settings, int completed, int failed) {
        this.projectId = projectId;
        this.tasks = List.copyOf(tasks);
        this.settings = settings;
        this.completed = new AtomicInteger(completed);
        this.failed = new AtomicInteger(failed);
    }

    String projectId() {
        return projectId;
    }

    List<Task> tasks() {
        return tasks;
    }

    RunSettings settings() {
        return settings;
    }

    RunStatus status() {
        return status;
    }

    void status(RunStatus status) {
        this.status = status;
    }

    boolean isRunning() {
        return status == RunStatus.RUNNING;
    }

    void recordCompleted() {
        completed.incrementAndGet();
    }

    void recordFailed() {
        failed.incrementAndGet();
    }

    synchronized int generation() {
        return generation;
    }

    synchronized int nextGeneration() {
        return ++generation;
    }

    synchronized CompletableFuture<Void> loop() {
        return loop;
    }

    synchronized void loop(CompletableFuture<Void> loop) {
        this.loop = loop;
    }

    void track(EventBus.Subscription subscription) {
        subscriptions.add(subscription);
    }

    /** Detaches the run's listeners from the bus once the run is over. */
    void releaseSubscriptions() {
        for (EventBus.Subscription subscription : subscriptions) {
            subscription.unsubscribe();
        }
        subscriptions.clear();
    }

    RunCheckpoint checkpoint() {
        return RunCheckpoint.of(tasks.size(), completed.get(), failed.get());
    }

    RunProgress progress(TaskOutcome lastResult) {
        return new RunProgress(projectId, status, tasks.size(), completed.get(), failed.get(), lastResult);
    }

    int remaining() {
        return tasks.size() - completed.get() - failed.get();
    }
}
