package com.skillbench.core.events;

import com.skillbench.core.model.RunProgress;
import com.skillbench.core.model.TaskOutcome;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * An event emitted during test runs and iterations, used for SSE streaming, run listeners
 * and CLI follow mode.
 *
 * @param eventType event type (e.g. "run.progress", "run.completed", "iteration.round.completed")
 * @param projectId the project this event belongs to
 * @param taskId    the task this event relates to, as "skillId/caseId" (nullable for run-level events)
 * @param payload   wire form of the event, as streamed to SSE clients
 * @param progress  typed run snapshot, present on run events only
 * @param timestamp when the event occurred
 */
public record SkillbenchEvent(
    String eventType,
    String projectId,
    String taskId,
    Map<String, Object> payload,
    RunProgress progress,
    Instant timestamp
) {

    public SkillbenchEvent(String eventType, String projectId, String taskId,
                           Map<String, Object> payload, Instant timestamp) {
        this(eventType, projectId, taskId, payload, null, timestamp);
    }

    public static SkillbenchEvent of(String eventType, String projectId, Map<String, Object> payload) {
        return new SkillbenchEvent(eventType, projectId, null, payload, null, Instant.now());
    }

    /**
     * Build a run event from a progress snapshot. The payload mirrors the snapshot's counters.
     */
    public static SkillbenchEvent run(String eventType, String taskId, RunProgress progress) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("status", progress.status().name().toLowerCase());
        payload.put("total_tasks", progress.totalTasks());
        payload.put("completed_tasks", progress.completedTasks());
        payload.put("failed_tasks", progress.failedTasks());
        TaskOutcome last = progress.lastResult();
        if (last != null) {
            payload.put("last_result", last);
        }
        return new SkillbenchEvent(eventType, progress.projectId(), taskId, payload, progress, Instant.now());
    }

    public boolean isRunEvent() {
        return progress != null;
    }
}
