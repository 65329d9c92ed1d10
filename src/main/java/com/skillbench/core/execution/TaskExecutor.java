package com.skillbench.core.execution;

import com.skillbench.core.metrics.SkillbenchMetrics;
import com.skillbench.core.model.ResultRecord;
import com.skillbench.core.model.ResultStatus;
import com.skillbench.core.model.Score;
import com.skillbench.core.model.Task;
import com.skillbench.core.oracle.OracleClient;
import com.skillbench.core.oracle.OracleErrorCode;
import com.skillbench.core.oracle.OracleException;
import com.skillbench.core.oracle.OracleOptions;
import com.skillbench.core.oracle.OracleResponse;
import com.skillbench.core.persistence.ProjectStore;
import com.skillbench.core.persistence.StoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;

/**
 * Runs one Skill x Case task: executes the case input under the skill's
 * instructions, scores the output against the rubric and writes the result record.
 * <p>
 * {@link #execute} never throws. Execution failures become failed records;
 * scoring failures leave a completed record without scores.
 */
@Service
public class TaskExecutor {

    private static final Logger log = LoggerFactory.getLogger(TaskExecutor.class);

    private final OracleClient oracle;
    private final RubricScorer scorer;
    private final ProjectStore store;
    private final SkillbenchMetrics metrics;

    public TaskExecutor(OracleClient oracle, RubricScorer scorer, ProjectStore store, SkillbenchMetrics metrics) {
        this.oracle = oracle;
        this.scorer = scorer;
        this.store = store;
        this.metrics = metrics;
    }

    public ResultRecord execute(String projectId, Task task, RunSettings settings) {
        log.info("Task {} started (model {})", task.key(), settings.model());

        ResultStatus status = ResultStatus.COMPLETED;
        String actualOutput = "";
        long durationMs = 0;
        String error = null;
        String errorCode = null;

        try {
            var options = OracleOptions.of(task.workingDir(), settings.timeout(), settings.model())
                    .withSystemInstructions(task.skillContent());
            OracleResponse response = oracle.generate(task.testCase().input(), options);
            actualOutput = response.text() == null ? "" : response.text();
            durationMs = response.durationMs();
        } catch (OracleException e) {
            status = ResultStatus.FAILED;
            error = e.getMessage() != null ? e.getMessage() : e.getCode().name();
            errorCode = e.getCode().name();
            log.error("Task {} execution failed [{}]: {}", task.key(), errorCode, error);
        } catch (RuntimeException e) {
            status = ResultStatus.FAILED;
            error = String.valueOf(e.getMessage());
            errorCode = OracleErrorCode.EXECUTION_ERROR.name();
            log.error("Task {} execution failed unexpectedly", task.key(), e);
        }

        Score score = null;
        String reasoning = "";
        Instant scoredAt = null;
        if (status == ResultStatus.COMPLETED) {
            try {
                ScoringResult verdict = scorer.score(task.testCase(), actualOutput, task.workingDir(), settings.model());
                score = verdict.score();
                reasoning = verdict.reasoning();
                scoredAt = Instant.now();
                log.info("Task {} scored {}", task.key(), score.total());
            } catch (OracleException e) {
                metrics.recordScoringFailure();
                log.warn("Task {} scoring failed (non-fatal) [{}]: {}", task.key(), e.getCode(), e.getMessage());
            } catch (RuntimeException e) {
                metrics.recordScoringFailure();
                log.warn("Task {} scoring failed (non-fatal): {}", task.key(), e.toString());
            }
        }

        var record = new ResultRecord(
                task.caseId(),
                task.skillId(),
                task.skill().version(),
                task.baseline().refId(),
                task.baseline().version(),
                Instant.now(),
                status,
                task.testCase().input() == null ? "" : task.testCase().input(),
                task.testCase().expectedOutput() == null ? "" : task.testCase().expectedOutput(),
                actualOutput,
                durationMs,
                settings.model(),
                error,
                errorCode,
                score,
                reasoning,
                scoredAt);

        try {
            store.writeResult(projectId, record);
        } catch (StoreException e) {
            log.error("Task {} result could not be persisted", task.key(), e);
        }
        metrics.recordTaskExecution(status.name().toLowerCase(), durationMs);
        return record;
    }
}
