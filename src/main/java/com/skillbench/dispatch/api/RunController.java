package com.skillbench.dispatch.api;

import com.skillbench.core.model.ResultStatus;
import com.skillbench.core.model.RunProgress;
import com.skillbench.core.results.ExportFormat;
import com.skillbench.core.results.ResultFilter;
import com.skillbench.core.results.ResultPage;
import com.skillbench.core.results.ResultQueryService;
import com.skillbench.core.scheduler.PauseResult;
import com.skillbench.core.scheduler.ResumeResult;
import com.skillbench.core.scheduler.RetryResult;
import com.skillbench.core.scheduler.RunListener;
import com.skillbench.core.scheduler.RunScheduler;
import com.skillbench.core.scheduler.RunStartResult;
import com.skillbench.core.state.ErrorCode;
import com.skillbench.core.state.EvaluationStateException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.nio.file.Path;
import java.util.Map;

/**
 * REST controller for test runs, their results and the project event stream.
 */
@RestController
@RequestMapping("/api/v1/projects/{id}")
public class RunController {

    private static final Logger log = LoggerFactory.getLogger(RunController.class);

    private final RunScheduler scheduler;
    private final ResultQueryService results;
    private final SseStreamingService sseStreamingService;

    public RunController(RunScheduler scheduler, ResultQueryService results, SseStreamingService sseStreamingService) {
        this.scheduler = scheduler;
        this.results = results;
        this.sseStreamingService = sseStreamingService;
    }

    /**
     * POST /api/v1/projects/{id}/runs: Start a test run. Progress goes out on the event stream.
     */
    @PostMapping("/runs")
    public ResponseEntity<RunStartResult> start(@PathVariable String id) {
        RunStartResult result = scheduler.start(id, RunListener.NONE);
        log.info("Accepted test run for project {} ({} tasks)", id, result.totalTasks());
        return ResponseEntity.accepted().body(result);
    }

    @PostMapping("/runs/pause")
    public PauseResult pause(@PathVariable String id) {
        return scheduler.pause(id);
    }

    @PostMapping("/runs/resume")
    public ResumeResult resume(@PathVariable String id) {
        return scheduler.resume(id, RunListener.NONE);
    }

    @PostMapping("/runs/stop")
    public Map<String, Boolean> stop(@PathVariable String id) {
        scheduler.stop(id);
        return Map.of("stopped", true);
    }

    @GetMapping("/runs/progress")
    public RunProgress progress(@PathVariable String id) {
        return scheduler.getProgress(id);
    }

    /**
     * GET /api/v1/projects/{id}/results: Paginated result records plus the current summary.
     */
    @GetMapping("/results")
    public ResultPage results(@PathVariable String id,
                              @RequestParam(name = "skill_id", required = false) String skillId,
                              @RequestParam(name = "case_id", required = false) String caseId,
                              @RequestParam(name = "status", required = false) String status,
                              @RequestParam(name = "page", defaultValue = "1") int page,
                              @RequestParam(name = "page_size", defaultValue = "50") int pageSize) {
        return results.getResults(id, new ResultFilter(skillId, caseId, parseStatus(status)), page, pageSize);
    }

    @PostMapping("/results/retry")
    public ResponseEntity<RetryResult> retry(@PathVariable String id, @RequestBody RetryCaseRequest request) {
        if (request.skillId() == null || request.caseId() == null) {
            throw new EvaluationStateException(ErrorCode.INVALID_PARAMS, "skill_id and case_id are required");
        }
        return ResponseEntity.accepted().body(scheduler.retryCase(id, request.skillId(), request.caseId(), null));
    }

    @PostMapping("/results/export")
    public Map<String, String> export(@PathVariable String id, @RequestBody ExportRequest request) {
        if (request.destPath() == null || request.destPath().isBlank()) {
            throw new EvaluationStateException(ErrorCode.INVALID_PARAMS, "dest_path is required");
        }
        Path written = results.exportResults(id, ExportFormat.parse(request.format()), Path.of(request.destPath()));
        return Map.of("path", written.toString());
    }

    /**
     * GET /api/v1/projects/{id}/events: SSE stream of run and iteration events.
     */
    @GetMapping(value = "/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter events(@PathVariable String id) {
        scheduler.getProgress(id);
        return sseStreamingService.createEmitter(id);
    }

    private static ResultStatus parseStatus(String status) {
        if (status == null || status.isBlank()) {
            return null;
        }
        try {
            return ResultStatus.valueOf(status.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new EvaluationStateException(ErrorCode.INVALID_PARAMS, "Invalid status: " + status);
        }
    }
}
