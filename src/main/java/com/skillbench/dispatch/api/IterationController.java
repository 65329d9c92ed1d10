package com.skillbench.dispatch.api;

import com.skillbench.core.iteration.IterationListener;
import com.skillbench.core.iteration.RoundController;
import com.skillbench.core.model.ExplorationLog;
import com.skillbench.core.model.IterationProgress;
import com.skillbench.core.model.IterationReport;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * REST controller for iteration runs.
 */
@RestController
@RequestMapping("/api/v1/projects/{id}/iterations")
public class IterationController {

    private final RoundController rounds;

    public IterationController(RoundController rounds) {
        this.rounds = rounds;
    }

    @PostMapping
    public ResponseEntity<Map<String, String>> start(@PathVariable String id, @RequestBody IterationRequest request) {
        String iterationId = rounds.startIteration(id, request.toParams(), IterationListener.NONE);
        return ResponseEntity.accepted().body(Map.of("iteration_id", iterationId));
    }

    @PostMapping("/pause")
    public Map<String, Boolean> pause(@PathVariable String id) {
        rounds.pauseIteration(id);
        return Map.of("paused", true);
    }

    @PostMapping("/stop")
    public Map<String, Boolean> stop(@PathVariable String id) {
        rounds.stopIteration(id);
        return Map.of("stopped", true);
    }

    @GetMapping("/progress")
    public IterationProgress progress(@PathVariable String id) {
        return rounds.getProgress(id);
    }

    @GetMapping("/report")
    public IterationReport report(@PathVariable String id) {
        return rounds.getReport(id);
    }

    @GetMapping("/exploration-log")
    public ExplorationLog explorationLog(@PathVariable String id) {
        return rounds.getExplorationLog(id);
    }
}
