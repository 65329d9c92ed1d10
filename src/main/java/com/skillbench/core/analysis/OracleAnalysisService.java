package com.skillbench.core.analysis;

import com.skillbench.core.model.ProjectConfig;
import com.skillbench.core.model.SkillRef;
import com.skillbench.core.model.Summary;
import com.skillbench.core.oracle.OracleClient;
import com.skillbench.core.oracle.OracleOptions;
import com.skillbench.core.oracle.OracleProperties;
import com.skillbench.core.oracle.OracleResponse;
import com.skillbench.core.oracle.StructuredOutputParser;
import com.skillbench.core.persistence.ProjectStore;
import com.skillbench.core.state.EvaluationStateException;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Default analysis: one oracle call over the summary, the skill texts and the
 * widest-spread cases, parsed into an {@link AnalysisReport} and written to
 * {@code analysis_report.json}.
 */
@Service
public class OracleAnalysisService implements AnalysisCollaborator {

    private static final Logger log = LoggerFactory.getLogger(OracleAnalysisService.class);

    private final ProjectStore store;
    private final OracleClient oracle;
    private final StructuredOutputParser parser;
    private final OracleProperties properties;
    private final ExecutorService worker = Executors.newSingleThreadExecutor(r -> {
        Thread t = new Thread(r, "analysis-worker");
        t.setDaemon(true);
        return t;
    });

    public OracleAnalysisService(ProjectStore store, OracleClient oracle,
                                 StructuredOutputParser parser, OracleProperties properties) {
        this.store = store;
        this.oracle = oracle;
        this.parser = parser;
        this.properties = properties;
    }

    @PreDestroy
    void shutdown() {
        worker.shutdownNow();
    }

    @Override
    public CompletableFuture<AnalysisReport> analyze(String projectId) {
        ProjectConfig config = store.readConfig(projectId);
        log.info("Analysis started for project {} ({} skills)", projectId, config.getSkills().size());
        return CompletableFuture.supplyAsync(() -> runAnalysis(projectId, config), worker)
                .whenComplete((report, err) -> {
                    if (err != null) {
                        log.error("Analysis failed for project {}: {}", projectId, err.getMessage());
                    }
                });
    }

    /** The persisted report of the last analysis, if any. */
    public Optional<AnalysisReport> getReport(String projectId) {
        return store.readDocument(projectId, ProjectStore.ANALYSIS_REPORT, AnalysisReport.class);
    }

    AnalysisReport runAnalysis(String projectId, ProjectConfig config) {
        Summary summary = store.readSummary(projectId)
                .orElseThrow(() -> EvaluationStateException.notFound("Test summary of project " + projectId));
        Map<String, String> contents = new LinkedHashMap<>();
        for (SkillRef skill : config.getSkills()) {
            contents.put(skill.refId(), store.readSkillContent(projectId, skill));
        }
        String prompt = AnalysisPromptBuilder.build(config, summary, contents, store.listResults(projectId));

        var options = OracleOptions.of(store.collaboratorDir(projectId),
                Duration.ofSeconds(properties.getCollaboratorTimeoutSeconds()), properties.getDefaultModel());
        OracleResponse response = oracle.generate(prompt, options);
        AnalysisReport report = parser.parse(response.text(), AnalysisReport.class)
                .withProject(projectId, Instant.now());

        store.writeDocument(projectId, ProjectStore.ANALYSIS_REPORT, report);
        log.info("Analysis completed for project {}: best skill {}, {} advantage segments",
                projectId, report.bestSkillId(), report.advantageSegments().size());
        return report;
    }
}
