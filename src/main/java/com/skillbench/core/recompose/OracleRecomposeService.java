package com.skillbench.core.recompose;

import com.skillbench.core.analysis.AdvantageSegment;
import com.skillbench.core.analysis.AnalysisReport;
import com.skillbench.core.model.ProjectConfig;
import com.skillbench.core.model.SkillRef;
import com.skillbench.core.model.Summary;
import com.skillbench.core.oracle.OracleClient;
import com.skillbench.core.oracle.OracleOptions;
import com.skillbench.core.oracle.OracleProperties;
import com.skillbench.core.oracle.OracleResponse;
import com.skillbench.core.persistence.LibrarySkill;
import com.skillbench.core.persistence.ProjectStore;
import com.skillbench.core.persistence.SkillLibrary;
import com.skillbench.core.state.EvaluationStateException;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Default recomposition: fuses the selected advantage segments of the last
 * analysis into new skill text with one oracle call.
 */
@Service
public class OracleRecomposeService implements RecomposeCollaborator {

    private static final Logger log = LoggerFactory.getLogger(OracleRecomposeService.class);

    private final ProjectStore store;
    private final SkillLibrary library;
    private final OracleClient oracle;
    private final OracleProperties properties;
    private final ExecutorService worker = Executors.newSingleThreadExecutor(r -> {
        Thread t = new Thread(r, "recompose-worker");
        t.setDaemon(true);
        return t;
    });

    public OracleRecomposeService(ProjectStore store, SkillLibrary library,
                                  OracleClient oracle, OracleProperties properties) {
        this.store = store;
        this.library = library;
        this.oracle = oracle;
        this.properties = properties;
    }

    @PreDestroy
    void shutdown() {
        worker.shutdownNow();
    }

    @Override
    public CompletableFuture<RecomposeResult> recompose(String projectId, RecomposeRequest request) {
        store.projectDir(projectId);
        return CompletableFuture.supplyAsync(() -> runRecompose(projectId, request), worker)
                .whenComplete((result, err) -> {
                    if (err != null) {
                        log.error("Recomposition failed for project {} (strategy {}): {}",
                                projectId, request.strategy(), err.getMessage());
                    }
                });
    }

    RecomposeResult runRecompose(String projectId, RecomposeRequest request) {
        AnalysisReport report = readReport(projectId);
        Summary summary = store.readSummary(projectId).orElse(null);
        List<AdvantageSegment> selected =
                RecomposePromptBuilder.select(report.advantageSegments(), request.selectedSegmentIds());
        String prompt = RecomposePromptBuilder.build(selected, summary, request);

        var options = OracleOptions.of(store.collaboratorDir(projectId),
                Duration.ofSeconds(properties.getCollaboratorTimeoutSeconds()), properties.getDefaultModel());
        OracleResponse response = oracle.generate(prompt, options);

        int sourceSkills = (int) selected.stream().map(AdvantageSegment::skillId).distinct().count();
        log.info("Recomposition completed for project {} (strategy {}, {} segments from {} skills)",
                projectId, request.strategy(), selected.size(), sourceSkills);
        return new RecomposeResult(response.text() == null ? "" : response.text(), selected.size(), sourceSkills);
    }

    @Override
    public String saveRecomposedSkill(String projectId, String content, String name, String purpose, String provider,
                                      String retentionRules) {
        ProjectConfig config = store.readConfig(projectId);
        LibrarySkill skill = library.importSkill(content, name, purpose, provider, "", "recomposed");

        List<AdvantageSegment> segments = store
                .readDocument(projectId, ProjectStore.ANALYSIS_REPORT, AnalysisReport.class)
                .map(AnalysisReport::advantageSegments)
                .orElse(List.of());
        library.writeProvenance(skill.id(), provenance(config, segments, retentionRules));

        log.info("Recomposed skill {} saved from project {}", skill.id(), projectId);
        return skill.id();
    }

    static Map<String, Object> provenance(ProjectConfig config, List<AdvantageSegment> segments,
                                          String retentionRules) {
        Map<String, Map<String, Object>> sources = new LinkedHashMap<>();
        Map<String, LinkedHashSet<String>> contributed = new LinkedHashMap<>();
        for (AdvantageSegment segment : segments) {
            sources.computeIfAbsent(segment.skillId(), id -> {
                Map<String, Object> source = new LinkedHashMap<>();
                source.put("skill_id", id);
                source.put("skill_name", segment.skillName());
                source.put("skill_version", config.getSkills().stream()
                        .filter(s -> s.refId().equals(id))
                        .map(SkillRef::version)
                        .findFirst()
                        .orElse("v1"));
                return source;
            });
            contributed.computeIfAbsent(segment.skillId(), id -> new LinkedHashSet<>()).add(segment.id());
        }
        sources.forEach((id, source) -> source.put("contributed_segments", new ArrayList<>(contributed.get(id))));

        Map<String, Object> provenance = new LinkedHashMap<>();
        provenance.put("type", "recomposed");
        provenance.put("source_project_id", config.getId());
        provenance.put("source_project_name", config.getName());
        provenance.put("user_retention_rules", retentionRules == null ? "" : retentionRules);
        provenance.put("source_skills", new ArrayList<>(sources.values()));
        provenance.put("created_at", Instant.now().toString());
        return provenance;
    }

    private AnalysisReport readReport(String projectId) {
        return store.readDocument(projectId, ProjectStore.ANALYSIS_REPORT, AnalysisReport.class)
                .orElseThrow(() -> EvaluationStateException.notFound("Analysis report of project " + projectId));
    }
}
