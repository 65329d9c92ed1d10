package com.skillbench.core.analysis;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Derived comparison of the skills of a project ({@code analysis_report.json}).
 *
 * @param dimensionLeaders dimension key to the id of the leading skill
 */
public record AnalysisReport(
    String projectId,
    Instant generatedAt,
    String bestSkillId,
    String bestSkillName,
    Map<String, String> dimensionLeaders,
    List<AdvantageSegment> advantageSegments,
    List<AnalysisIssue> issues
) {

    public AnalysisReport {
        bestSkillId = bestSkillId == null ? "" : bestSkillId;
        bestSkillName = bestSkillName == null ? "" : bestSkillName;
        dimensionLeaders = dimensionLeaders == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(dimensionLeaders));
        advantageSegments = advantageSegments == null ? List.of() : List.copyOf(advantageSegments);
        issues = issues == null ? List.of() : List.copyOf(issues);
    }

    public AnalysisReport withProject(String projectId, Instant generatedAt) {
        return new AnalysisReport(projectId, generatedAt, bestSkillId, bestSkillName,
                dimensionLeaders, advantageSegments, issues);
    }
}
