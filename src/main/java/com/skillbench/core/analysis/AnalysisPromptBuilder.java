package com.skillbench.core.analysis;

import com.skillbench.core.model.ProjectConfig;
import com.skillbench.core.model.ResultRecord;
import com.skillbench.core.model.ScoreDimension;
import com.skillbench.core.model.SkillRef;
import com.skillbench.core.model.SkillSummary;
import com.skillbench.core.model.Summary;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Renders the cross-skill comparison prompt from a project's config, summary,
 * skill texts and scored result records.
 */
final class AnalysisPromptBuilder {

    static final String TEMPLATE = """
            You are a prompt engineer specialising in code-generation prompts. Compare the test \
            results of the skills below side by side, identify each skill's advantage segments and \
            shortcomings, and produce a structured analysis report.

            [Baseline]
            Name: {baseline_name}
            Cases: {case_count}

            {iteration_context}[Skill prompts]
            {skills_content}

            [Score summary]
            {skills_score_summary}

            [Per-dimension scores]
            {dimension_scores_table}

            [Typical cases (the 3 cases with the widest score spread)]
            {top_diff_cases}

            [Tasks]
            1. Name the skill with the best overall performance (best_skill_id).
            2. Name the leading skill of every rubric dimension (dimension_leaders).
            3. Extract at least 3 concrete advantage segments from the skill prompts. For each give \
            the owning skill, the segment type, the verbatim text, the dimension it excels in and why.
               Segment types: instruction | constraint | format | role | example
            4. List concrete shortcomings of each skill per dimension (issues).

            [Rules]
            Reply with JSON only: no prose, no Markdown fences.

            [Reply format]
            {
              "best_skill_id": "<skill id>",
              "best_skill_name": "<skill name>",
              "dimension_leaders": {
                "functional_correctness": "<skill id>",
                "robustness": "<skill id>",
                "readability": "<skill id>",
                "conciseness": "<skill id>",
                "complexity_control": "<skill id>",
                "format_compliance": "<skill id>"
              },
              "advantage_segments": [
                {
                  "id": "seg_001",
                  "skill_id": "<skill id>",
                  "skill_name": "<skill name>",
                  "type": "role|instruction|constraint|format|example",
                  "content": "<verbatim fragment of the skill prompt>",
                  "reason": "<why this fragment stands out in its dimension>",
                  "dimension": "<dimension key>"
                }
              ],
              "issues": [
                {
                  "skill_id": "<skill id>",
                  "skill_name": "<skill name>",
                  "dimension": "<dimension key>",
                  "description": "<concrete shortcoming>"
                }
              ]
            }""";

    private AnalysisPromptBuilder() {}

    /**
     * @param skillContents skill id to prompt text, in config order
     */
    static String build(ProjectConfig config, Summary summary, Map<String, String> skillContents,
                        List<ResultRecord> records) {
        String baselineName = config.getBaselines().isEmpty() ? "unknown" : config.getBaselines().get(0).name();
        boolean tagged = !config.getOriginalSkillIds().isEmpty();

        return TEMPLATE
                .replace("{baseline_name}", String.valueOf(baselineName))
                .replace("{case_count}", String.valueOf(summary.totalCases()))
                .replace("{iteration_context}", iterationContext(config))
                .replace("{skills_content}", skillsContent(config, skillContents, tagged))
                .replace("{skills_score_summary}", scoreSummary(config, summary, tagged))
                .replace("{dimension_scores_table}", dimensionTable(summary))
                .replace("{top_diff_cases}", topDiffCases(config, records));
    }

    static String iterationContext(ProjectConfig config) {
        if (config.getOriginalSkillIds().isEmpty()) {
            return "";
        }
        List<String> originals = new ArrayList<>();
        List<String> candidates = new ArrayList<>();
        for (SkillRef skill : config.getSkills()) {
            (config.isOriginal(skill.refId()) ? originals : candidates).add(skill.name());
        }
        if (candidates.isEmpty()) {
            return "";
        }
        return "[Iteration context]\n"
                + "This analysis covers the original reference skills (" + String.join(", ", originals)
                + ") and the current iteration candidate (" + String.join(", ", candidates) + ").\n"
                + "When extracting advantage segments, prefer what the candidate improves over the originals;\n"
                + "where the candidate still trails an original in some dimension, say so in issues.\n\n";
    }

    private static String skillsContent(ProjectConfig config, Map<String, String> contents, boolean tagged) {
        return config.getSkills().stream()
                .map(s -> "Skill: " + s.name() + roleTag(config, s.refId(), tagged, "[original]", "[candidate]")
                        + " (ID: " + s.refId() + ")\n" + contents.getOrDefault(s.refId(), ""))
                .collect(Collectors.joining("\n\n---\n\n"));
    }

    private static String scoreSummary(ProjectConfig config, Summary summary, boolean tagged) {
        return summary.ranking().stream()
                .map(r -> "- " + r.skillName() + roleTag(config, r.skillId(), tagged, " (original)", " (candidate)")
                        + " (ID: " + r.skillId() + "): average " + r.avgScore()
                        + ", completed " + r.completedCases() + "/" + summary.totalCases()
                        + (r.failedCases() > 0 ? " (" + r.failedCases() + " failed)" : ""))
                .collect(Collectors.joining("\n"));
    }

    static String dimensionTable(Summary summary) {
        var sb = new StringBuilder("Dimension");
        for (SkillSummary r : summary.ranking()) {
            sb.append('\t').append(r.skillName());
        }
        for (ScoreDimension d : ScoreDimension.values()) {
            sb.append('\n').append(d.label()).append('(').append(d.max()).append(')');
            for (SkillSummary r : summary.ranking()) {
                double value = r.scoreBreakdown() == null ? 0 : r.scoreBreakdown().get(d);
                sb.append('\t').append(String.format(Locale.ROOT, "%.1f", value));
            }
        }
        return sb.toString();
    }

    /**
     * The three cases whose totals differ most across skills; only cases scored for
     * at least two skills qualify.
     */
    static String topDiffCases(ProjectConfig config, List<ResultRecord> records) {
        Map<String, Map<String, Integer>> byCase = new LinkedHashMap<>();
        for (ResultRecord r : records) {
            if (r.isScored()) {
                byCase.computeIfAbsent(r.caseId(), k -> new LinkedHashMap<>()).put(r.skillId(), r.scores().total());
            }
        }
        List<Map.Entry<String, Map<String, Integer>>> spread = byCase.entrySet().stream()
                .filter(e -> e.getValue().size() > 1)
                .sorted(Comparator.comparingInt((Map.Entry<String, Map<String, Integer>> e) -> spreadOf(e.getValue()))
                        .reversed())
                .limit(3)
                .toList();
        if (spread.isEmpty()) {
            return "Not enough data to compare";
        }
        return spread.stream().map(e -> {
            var lines = new StringBuilder("Case " + e.getKey() + ":");
            for (SkillRef skill : config.getSkills()) {
                Integer total = e.getValue().get(skill.refId());
                lines.append("\n  ").append(skill.name()).append(" (total ")
                        .append(total == null ? "N/A" : total).append(')');
            }
            return lines.toString();
        }).collect(Collectors.joining("\n\n"));
    }

    private static int spreadOf(Map<String, Integer> totals) {
        int max = totals.values().stream().mapToInt(Integer::intValue).max().orElse(0);
        int min = totals.values().stream().mapToInt(Integer::intValue).min().orElse(0);
        return max - min;
    }

    private static String roleTag(ProjectConfig config, String skillId, boolean tagged,
                                  String original, String candidate) {
        if (!tagged) {
            return "";
        }
        return config.isOriginal(skillId) ? original : candidate;
    }
}
