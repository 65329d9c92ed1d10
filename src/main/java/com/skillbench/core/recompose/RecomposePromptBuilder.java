package com.skillbench.core.recompose;

import com.skillbench.core.analysis.AdvantageSegment;
import com.skillbench.core.model.Round;
import com.skillbench.core.model.ScoreBreakdown;
import com.skillbench.core.model.ScoreDimension;
import com.skillbench.core.model.SkillSummary;
import com.skillbench.core.model.Strategy;
import com.skillbench.core.model.Summary;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Renders the recomposition prompt. When score history is supplied the prompt
 * ends with a trend tail: one line per round, the strategy directive and the
 * stagnant dimensions.
 */
final class RecomposePromptBuilder {

    static final String TEMPLATE = """
            You are a prompt engineer. Fuse the advantage segments of the skills below, honouring \
            the retention rules, into one better skill prompt.

            [Source skills]
            {source_skills_info}

            [Advantage segments to keep]
            {selected_segments}

            [Retention rules]
            {user_retention_rules}

            [How to recompose]
            1. Keep every listed segment; do not drop or rewrite its core meaning.
            2. Merge the strongest constraints the skills show for robustness, readability and the other dimensions.
            3. Unify the output-format instructions and remove contradictions and redundancy.
            4. Keep the instructions clear and concise; do not pile up requirements.
            5. The result must be a complete, directly usable prompt with no notes or commentary.

            {meta_prompt_tail}[Output]
            Reply with the full recomposed skill prompt only: no explanation, heading or JSON wrapper.""";

    private RecomposePromptBuilder() {
    }

    /** Segments matching {@code ids}, or all segments when {@code ids} is empty. */
    static List<AdvantageSegment> select(List<AdvantageSegment> segments, List<String> ids) {
        if (ids == null || ids.isEmpty()) {
            return segments;
        }
        Set<String> wanted = Set.copyOf(ids);
        return segments.stream().filter(s -> wanted.contains(s.id())).collect(Collectors.toList());
    }

    static String build(List<AdvantageSegment> selected, Summary summary, RecomposeRequest request) {
        String tail = metaTail(request.scoreHistory(), request.strategy(), request.focusDimension());
        return TEMPLATE
                .replace("{source_skills_info}", sourceSkillsInfo(selected, summary))
                .replace("{selected_segments}", segmentsText(selected))
                .replace("{user_retention_rules}",
                        request.retentionRules().isBlank() ? "No special requirements" : request.retentionRules())
                .replace("{meta_prompt_tail}", tail.isEmpty() ? "" : tail + "\n");
    }

    static String sourceSkillsInfo(List<AdvantageSegment> selected, Summary summary) {
        Set<String> seen = new LinkedHashSet<>();
        List<String> lines = new ArrayList<>();
        for (AdvantageSegment segment : selected) {
            if (seen.add(segment.skillId())) {
                double avg = summary == null ? 0
                        : summary.find(segment.skillId()).map(SkillSummary::avgScore).orElse(0.0);
                lines.add("- " + segment.skillName() + " (overall score " + fmt(avg) + ")");
            }
        }
        return lines.isEmpty() ? "No source information" : String.join("\n", lines);
    }

    static String segmentsText(List<AdvantageSegment> selected) {
        if (selected.isEmpty()) {
            return "No segments selected";
        }
        List<String> blocks = new ArrayList<>();
        for (int i = 0; i < selected.size(); i++) {
            AdvantageSegment s = selected.get(i);
            blocks.add("Segment " + (i + 1) + " (from " + s.skillName() + ", type " + s.type() + "):\n" + s.content());
        }
        return String.join("\n\n", blocks);
    }

    /**
     * Score-trend tail. Empty when there is no history.
     */
    static String metaTail(List<Round> history, Strategy strategy, ScoreDimension focus) {
        if (history == null || history.isEmpty()) {
            return "";
        }
        List<String> lines = new ArrayList<>();
        lines.add("[Score trend]");
        for (Round r : history) {
            lines.add(historyLine(r));
        }
        lines.add("");

        List<String> directives = new ArrayList<>();
        if (strategy == Strategy.DIMENSION_FOCUS && focus != null) {
            directives.add("Strategy this round: DIMENSION_FOCUS, improve the \"" + focus.label() + "\" dimension.");
            directives.add("Sharpen the instructions and constraints behind that dimension without giving up the others.");
        } else if (strategy == Strategy.SEGMENT_EXPLORE) {
            directives.add("Strategy this round: SEGMENT_EXPLORE, bring in advantage segments not used so far.");
            directives.add("Blend the new segments into the existing text instead of appending them.");
        } else if (strategy == Strategy.CROSS_POLLINATE) {
            directives.add("Strategy this round: CROSS_POLLINATE, draw the best structure from several sources across skill boundaries.");
            directives.add("Revisit the source segments without holding on to last round's prompt structure.");
        }

        List<ScoreDimension> stagnant = stagnantDimensions(history);
        if (!stagnant.isEmpty()) {
            directives.add("Stagnant dimensions (no improvement over the last 2 rounds): "
                    + stagnant.stream().map(ScoreDimension::label).collect(Collectors.joining(", ")));
            directives.add("Target these dimensions first this round.");
        }
        lines.addAll(directives);
        lines.add("");
        return String.join("\n", lines);
    }

    /** Dimensions whose score did not rise between the last two rounds. */
    static List<ScoreDimension> stagnantDimensions(List<Round> history) {
        if (history.size() < 2) {
            return List.of();
        }
        ScoreBreakdown before = history.get(history.size() - 2).scoreBreakdown();
        ScoreBreakdown after = history.get(history.size() - 1).scoreBreakdown();
        if (before == null || after == null) {
            return List.of();
        }
        List<ScoreDimension> stagnant = new ArrayList<>();
        for (ScoreDimension d : ScoreDimension.values()) {
            if (after.get(d) <= before.get(d)) {
                stagnant.add(d);
            }
        }
        return stagnant;
    }

    private static String historyLine(Round r) {
        StringBuilder sb = new StringBuilder("Round ").append(r.round());
        if (r.strategy() != null) {
            sb.append(" (").append(r.strategy()).append(')');
        }
        sb.append(": total ").append(fmt(r.avgScore() == null ? 0 : r.avgScore()));
        if (r.scoreDelta() != null) {
            sb.append(" (").append(r.scoreDelta() >= 0 ? "+" : "").append(fmt(r.scoreDelta())).append(')');
        }
        if (r.scoreBreakdown() != null) {
            ScoreBreakdown b = r.scoreBreakdown();
            List<String> dims = new ArrayList<>();
            for (ScoreDimension d : ScoreDimension.values()) {
                dims.add(d.label() + " " + b.get(d));
            }
            sb.append("  ").append(String.join(" | ", dims));
        }
        return sb.toString();
    }

    private static String fmt(double value) {
        return String.format(Locale.ROOT, "%.1f", value);
    }
}
