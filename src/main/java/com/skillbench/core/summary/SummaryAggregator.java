package com.skillbench.core.summary;

import com.skillbench.core.model.ResultRecord;
import com.skillbench.core.model.ScoreBreakdown;
import com.skillbench.core.model.ScoreDimension;
import com.skillbench.core.model.SkillRef;
import com.skillbench.core.model.SkillSummary;
import com.skillbench.core.model.Summary;
import com.skillbench.core.model.Task;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Folds the result records of a run into a ranked per-skill summary.
 * <p>
 * Pure: the same tasks and records always produce the same ranking. Averages
 * divide by the number of scored cases only and are rounded to one decimal.
 * Skills without a scored case average 0 and rank after every scored skill.
 */
@Component
public class SummaryAggregator {

    private static final Comparator<Tally> RANKING = Comparator
            .comparing((Tally t) -> t.scoredCases == 0)
            .thenComparing(Tally::avgScore, Comparator.reverseOrder())
            .thenComparing(t -> t.completedCases, Comparator.reverseOrder());

    public Summary aggregate(String projectId, List<Task> tasks, List<ResultRecord> records) {
        Map<String, ResultRecord> byKey = new HashMap<>();
        for (ResultRecord r : records) {
            byKey.put(r.skillId() + "/" + r.caseId(), r);
        }

        Map<String, Tally> tallies = new LinkedHashMap<>();
        for (Task task : tasks) {
            Tally tally = tallies.computeIfAbsent(task.skillId(), id -> new Tally(task.skill()));
            tally.taskCount++;
            ResultRecord record = byKey.get(task.key());
            if (record != null) {
                tally.add(record);
            }
        }

        List<Tally> sorted = new ArrayList<>(tallies.values());
        sorted.sort(RANKING);

        List<SkillSummary> ranking = new ArrayList<>();
        for (int i = 0; i < sorted.size(); i++) {
            ranking.add(sorted.get(i).toSummary(i + 1));
        }
        int totalCases = sorted.isEmpty() ? 0 : sorted.get(0).taskCount;
        return new Summary(projectId, Instant.now(), totalCases, ranking);
    }

    static double round1(double value) {
        return Math.round(value * 10) / 10.0;
    }

    private static final class Tally {
        private final SkillRef skill;
        private int taskCount;
        private int completedCases;
        private int failedCases;
        private int scoredCases;
        private long totalScore;
        private final Map<ScoreDimension, Long> dimensions = new EnumMap<>(ScoreDimension.class);

        Tally(SkillRef skill) {
            this.skill = skill;
        }

        void add(ResultRecord record) {
            if (!record.isCompleted()) {
                failedCases++;
                return;
            }
            completedCases++;
            if (record.isScored()) {
                scoredCases++;
                totalScore += record.scores().total();
                for (ScoreDimension d : ScoreDimension.values()) {
                    dimensions.merge(d, (long) record.scores().get(d), Long::sum);
                }
            }
        }

        double avgScore() {
            return scoredCases == 0 ? 0 : round1((double) totalScore / scoredCases);
        }

        SkillSummary toSummary(int rank) {
            int divisor = scoredCases == 0 ? 1 : scoredCases;
            var breakdown = new ScoreBreakdown(
                    dimensionAvg(ScoreDimension.FUNCTIONAL_CORRECTNESS, divisor),
                    dimensionAvg(ScoreDimension.ROBUSTNESS, divisor),
                    dimensionAvg(ScoreDimension.READABILITY, divisor),
                    dimensionAvg(ScoreDimension.CONCISENESS, divisor),
                    dimensionAvg(ScoreDimension.COMPLEXITY_CONTROL, divisor),
                    dimensionAvg(ScoreDimension.FORMAT_COMPLIANCE, divisor));
            return new SkillSummary(skill.refId(), skill.name(), skill.version(),
                    completedCases, failedCases, scoredCases, avgScore(), breakdown, rank);
        }

        private double dimensionAvg(ScoreDimension d, int divisor) {
            return round1((double) dimensions.getOrDefault(d, 0L) / divisor);
        }
    }
}
