package com.skillbench.core.results;

import com.skillbench.core.model.ProjectConfig;
import com.skillbench.core.model.ResultRecord;
import com.skillbench.core.model.Score;
import com.skillbench.core.model.SkillRef;
import com.skillbench.core.persistence.ProjectStore;
import com.skillbench.core.persistence.StoreException;
import com.skillbench.core.state.ErrorCode;
import com.skillbench.core.state.EvaluationStateException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Read side of the result records: filtered paging and export to JSON or CSV.
 * Only skills currently configured in the project are listed.
 */
@Service
public class ResultQueryService {

    private static final Logger log = LoggerFactory.getLogger(ResultQueryService.class);

    static final List<String> CSV_HEADERS = List.of(
            "case_id", "skill_id", "skill_version", "status", "duration_ms", "model_version",
            "scores.total", "scores.functional_correctness", "scores.robustness", "scores.readability",
            "scores.conciseness", "scores.complexity_control", "scores.format_compliance", "error");

    private final ProjectStore store;

    public ResultQueryService(ProjectStore store) {
        this.store = store;
    }

    /**
     * @param page     1-based page number
     * @param pageSize records per page
     */
    public ResultPage getResults(String projectId, ResultFilter filter, int page, int pageSize) {
        if (page < 1 || pageSize < 1) {
            throw new EvaluationStateException(ErrorCode.INVALID_PARAMS, "page and page_size must be positive");
        }
        List<ResultRecord> matching = matching(projectId, filter);
        int from = Math.min((page - 1) * pageSize, matching.size());
        int to = Math.min(from + pageSize, matching.size());
        return new ResultPage(List.copyOf(matching.subList(from, to)), matching.size(), page, pageSize,
                store.readSummary(projectId).orElse(null));
    }

    /**
     * Writes every configured skill's result records to {@code destination}.
     *
     * @return the written path
     */
    public Path exportResults(String projectId, ExportFormat format, Path destination) {
        List<ResultRecord> records = matching(projectId, ResultFilter.ALL);
        try {
            if (destination.getParent() != null) {
                Files.createDirectories(destination.getParent());
            }
            if (format == ExportFormat.CSV) {
                Files.writeString(destination, toCsv(records), StandardCharsets.UTF_8);
            } else {
                store.mapper().writeValue(destination.toFile(), records);
            }
        } catch (IOException e) {
            throw new StoreException("Failed to export results to " + destination, e);
        }
        log.info("Exported {} result(s) of project {} as {} to {}", records.size(), projectId, format, destination);
        return destination;
    }

    private List<ResultRecord> matching(String projectId, ResultFilter filter) {
        ProjectConfig config = store.readConfig(projectId);
        Set<String> configured = config.getSkills().stream().map(SkillRef::refId).collect(Collectors.toSet());
        List<ResultRecord> result = new ArrayList<>();
        for (ResultRecord record : store.listResults(projectId)) {
            if (configured.contains(record.skillId()) && filter.matches(record)) {
                result.add(record);
            }
        }
        return result;
    }

    static String toCsv(List<ResultRecord> records) {
        var sb = new StringBuilder(String.join(",", CSV_HEADERS));
        for (ResultRecord r : records) {
            Score s = r.scores();
            List<Object> row = List.of(
                    r.caseId(), r.skillId(), nullToEmpty(r.skillVersion()), r.status().name().toLowerCase(),
                    r.durationMs(), nullToEmpty(r.modelVersion()),
                    s == null ? "" : s.total(),
                    s == null ? "" : s.functionalCorrectness(),
                    s == null ? "" : s.robustness(),
                    s == null ? "" : s.readability(),
                    s == null ? "" : s.conciseness(),
                    s == null ? "" : s.complexityControl(),
                    s == null ? "" : s.formatCompliance(),
                    nullToEmpty(r.error()));
            sb.append('\n').append(row.stream().map(ResultQueryService::quote).collect(Collectors.joining(",")));
        }
        return sb.toString();
    }

    private static String quote(Object value) {
        return "\"" + String.valueOf(value).replace("\"", "\"\"") + "\"";
    }

    private static Object nullToEmpty(Object value) {
        return value == null ? "" : value;
    }
}
