package com.skillbench.core.persistence;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.skillbench.core.model.BaselineRef;
import com.skillbench.core.model.CaseSet;
import com.skillbench.core.model.ProjectConfig;
import com.skillbench.core.model.ResultRecord;
import com.skillbench.core.model.Round;
import com.skillbench.core.model.SkillRef;
import com.skillbench.core.model.Summary;
import com.skillbench.core.model.TestCase;
import com.skillbench.core.state.EvaluationStateException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.UnaryOperator;
import java.util.stream.Stream;

/**
 * File-backed store for everything a project owns: its config document, the
 * skill and baseline copies, result records, the summary, round snapshots and
 * iteration documents.
 * <p>
 * Every document is read and replaced whole. Writes go through a temp file and
 * a rename, so a reader never observes a half-written document. The store itself
 * has no concurrency semantics beyond that; config read-modify-write cycles are
 * serialized per project through {@link #updateConfig}.
 */
@Service
public class ProjectStore {

    private static final Logger log = LoggerFactory.getLogger(ProjectStore.class);

    public static final String CONFIG_FILE = "config.json";
    public static final String SUMMARY = "results/summary.json";
    public static final String ANALYSIS_REPORT = "analysis_report.json";
    public static final String ITERATION_REPORT = "iterations/iteration_report.json";
    public static final String EXPLORATION_LOG = "iterations/exploration_log.json";

    private final Path root;
    private final ObjectMapper mapper = StoreMapper.create();
    private final ConcurrentHashMap<String, Path> projectDirs = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    public ProjectStore(WorkspaceProperties properties) {
        this.root = Path.of(properties.getRoot());
        log.info("Project store rooted at {}", root);
    }

    public Path root() {
        return root;
    }

    public ObjectMapper mapper() {
        return mapper;
    }

    // ── Project config ──────────────────────────────────────────────

    /**
     * Locates a project directory by scanning {@code projects/*}/config.json for a matching id.
     *
     * @throws EvaluationStateException NOT_FOUND when no project has that id
     */
    public Path projectDir(String projectId) {
        Path cached = projectDirs.get(projectId);
        if (cached != null && Files.exists(cached.resolve(CONFIG_FILE))) {
            return cached;
        }
        Path found = scanForProject(projectId)
                .orElseThrow(() -> EvaluationStateException.notFound("Project " + projectId));
        projectDirs.put(projectId, found);
        return found;
    }

    public boolean exists(String projectId) {
        try {
            projectDir(projectId);
            return true;
        } catch (EvaluationStateException e) {
            return false;
        }
    }

    public ProjectConfig readConfig(String projectId) {
        return read(projectDir(projectId).resolve(CONFIG_FILE), ProjectConfig.class)
                .orElseThrow(() -> EvaluationStateException.notFound("Config of project " + projectId));
    }

    /**
     * Applies {@code change} to the current config and writes the result back,
     * holding the project's lock for the whole cycle. Stamps {@code updated_at}.
     */
    public ProjectConfig updateConfig(String projectId, UnaryOperator<ProjectConfig> change) {
        ReentrantLock lock = locks.computeIfAbsent(projectId, k -> new ReentrantLock());
        lock.lock();
        try {
            ProjectConfig updated = change.apply(readConfig(projectId));
            updated.setUpdatedAt(Instant.now());
            write(projectDir(projectId).resolve(CONFIG_FILE), updated);
            return updated;
        } finally {
            lock.unlock();
        }
    }

    /** Lists every project config found under {@code projects/}. */
    public List<ProjectConfig> listProjects() {
        Path projects = root.resolve("projects");
        if (!Files.isDirectory(projects)) {
            return List.of();
        }
        List<ProjectConfig> result = new ArrayList<>();
        try (Stream<Path> dirs = Files.list(projects)) {
            dirs.filter(Files::isDirectory)
                    .sorted()
                    .forEach(dir -> read(dir.resolve(CONFIG_FILE), ProjectConfig.class).ifPresent(result::add));
        } catch (IOException e) {
            throw new StoreException("Failed to list projects under " + projects, e);
        }
        return result;
    }

    // ── Skills, baselines, working paths ────────────────────────────

    public List<TestCase> readCases(String projectId, BaselineRef baseline) {
        Path file = projectDir(projectId).resolve(baseline.localPath()).resolve("cases.json");
        if (!Files.exists(file)) {
            log.warn("Baseline {} of project {} has no cases.json at {}", baseline.refId(), projectId, file);
            return List.of();
        }
        try {
            JsonNode node = mapper.readTree(file.toFile());
            if (node.isArray()) {
                return List.of(mapper.treeToValue(node, TestCase[].class));
            }
            return mapper.treeToValue(node, CaseSet.class).cases();
        } catch (IOException e) {
            throw new StoreException("Failed to read cases from " + file, e);
        }
    }

    public String readSkillContent(String projectId, SkillRef skill) {
        Path file = projectDir(projectId).resolve(skill.localPath()).resolve("content.txt");
        if (!Files.exists(file)) {
            log.warn("Skill {} of project {} has no content.txt at {}", skill.refId(), projectId, file);
            return "";
        }
        return readText(file);
    }

    public void writeSkillContent(String projectId, String localPath, String content) {
        writeText(projectDir(projectId).resolve(localPath).resolve("content.txt"), content);
    }

    /**
     * The isolated working path of a skill within a project, created on demand.
     */
    public Path workingDir(String projectId, String skillId) {
        String shortId = skillId.length() > 8 ? skillId.substring(0, 8) : skillId;
        Path dir = projectDir(projectId).resolve(".work").resolve("skill_" + sanitize(shortId));
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new StoreException("Failed to create working directory " + dir, e);
        }
        return dir;
    }

    /** Working path for analysis and recompose calls, created on demand. */
    public Path collaboratorDir(String projectId) {
        Path dir = projectDir(projectId).resolve(".work").resolve("collaborator");
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new StoreException("Failed to create working directory " + dir, e);
        }
        return dir;
    }

    // ── Result records ──────────────────────────────────────────────

    public Path resultPath(String projectId, String skillId, String caseId) {
        return projectDir(projectId).resolve("results")
                .resolve(sanitize(skillId))
                .resolve(sanitize(caseId) + ".json");
    }

    public boolean hasResult(String projectId, String skillId, String caseId) {
        return Files.exists(resultPath(projectId, skillId, caseId));
    }

    public Optional<ResultRecord> readResult(String projectId, String skillId, String caseId) {
        return read(resultPath(projectId, skillId, caseId), ResultRecord.class);
    }

    public void writeResult(String projectId, ResultRecord record) {
        write(resultPath(projectId, record.skillId(), record.caseId()), record);
    }

    /** All result records of a project, ordered by skill directory then case file name. */
    public List<ResultRecord> listResults(String projectId) {
        Path results = projectDir(projectId).resolve("results");
        if (!Files.isDirectory(results)) {
            return List.of();
        }
        List<ResultRecord> records = new ArrayList<>();
        try (Stream<Path> skillDirs = Files.list(results)) {
            for (Path skillDir : skillDirs.filter(Files::isDirectory).sorted().toList()) {
                try (Stream<Path> files = Files.list(skillDir)) {
                    files.filter(f -> f.getFileName().toString().endsWith(".json"))
                            .sorted()
                            .forEach(f -> read(f, ResultRecord.class).ifPresent(records::add));
                }
            }
        } catch (IOException e) {
            throw new StoreException("Failed to list results of project " + projectId, e);
        }
        return records;
    }

    public void writeSummary(String projectId, Summary summary) {
        writeDocument(projectId, SUMMARY, summary);
    }

    public Optional<Summary> readSummary(String projectId) {
        return readDocument(projectId, SUMMARY, Summary.class);
    }

    // ── Iteration documents ─────────────────────────────────────────

    public void writeRoundSnapshot(String projectId, Round round) {
        writeDocument(projectId, "iterations/round_" + round.round() + "/" + CONFIG_FILE, round);
    }

    /** Round snapshots on disk, ordered by round number. */
    public List<Round> listRoundSnapshots(String projectId) {
        Path iterations = projectDir(projectId).resolve("iterations");
        if (!Files.isDirectory(iterations)) {
            return List.of();
        }
        try (Stream<Path> dirs = Files.list(iterations)) {
            return dirs.filter(d -> d.getFileName().toString().startsWith("round_"))
                    .map(d -> read(d.resolve(CONFIG_FILE), Round.class))
                    .flatMap(Optional::stream)
                    .sorted(Comparator.comparingInt(Round::round))
                    .toList();
        } catch (IOException e) {
            throw new StoreException("Failed to list round snapshots of project " + projectId, e);
        }
    }

    /**
     * Removes the round snapshots and final documents of a previous iteration run.
     */
    public void clearIterationHistory(String projectId) {
        Path iterations = projectDir(projectId).resolve("iterations");
        if (!Files.isDirectory(iterations)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(iterations)) {
            for (Path p : walk.sorted(Comparator.reverseOrder()).toList()) {
                if (!p.equals(iterations)) {
                    Files.delete(p);
                }
            }
        } catch (IOException e) {
            throw new StoreException("Failed to clear iteration history of project " + projectId, e);
        }
        log.debug("Cleared iteration history of project {}", projectId);
    }

    // ── Generic documents ───────────────────────────────────────────

    public void writeDocument(String projectId, String relativePath, Object document) {
        write(projectDir(projectId).resolve(relativePath), document);
    }

    public <T> Optional<T> readDocument(String projectId, String relativePath, Class<T> type) {
        return read(projectDir(projectId).resolve(relativePath), type);
    }

    public boolean hasDocument(String projectId, String relativePath) {
        return Files.exists(projectDir(projectId).resolve(relativePath));
    }

    // ── Internals ───────────────────────────────────────────────────

    private Optional<Path> scanForProject(String projectId) {
        Path projects = root.resolve("projects");
        if (!Files.isDirectory(projects)) {
            return Optional.empty();
        }
        try (Stream<Path> dirs = Files.list(projects)) {
            return dirs.filter(Files::isDirectory)
                    .filter(dir -> read(dir.resolve(CONFIG_FILE), ProjectConfig.class)
                            .map(c -> projectId.equals(c.getId()))
                            .orElse(false))
                    .findFirst();
        } catch (IOException e) {
            throw new StoreException("Failed to scan projects under " + projects, e);
        }
    }

    <T> Optional<T> read(Path file, Class<T> type) {
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(mapper.readValue(file.toFile(), type));
        } catch (IOException e) {
            throw new StoreException("Failed to read " + file, e);
        }
    }

    void write(Path file, Object document) {
        try {
            writeBytes(file, mapper.writeValueAsBytes(document));
        } catch (IOException e) {
            throw new StoreException("Failed to write " + file, e);
        }
    }

    String readText(Path file) {
        try {
            return Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new StoreException("Failed to read " + file, e);
        }
    }

    void writeText(Path file, String content) {
        try {
            writeBytes(file, content.getBytes(StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new StoreException("Failed to write " + file, e);
        }
    }

    private static void writeBytes(Path file, byte[] bytes) throws IOException {
        Files.createDirectories(file.getParent());
        Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
        Files.write(tmp, bytes);
        try {
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    static String sanitize(String name) {
        return name.replaceAll("[^A-Za-z0-9._-]", "_");
    }
}
