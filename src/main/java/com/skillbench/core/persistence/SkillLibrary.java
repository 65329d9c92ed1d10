package com.skillbench.core.persistence;

import com.skillbench.core.model.SkillRef;
import com.skillbench.core.state.ErrorCode;
import com.skillbench.core.state.EvaluationStateException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Workspace-wide skill library. New skills are imported here and then copied
 * into the projects that test them.
 */
@Service
public class SkillLibrary {

    private static final Logger log = LoggerFactory.getLogger(SkillLibrary.class);

    private final ProjectStore store;

    public SkillLibrary(ProjectStore store) {
        this.store = store;
    }

    /**
     * Imports text as a new version-1 skill.
     *
     * @throws EvaluationStateException INVALID_PARAMS when content, name, purpose or provider is missing
     */
    public LibrarySkill importSkill(String content, String name, String purpose, String provider,
                                    String description, String source) {
        if (content == null || content.isBlank()) {
            throw new EvaluationStateException(ErrorCode.INVALID_PARAMS, "content is required");
        }
        if (isBlank(name) || isBlank(purpose) || isBlank(provider)) {
            throw new EvaluationStateException(ErrorCode.INVALID_PARAMS, "name, purpose and provider are required");
        }
        var skill = new LibrarySkill(UUID.randomUUID().toString(), name, "v1", purpose, provider,
                description == null ? "" : description, source == null ? "" : source, Instant.now());
        Path dir = skillDir(skill.id());
        store.writeText(dir.resolve("content.txt"), content);
        store.write(dir.resolve("meta.json"), skill);
        log.info("Skill imported: {} ({})", skill.name(), skill.id());
        return skill;
    }

    public Optional<LibrarySkill> findSkill(String skillId) {
        return store.read(skillDir(skillId).resolve("meta.json"), LibrarySkill.class);
    }

    public String readContent(String skillId) {
        Path file = skillDir(skillId).resolve("content.txt");
        if (!Files.exists(file)) {
            throw EvaluationStateException.notFound("Skill " + skillId);
        }
        return store.readText(file);
    }

    public void writeProvenance(String skillId, Map<String, Object> provenance) {
        store.write(skillDir(skillId).resolve("provenance.json"), provenance);
    }

    /**
     * Copies a library skill into the project as the project's sole non-original
     * skill. Original skills stay in place; any previous iteration candidate is dropped.
     *
     * @param round round the candidate is registered for, used to name the project-local directory
     * @return the reference now present in the project config
     */
    public SkillRef registerIterationCandidate(String projectId, String skillId, int round) {
        LibrarySkill skill = findSkill(skillId)
                .orElseThrow(() -> EvaluationStateException.notFound("Iteration candidate skill " + skillId));
        String localPath = "skills/skill_iter_v" + round;
        store.writeSkillContent(projectId, localPath, readContent(skillId));

        var ref = new SkillRef(skill.id(), skill.name(), skill.version(), localPath,
                skill.purpose(), skill.provider());
        store.updateConfig(projectId, config -> {
            List<SkillRef> kept = new ArrayList<>();
            for (SkillRef existing : config.getSkills()) {
                if (config.isOriginal(existing.refId())) {
                    kept.add(existing);
                }
            }
            kept.add(ref);
            config.setSkills(kept);
            return config;
        });
        log.info("Registered iteration candidate {} for round {} in project {}", skillId, round, projectId);
        return ref;
    }

    private Path skillDir(String skillId) {
        return store.root().resolve("skills").resolve(ProjectStore.sanitize(skillId));
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
