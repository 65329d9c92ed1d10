package com.skillbench.core;

import com.skillbench.core.model.BaselineRef;
import com.skillbench.core.model.CaseSet;
import com.skillbench.core.model.ProjectConfig;
import com.skillbench.core.model.SkillRef;
import com.skillbench.core.model.TestCase;
import com.skillbench.core.persistence.ProjectStore;
import com.skillbench.core.persistence.WorkspaceProperties;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Builds throwaway projects on disk for store, scheduler and iteration tests.
 */
public final class TestWorkspace {

    private TestWorkspace() {
    }

    public static ProjectStore store(Path root) {
        var properties = new WorkspaceProperties();
        properties.setRoot(root.toString());
        return new ProjectStore(properties);
    }

    public static List<TestCase> cases(int count) {
        List<TestCase> cases = new ArrayList<>();
        for (int i = 1; i <= count; i++) {
            cases.add(new TestCase("case_" + String.format("%03d", i), "input " + i, "expected " + i));
        }
        return cases;
    }

    /**
     * Writes {@code projects/<id>/} with one baseline holding {@code cases} and one
     * skill directory per id, each with content "instructions for <id>".
     */
    public static ProjectConfig createProject(ProjectStore store, String projectId,
                                              List<String> skillIds, List<TestCase> cases) {
        Path dir = store.root().resolve("projects").resolve(projectId);
        var config = new ProjectConfig();
        config.setId(projectId);
        config.setName("Project " + projectId);
        List<SkillRef> skills = new ArrayList<>();
        for (String skillId : skillIds) {
            String localPath = "skills/" + skillId;
            skills.add(new SkillRef(skillId, "Skill " + skillId, "v1", localPath, "coding", "test"));
            writeText(dir.resolve(localPath).resolve("content.txt"), "instructions for " + skillId);
        }
        config.setSkills(skills);
        config.setBaselines(List.of(new BaselineRef("b1", "Baseline", "v1", "baselines/b1")));
        try {
            Files.createDirectories(dir.resolve("baselines/b1"));
            store.mapper().writeValue(dir.resolve("baselines/b1/cases.json").toFile(), new CaseSet(cases));
            store.mapper().writeValue(dir.resolve(ProjectStore.CONFIG_FILE).toFile(), config);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return config;
    }

    public static void writeText(Path file, String content) {
        try {
            Files.createDirectories(file.getParent());
            Files.writeString(file, content);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
