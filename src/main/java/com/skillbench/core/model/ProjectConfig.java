package com.skillbench.core.model;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The per-project config document ({@code config.json}).
 * <p>
 * Holds skill/baseline references, run status and the progress checkpoint.
 * Fields this module does not know about are kept in {@link #extra()} so that
 * a whole-document rewrite never drops data owned by other collaborators.
 */
public class ProjectConfig {

    private String id;
    private String name;
    private RunStatus status = RunStatus.PENDING;
    private List<SkillRef> skills = new ArrayList<>();
    private List<BaselineRef> baselines = new ArrayList<>();
    private List<String> originalSkillIds = new ArrayList<>();
    private CliConfig cliConfig;
    private RunCheckpoint progress;
    private Instant updatedAt;
    private final Map<String, Object> extra = new LinkedHashMap<>();

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public RunStatus getStatus() {
        return status;
    }

    public void setStatus(RunStatus status) {
        this.status = status;
    }

    public List<SkillRef> getSkills() {
        return skills;
    }

    public void setSkills(List<SkillRef> skills) {
        this.skills = skills == null ? new ArrayList<>() : new ArrayList<>(skills);
    }

    public List<BaselineRef> getBaselines() {
        return baselines;
    }

    public void setBaselines(List<BaselineRef> baselines) {
        this.baselines = baselines == null ? new ArrayList<>() : new ArrayList<>(baselines);
    }

    public List<String> getOriginalSkillIds() {
        return originalSkillIds;
    }

    public void setOriginalSkillIds(List<String> originalSkillIds) {
        this.originalSkillIds = originalSkillIds == null ? new ArrayList<>() : new ArrayList<>(originalSkillIds);
    }

    public CliConfig getCliConfig() {
        return cliConfig;
    }

    public void setCliConfig(CliConfig cliConfig) {
        this.cliConfig = cliConfig;
    }

    public RunCheckpoint getProgress() {
        return progress;
    }

    public void setProgress(RunCheckpoint progress) {
        this.progress = progress;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(Instant updatedAt) {
        this.updatedAt = updatedAt;
    }

    @JsonAnyGetter
    public Map<String, Object> extra() {
        return extra;
    }

    @JsonAnySetter
    public void putExtra(String key, Object value) {
        extra.put(key, value);
    }

    public boolean isOriginal(String skillId) {
        return originalSkillIds.contains(skillId);
    }
}
