package com.skillbench.core.model;

/**
 * Reference from a project to one Skill under evaluation.
 *
 * @param refId     skill id in the skill library
 * @param name      display name
 * @param version   version label of the referenced content (e.g. "v1")
 * @param localPath project-relative directory holding {@code content.txt}
 * @param purpose   free-form purpose tag
 * @param provider  who produced the skill ("user", "iteration", ...)
 */
public record SkillRef(
    String refId,
    String name,
    String version,
    String localPath,
    String purpose,
    String provider
) {
}
