package com.skillbench.core.model;

import java.nio.file.Path;

/**
 * A single Skill x Case execution unit. Immutable once created for a run.
 * <p>
 * Identity is the (skill id, case id) pair; the result record written to
 * {@code resultPath} doubles as the idempotency marker for resume.
 *
 * @param skill        the skill under test
 * @param skillContent instruction text sent as system context
 * @param workingDir   the skill's isolated working path
 * @param baseline     baseline the case belongs to
 * @param testCase     the case to execute
 * @param resultPath   where the result record for this task lives
 */
public record Task(
    SkillRef skill,
    String skillContent,
    Path workingDir,
    BaselineRef baseline,
    TestCase testCase,
    Path resultPath
) {

    public String skillId() {
        return skill.refId();
    }

    public String caseId() {
        return testCase.caseId();
    }

    /** Short identifier used in logs and retry task ids. */
    public String key() {
        return skillId() + "/" + caseId();
    }
}
