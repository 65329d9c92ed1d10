package com.skillbench.core.analysis;

/**
 * A verbatim fragment of a skill that the analysis credits with a strong dimension.
 *
 * @param type one of role, instruction, constraint, format, example
 */
public record AdvantageSegment(
    String id,
    String skillId,
    String skillName,
    String type,
    String content,
    String reason,
    String dimension
) {
}
