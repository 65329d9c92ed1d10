package com.skillbench.core.analysis;

public record AnalysisIssue(
    String skillId,
    String skillName,
    String dimension,
    String description
) {
}
