package com.skillbench.core.recompose;

/**
 * Generated skill text plus how much source material went into it.
 */
public record RecomposeResult(String content, int segmentCount, int sourceSkillCount) {
}
