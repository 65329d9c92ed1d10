package com.skillbench.core.persistence;

import java.time.Instant;

/**
 * A skill stored in the workspace-wide skill library ({@code skills/<id>/meta.json}).
 * The content is loaded separately from {@code content.txt}.
 */
public record LibrarySkill(
    String id,
    String name,
    String version,
    String purpose,
    String provider,
    String description,
    String source,
    Instant createdAt
) {
}
