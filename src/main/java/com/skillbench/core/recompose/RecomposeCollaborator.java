package com.skillbench.core.recompose;

import java.util.concurrent.CompletableFuture;

/**
 * Produces new skill text from a project's advantage segments and stores it as
 * a skill asset.
 */
public interface RecomposeCollaborator {

    /**
     * Generates a recomposed skill in the background. The future fails when no
     * analysis report exists or the oracle call fails.
     */
    CompletableFuture<RecomposeResult> recompose(String projectId, RecomposeRequest request);

    /**
     * Saves recomposed text as a new library skill with provenance.
     *
     * @param retentionRules the rules the recomposition was asked to keep, recorded in the provenance; may be null
     * @return id of the new skill
     */
    String saveRecomposedSkill(String projectId, String content, String name, String purpose, String provider,
                               String retentionRules);
}
