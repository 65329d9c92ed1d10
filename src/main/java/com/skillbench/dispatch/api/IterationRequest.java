package com.skillbench.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.skillbench.core.model.IterationParams;

import java.util.List;

/**
 * Inbound JSON body for POST /api/v1/projects/{id}/iterations. Every field but
 * the skill id is optional.
 */
public record IterationRequest(
    @JsonProperty("recomposed_skill_id") String recomposedSkillId,
    @JsonProperty("max_rounds") Integer maxRounds,
    @JsonProperty("stop_threshold") Double stopThreshold,
    @JsonProperty("retention_rules") String retentionRules,
    @JsonProperty("selected_segment_ids") List<String> selectedSegmentIds,
    @JsonProperty("beam_width") Integer beamWidth,
    @JsonProperty("plateau_threshold") Double plateauThreshold,
    @JsonProperty("plateau_rounds_before_escape") Integer plateauRoundsBeforeEscape
) {

    public IterationParams toParams() {
        return new IterationParams(recomposedSkillId, maxRounds, stopThreshold, retentionRules,
                selectedSegmentIds, beamWidth, plateauThreshold, plateauRoundsBeforeEscape);
    }
}
