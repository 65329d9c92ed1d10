package com.skillbench.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Request body for POST /api/v1/projects/{id}/results/retry.
 */
public record RetryCaseRequest(
    @JsonProperty("skill_id") String skillId,
    @JsonProperty("case_id") String caseId
) {}
