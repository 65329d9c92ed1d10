package com.skillbench.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Request body for POST /api/v1/projects/{id}/results/export.
 *
 * @param format   json or csv
 * @param destPath file to write; the directory is created if needed
 */
public record ExportRequest(
    String format,
    @JsonProperty("dest_path") String destPath
) {}
