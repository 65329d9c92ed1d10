package com.skillbench.core.model;

/**
 * Reference from a project to a Baseline (a fixed set of test cases).
 *
 * @param refId     baseline id
 * @param name      display name
 * @param version   version label
 * @param localPath project-relative directory holding {@code cases.json}
 */
public record BaselineRef(
    String refId,
    String name,
    String version,
    String localPath
) {
}
