package com.skillbench.core.oracle;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "skillbench.oracle")
public class OracleProperties {

    /** "cli" spawns the CLI per call, "chat" goes through the Spring AI ChatClient. */
    private String provider = "cli";
    private String cliPath = "claude";
    private String defaultModel = "claude-opus-4-6";
    private int defaultTimeoutSeconds = 60;
    private int scoringTimeoutSeconds = 30;
    private int collaboratorTimeoutSeconds = 60;
    private int retryCount = 0;
    private int rateLimitBackoffSeconds = 30;

    private static final long COLLABORATOR_GRACE_SECONDS = 5;

    public String getProvider() {
        return provider;
    }

    public void setProvider(String provider) {
        this.provider = provider;
    }

    public String getCliPath() {
        return cliPath;
    }

    public void setCliPath(String cliPath) {
        this.cliPath = cliPath;
    }

    public String getDefaultModel() {
        return defaultModel;
    }

    public void setDefaultModel(String defaultModel) {
        this.defaultModel = defaultModel;
    }

    public int getDefaultTimeoutSeconds() {
        return defaultTimeoutSeconds;
    }

    public void setDefaultTimeoutSeconds(int defaultTimeoutSeconds) {
        this.defaultTimeoutSeconds = defaultTimeoutSeconds;
    }

    public int getScoringTimeoutSeconds() {
        return scoringTimeoutSeconds;
    }

    public void setScoringTimeoutSeconds(int scoringTimeoutSeconds) {
        this.scoringTimeoutSeconds = scoringTimeoutSeconds;
    }

    public int getCollaboratorTimeoutSeconds() {
        return collaboratorTimeoutSeconds;
    }

    public void setCollaboratorTimeoutSeconds(int collaboratorTimeoutSeconds) {
        this.collaboratorTimeoutSeconds = collaboratorTimeoutSeconds;
    }

    public int getRetryCount() {
        return retryCount;
    }

    public void setRetryCount(int retryCount) {
        this.retryCount = retryCount;
    }

    public int getRateLimitBackoffSeconds() {
        return rateLimitBackoffSeconds;
    }

    public void setRateLimitBackoffSeconds(int rateLimitBackoffSeconds) {
        this.rateLimitBackoffSeconds = rateLimitBackoffSeconds;
    }

    /**
     * Longest a round waits for one analysis or recompose step: every attempt at the
     * collaborator timeout plus the rate-limit backoffs between them, plus a short grace.
     */
    public Duration collaboratorBudget() {
        long attempts = retryCount + 1L;
        return Duration.ofSeconds(collaboratorTimeoutSeconds * attempts
                + (long) rateLimitBackoffSeconds * retryCount + COLLABORATOR_GRACE_SECONDS);
    }

    public boolean isChatProvider() {
        return "chat".equalsIgnoreCase(provider);
    }
}
