package com.skillbench.core.oracle;

import com.skillbench.core.metrics.SkillbenchMetrics;
import com.skillbench.core.persistence.WorkspaceProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Selects the oracle implementation from {@code skillbench.oracle.provider} and
 * wraps it with retries and failure metrics.
 */
@Configuration
public class OracleConfig {

    private static final Logger log = LoggerFactory.getLogger(OracleConfig.class);

    @Bean
    public OracleClient oracleClient(OracleProperties properties,
                                     WorkspaceProperties workspace,
                                     ObjectProvider<ChatClient.Builder> chatClientBuilder,
                                     SkillbenchMetrics metrics) {
        OracleClient client;
        if (properties.isChatProvider()) {
            log.info("Oracle provider: Spring AI chat client");
            client = new ChatOracleClient(chatClientBuilder.getObject());
        } else {
            log.info("Oracle provider: CLI ({})", properties.getCliPath());
            client = new CliOracleClient(properties, Path.of(workspace.getRoot(), ".cli-session"));
        }
        if (properties.getRetryCount() > 0) {
            client = new RetryingOracleClient(client, properties.getRetryCount(),
                    Duration.ofSeconds(properties.getRateLimitBackoffSeconds()));
        }
        OracleClient delegate = client;
        return (prompt, options) -> {
            try {
                return delegate.generate(prompt, options);
            } catch (OracleException e) {
                metrics.recordOracleFailure(e.getCode().name());
                throw e;
            }
        };
    }
}
