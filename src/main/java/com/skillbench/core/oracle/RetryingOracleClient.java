package com.skillbench.core.oracle;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Retries failed oracle calls. RATE_LIMITED failures wait for the configured
 * backoff first; other failures are retried immediately. The last failure is rethrown.
 */
public class RetryingOracleClient implements OracleClient {

    private static final Logger log = LoggerFactory.getLogger(RetryingOracleClient.class);

    private final OracleClient delegate;
    private final int retries;
    private final Duration rateLimitBackoff;

    public RetryingOracleClient(OracleClient delegate, int retries, Duration rateLimitBackoff) {
        this.delegate = delegate;
        this.retries = retries;
        this.rateLimitBackoff = rateLimitBackoff;
    }

    @Override
    public OracleResponse generate(String prompt, OracleOptions options) {
        OracleException last = null;
        for (int attempt = 0; attempt <= retries; attempt++) {
            try {
                return delegate.generate(prompt, options);
            } catch (OracleException e) {
                last = e;
                if (attempt == retries) {
                    break;
                }
                if (e.getCode() == OracleErrorCode.RATE_LIMITED) {
                    log.warn("Rate-limited, waiting {}s before retry {}/{}",
                            rateLimitBackoff.toSeconds(), attempt + 1, retries);
                    sleep(rateLimitBackoff);
                } else {
                    log.warn("Oracle call failed with {}, retry {}/{}", e.getCode(), attempt + 1, retries);
                }
            }
        }
        log.error("Oracle call failed after {} attempt(s): {}", retries + 1, last.getCode());
        throw last;
    }

    private static void sleep(Duration duration) {
        try {
            Thread.sleep(duration.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new OracleException(OracleErrorCode.EXECUTION_ERROR, "interrupted during rate-limit backoff", e);
        }
    }
}
