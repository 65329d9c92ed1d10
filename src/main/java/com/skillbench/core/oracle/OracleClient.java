package com.skillbench.core.oracle;

/**
 * External text-generation / scoring service. Used identically for task
 * execution, rubric scoring, analysis and recomposition.
 * <p>
 * Calls block the caller until the oracle answers or the timeout expires.
 * Implementations must be safe to call from several execution streams at once.
 */
public interface OracleClient {

    /**
     * @throws OracleException with a typed code on any failure
     */
    OracleResponse generate(String prompt, OracleOptions options);
}
