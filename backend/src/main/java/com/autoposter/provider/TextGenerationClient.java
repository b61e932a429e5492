package com.autoposter.provider;

/**
 * Provider abstraction for free-text completion used by the primary content strategy.
 */
public interface TextGenerationClient {

    /**
     * @return false when no credential is configured; callers skip straight to their fallback
     */
    boolean isConfigured();

    /**
     * @throws TextGenerationException on any provider failure
     */
    String complete(String prompt);
}
