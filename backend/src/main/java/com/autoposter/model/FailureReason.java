package com.autoposter.model;

/**
 * Terminal failure kinds recorded on a failed {@link PostRecord}.
 */
public enum FailureReason {
    NO_TOPICS_AVAILABLE,
    AUTH_ERROR,
    RATE_LIMIT_ERROR,
    NETWORK_ERROR,
    VALIDATION_ERROR,
    UNKNOWN_PROVIDER_ERROR;

    /**
     * Only transient provider conditions are worth another publish attempt.
     */
    public boolean isRetryable() {
        return this == RATE_LIMIT_ERROR || this == NETWORK_ERROR;
    }
}
