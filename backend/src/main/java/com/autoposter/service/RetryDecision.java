package com.autoposter.service;

import java.time.Duration;

/**
 * Outcome of {@link PublishRetryPolicy#next}: the state to move to and, for
 * {@link PublishAttemptState#BACKOFF}, how long to wait first.
 */
public record RetryDecision(PublishAttemptState state, Duration delay) {

    public static RetryDecision succeeded() {
        return new RetryDecision(PublishAttemptState.SUCCEEDED, Duration.ZERO);
    }

    public static RetryDecision exhausted() {
        return new RetryDecision(PublishAttemptState.EXHAUSTED_FAILED, Duration.ZERO);
    }

    public static RetryDecision backoff(Duration delay) {
        return new RetryDecision(PublishAttemptState.BACKOFF, delay);
    }

    public boolean shouldRetry() {
        return state == PublishAttemptState.BACKOFF;
    }
}
