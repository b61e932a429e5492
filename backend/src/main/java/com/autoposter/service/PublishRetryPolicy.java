package com.autoposter.service;

import com.autoposter.config.PipelineProperties;
import com.autoposter.model.FailureReason;

import java.time.Duration;

/**
 * Pure retry rules for publishing. Network and rate-limit failures back off exponentially
 * (base, 2x base, 4x base ... capped at the max delay) until the attempt budget is spent; a
 * rate-limit hint from the platform extends the wait. All other failures end the run at once.
 */
public final class PublishRetryPolicy {

    private final int maxAttempts;
    private final Duration baseDelay;
    private final Duration maxDelay;

    public PublishRetryPolicy(int maxAttempts, Duration baseDelay, Duration maxDelay) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        if (baseDelay == null || baseDelay.isNegative()) {
            throw new IllegalArgumentException("baseDelay must be zero or positive");
        }
        if (maxDelay == null || maxDelay.compareTo(baseDelay) < 0) {
            throw new IllegalArgumentException("maxDelay must not be shorter than baseDelay");
        }
        this.maxAttempts = maxAttempts;
        this.baseDelay = baseDelay;
        this.maxDelay = maxDelay;
    }

    public static PublishRetryPolicy from(PipelineProperties.Publish publish) {
        return new PublishRetryPolicy(publish.getMaxAttempts(), publish.getBaseDelay(), publish.getMaxDelay());
    }

    /**
     * @param failure reason of the attempt that just failed, or null if it succeeded
     * @param attemptsMade attempts completed so far, including the one that just ended
     * @param retryAfterHint platform wait hint, may be null
     */
    public RetryDecision next(FailureReason failure, int attemptsMade, Duration retryAfterHint) {
        if (failure == null) {
            return RetryDecision.succeeded();
        }
        if (!failure.isRetryable() || attemptsMade >= maxAttempts) {
            return RetryDecision.exhausted();
        }
        Duration delay = backoffDelay(attemptsMade);
        if (failure == FailureReason.RATE_LIMIT_ERROR && retryAfterHint != null && retryAfterHint.compareTo(delay) > 0) {
            delay = retryAfterHint;
        }
        return RetryDecision.backoff(delay);
    }

    Duration backoffDelay(int attemptsMade) {
        int exponent = Math.max(0, Math.min(attemptsMade - 1, 30));
        long multiplier = 1L << exponent;
        long millis = baseDelay.toMillis();
        if (millis > 0 && multiplier > maxDelay.toMillis() / millis) {
            return maxDelay;
        }
        Duration delay = Duration.ofMillis(millis * multiplier);
        return delay.compareTo(maxDelay) > 0 ? maxDelay : delay;
    }
}
