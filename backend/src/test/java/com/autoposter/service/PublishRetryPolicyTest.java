package com.autoposter.service;

import com.autoposter.model.FailureReason;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class PublishRetryPolicyTest {

    private final PublishRetryPolicy policy =
            new PublishRetryPolicy(3, Duration.ofSeconds(5), Duration.ofSeconds(60));

    @Test
    void successEndsTheRun() {
        assertEquals(PublishAttemptState.SUCCEEDED, policy.next(null, 1, null).state());
    }

    @Test
    void networkFailuresBackOffExponentiallyUntilAttemptsAreSpent() {
        RetryDecision first = policy.next(FailureReason.NETWORK_ERROR, 1, null);
        RetryDecision second = policy.next(FailureReason.NETWORK_ERROR, 2, null);
        RetryDecision third = policy.next(FailureReason.NETWORK_ERROR, 3, null);

        assertEquals(RetryDecision.backoff(Duration.ofSeconds(5)), first);
        assertEquals(RetryDecision.backoff(Duration.ofSeconds(10)), second);
        assertEquals(PublishAttemptState.EXHAUSTED_FAILED, third.state());
    }

    @Test
    void backoffIsCappedAtMaxDelay() {
        PublishRetryPolicy generous = new PublishRetryPolicy(10, Duration.ofSeconds(5), Duration.ofSeconds(60));

        assertEquals(Duration.ofSeconds(40), generous.next(FailureReason.NETWORK_ERROR, 4, null).delay());
        assertEquals(Duration.ofSeconds(60), generous.next(FailureReason.NETWORK_ERROR, 5, null).delay());
        assertEquals(Duration.ofSeconds(60), generous.next(FailureReason.NETWORK_ERROR, 9, null).delay());
    }

    @Test
    void rateLimitWaitsForTheLongerOfBackoffAndHint() {
        assertEquals(Duration.ofSeconds(30), policy.next(FailureReason.RATE_LIMIT_ERROR, 1, Duration.ofSeconds(30)).delay());
        assertEquals(Duration.ofSeconds(5), policy.next(FailureReason.RATE_LIMIT_ERROR, 1, Duration.ofSeconds(2)).delay());
        assertEquals(Duration.ofSeconds(5), policy.next(FailureReason.RATE_LIMIT_ERROR, 1, null).delay());
    }

    @Test
    void hintIsIgnoredForNetworkFailures() {
        assertEquals(Duration.ofSeconds(5), policy.next(FailureReason.NETWORK_ERROR, 1, Duration.ofSeconds(30)).delay());
    }

    @Test
    void authValidationAndUnknownFailuresAreNeverRetried() {
        assertEquals(PublishAttemptState.EXHAUSTED_FAILED, policy.next(FailureReason.AUTH_ERROR, 1, null).state());
        assertEquals(PublishAttemptState.EXHAUSTED_FAILED, policy.next(FailureReason.VALIDATION_ERROR, 1, null).state());
        assertEquals(PublishAttemptState.EXHAUSTED_FAILED, policy.next(FailureReason.UNKNOWN_PROVIDER_ERROR, 1, null).state());
    }

    @Test
    void rejectsInvalidConfiguration() {
        assertThrows(IllegalArgumentException.class,
                () -> new PublishRetryPolicy(0, Duration.ofSeconds(5), Duration.ofSeconds(60)));
        assertThrows(IllegalArgumentException.class,
                () -> new PublishRetryPolicy(3, Duration.ofSeconds(5), Duration.ofSeconds(1)));
    }
}
