package com.autoposter.service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Absolute point in time by which a cycle must finish.
 */
public record CycleDeadline(Instant at) {

    public Duration remaining(Clock clock) {
        Duration remaining = Duration.between(clock.instant(), at);
        return remaining.isNegative() ? Duration.ZERO : remaining;
    }
}
