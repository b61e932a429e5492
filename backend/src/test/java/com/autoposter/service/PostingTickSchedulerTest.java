package com.autoposter.service;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PostingTickSchedulerTest {

    private static final Instant NOW = Instant.parse("2026-07-04T12:00:00Z");

    @Mock
    private PostingSchedulerService postingSchedulerService;

    @Test
    void tickUsesCurrentClockInstant() {
        when(postingSchedulerService.tick(NOW)).thenReturn(Optional.empty());

        new PostingTickScheduler(postingSchedulerService, new MutableClock(NOW)).processScheduleTick();

        verify(postingSchedulerService).tick(NOW);
    }

    @Test
    void tickFailureIsLoggedNotPropagated() {
        when(postingSchedulerService.tick(NOW)).thenThrow(new IllegalStateException("database unavailable"));

        PostingTickScheduler scheduler = new PostingTickScheduler(postingSchedulerService, new MutableClock(NOW));

        assertDoesNotThrow(scheduler::processScheduleTick);
    }
}
