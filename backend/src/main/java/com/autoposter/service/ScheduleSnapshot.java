package com.autoposter.service;

import com.autoposter.model.PostStatus;
import com.autoposter.model.ScheduleState;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.List;

/**
 * Immutable view of the schedule handed to readers.
 */
public record ScheduleSnapshot(
        boolean enabled,
        Duration interval,
        OffsetDateTime nextFireAt,
        PostStatus lastCycleStatus,
        OffsetDateTime lastCycleAt,
        List<Long> recentTopicIds,
        boolean cycleInFlight,
        OffsetDateTime updatedAt
) {

    public ScheduleSnapshot {
        recentTopicIds = recentTopicIds == null ? List.of() : List.copyOf(recentTopicIds);
    }

    static ScheduleSnapshot of(ScheduleState state, boolean cycleInFlight) {
        return new ScheduleSnapshot(
                state.isEnabled(),
                Duration.ofSeconds(state.getIntervalSeconds()),
                state.getNextFireAt(),
                state.getLastCycleStatus(),
                state.getLastCycleAt(),
                state.getRecentTopicIds(),
                cycleInFlight,
                state.getUpdatedAt()
        );
    }
}
