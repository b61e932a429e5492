package com.autoposter.controller.dto;

import com.autoposter.model.PostStatus;
import com.autoposter.service.ScheduleSnapshot;

import java.time.OffsetDateTime;
import java.util.List;

public final class SchedulerResponses {

    private SchedulerResponses() {
    }

    public record Status(
            boolean enabled,
            long intervalMinutes,
            OffsetDateTime nextFireAt,
            PostStatus lastCycleStatus,
            OffsetDateTime lastCycleAt,
            List<Long> recentTopicIds,
            boolean cycleInFlight
    ) {

        public static Status from(ScheduleSnapshot snapshot) {
            return new Status(
                    snapshot.enabled(),
                    snapshot.interval().toMinutes(),
                    snapshot.nextFireAt(),
                    snapshot.lastCycleStatus(),
                    snapshot.lastCycleAt(),
                    snapshot.recentTopicIds(),
                    snapshot.cycleInFlight()
            );
        }
    }
}
