package com.autoposter.config;

import com.autoposter.model.FailureReason;
import com.autoposter.model.PostRecord;
import com.autoposter.service.PostHistoryService;
import com.autoposter.service.PostingSchedulerService;
import com.autoposter.service.ScheduleSnapshot;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Reports schedule state and the latest cycle outcome. A credential failure on the latest
 * cycle reports DOWN since no later cycle can succeed without operator action.
 */
@Component
@RequiredArgsConstructor
public class PipelineHealthIndicator implements HealthIndicator {

    private final PostingSchedulerService postingSchedulerService;
    private final PostHistoryService postHistoryService;

    @Override
    public Health health() {
        try {
            ScheduleSnapshot schedule = postingSchedulerService.status();
            Optional<PostRecord> latest = postHistoryService.latest();

            boolean credentialsRejected = latest
                    .map(record -> record.getFailureReason() == FailureReason.AUTH_ERROR)
                    .orElse(false);
            Health.Builder builder = credentialsRejected ? Health.down() : Health.up();
            builder.withDetail("enabled", schedule.enabled())
                    .withDetail("interval", schedule.interval().toString())
                    .withDetail("nextFireAt", String.valueOf(schedule.nextFireAt()))
                    .withDetail("cycleInFlight", schedule.cycleInFlight())
                    .withDetail("lastCycleStatus", String.valueOf(schedule.lastCycleStatus()));
            latest.ifPresent(record -> builder
                    .withDetail("lastRecordId", record.getId())
                    .withDetail("lastFailureReason", String.valueOf(record.getFailureReason())));
            return builder.build();
        } catch (Exception e) {
            return Health.down()
                    .withException(e)
                    .build();
        }
    }
}
