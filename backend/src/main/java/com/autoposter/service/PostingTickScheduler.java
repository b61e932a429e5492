package com.autoposter.service;

import com.autoposter.model.PostRecord;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Optional;

@Service
@RequiredArgsConstructor
public class PostingTickScheduler {

    private static final Logger log = LoggerFactory.getLogger(PostingTickScheduler.class);

    private final PostingSchedulerService postingSchedulerService;
    private final Clock clock;

    @Scheduled(
            fixedDelayString = "${autoposter.scheduler.poll-interval-ms:5000}",
            initialDelayString = "${autoposter.scheduler.initial-delay-ms:10000}"
    )
    public void processScheduleTick() {
        try {
            Optional<PostRecord> record = postingSchedulerService.tick(clock.instant());
            if (record.isPresent()) {
                log.info("Timed cycle produced record id={} status={}", record.get().getId(), record.get().getStatus());
            } else {
                log.trace("Schedule tick completed with nothing due");
            }
        } catch (RuntimeException ex) {
            log.error("Schedule tick failed", ex);
        }
    }
}
