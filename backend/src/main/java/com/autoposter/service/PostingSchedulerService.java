package com.autoposter.service;

import com.autoposter.config.PipelineProperties;
import com.autoposter.model.ContentDraft;
import com.autoposter.model.CycleTrigger;
import com.autoposter.model.FailureReason;
import com.autoposter.model.ImageArtifact;
import com.autoposter.model.PostRecord;
import com.autoposter.model.PostStatus;
import com.autoposter.model.ScheduleState;
import com.autoposter.model.Topic;
import com.autoposter.repository.ScheduleStateRepository;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Owns the schedule state and runs produce-and-publish cycles, one at a time.
 *
 * <p>Cycles and ticks only ever {@code tryLock}: a timed tick that finds a cycle running does nothing
 * and a manual trigger is rejected with {@link CycleInProgressException}. Enable and interval updates
 * wait for the lock. Readers get the last published {@link ScheduleSnapshot} without locking.
 */
@Service
@RequiredArgsConstructor
public class PostingSchedulerService {

    private static final Logger log = LoggerFactory.getLogger(PostingSchedulerService.class);
    private static final int MAX_FAILURE_DETAIL_LENGTH = 512;

    private final TopicCatalog topicCatalog;
    private final ContentGenerator contentGenerator;
    private final ImageGenerator imageGenerator;
    private final ImageArchiveService imageArchiveService;
    private final PostPublisher postPublisher;
    private final PostHistoryService postHistoryService;
    private final ScheduleStateRepository scheduleStateRepository;
    private final PipelineProperties pipelineProperties;
    private final Clock clock;

    private final ReentrantLock cycleLock = new ReentrantLock();
    private final AtomicReference<ScheduleSnapshot> snapshot = new AtomicReference<>();

    // guarded by cycleLock
    private ScheduleState state;

    @EventListener(ApplicationReadyEvent.class)
    public void loadScheduleOnStartup() {
        cycleLock.lock();
        try {
            ensureState();
            log.info("Schedule loaded: enabled={}, interval={}, nextFireAt={}",
                    state.isEnabled(), Duration.ofSeconds(state.getIntervalSeconds()), state.getNextFireAt());
        } finally {
            cycleLock.unlock();
        }
    }

    public PostRecord runCycle(CycleTrigger trigger) {
        if (!cycleLock.tryLock()) {
            throw new CycleInProgressException();
        }
        try {
            ensureState();
            return executeCycle(trigger);
        } finally {
            cycleLock.unlock();
        }
    }

    /**
     * Runs a timed cycle when the schedule is enabled, due at {@code now}, and idle.
     *
     * @return the cycle's record, or empty when nothing ran
     */
    public Optional<PostRecord> tick(Instant now) {
        if (!cycleLock.tryLock()) {
            log.debug("Tick skipped: cycle in flight");
            return Optional.empty();
        }
        try {
            ensureState();
            if (!state.isEnabled() || now.isBefore(state.getNextFireAt().toInstant())) {
                return Optional.empty();
            }
            return Optional.of(executeCycle(CycleTrigger.TIMED));
        } finally {
            cycleLock.unlock();
        }
    }

    public ScheduleSnapshot setEnabled(boolean enabled) {
        cycleLock.lock();
        try {
            ensureState();
            state.setEnabled(enabled);
            ScheduleSnapshot updated = saveState(false);
            log.info("Automatic posting {}", enabled ? "enabled" : "disabled");
            return updated;
        } finally {
            cycleLock.unlock();
        }
    }

    /**
     * Changes the interval and schedules the next cycle one interval from now.
     */
    public ScheduleSnapshot setInterval(Duration interval) {
        PipelineProperties.Scheduler scheduler = pipelineProperties.getScheduler();
        if (interval == null
                || interval.compareTo(scheduler.getMinInterval()) < 0
                || interval.compareTo(scheduler.getMaxInterval()) > 0) {
            throw new IllegalArgumentException("Interval must be between " + scheduler.getMinInterval()
                    + " and " + scheduler.getMaxInterval());
        }
        cycleLock.lock();
        try {
            ensureState();
            state.setIntervalSeconds(interval.getSeconds());
            state.setNextFireAt(OffsetDateTime.ofInstant(clock.instant().plus(interval), ZoneOffset.UTC));
            ScheduleSnapshot updated = saveState(false);
            log.info("Posting interval set to {}; next cycle at {}", interval, updated.nextFireAt());
            return updated;
        } finally {
            cycleLock.unlock();
        }
    }

    public ScheduleSnapshot status() {
        ScheduleSnapshot current = snapshot.get();
        if (current != null) {
            return current;
        }
        cycleLock.lock();
        try {
            ensureState();
            return snapshot.get();
        } finally {
            cycleLock.unlock();
        }
    }

    private PostRecord executeCycle(CycleTrigger trigger) {
        Instant startedAt = clock.instant();
        snapshot.set(ScheduleSnapshot.of(state, true));
        try {
            Optional<Topic> selected = TopicSelector.select(topicCatalog.enabledTopics(), state.getRecentTopicIds());
            PostRecord record = selected
                    .map(topic -> produceAndPublish(topic, trigger, startedAt))
                    .orElseGet(() -> noTopicsRecord(trigger));

            // schedule advances even when the history append fails
            selected.ifPresent(topic -> state.setRecentTopicIds(new ArrayList<>(TopicSelector.remember(
                    state.getRecentTopicIds(), topic.getId(), pipelineProperties.getScheduler().getRotationMemory()))));
            state.setLastCycleStatus(record.getStatus());
            state.setLastCycleAt(record.getCreatedAt());
            state.setNextFireAt(OffsetDateTime.ofInstant(
                    startedAt.plusSeconds(state.getIntervalSeconds()), ZoneOffset.UTC));

            PostRecord saved;
            try {
                saved = postHistoryService.append(record);
            } catch (RuntimeException ex) {
                log.error("{} cycle for topic '{}' ended {} but its history record could not be stored",
                        trigger, record.getTopicName(), record.getStatus(), ex);
                try {
                    saveState(false);
                } catch (RuntimeException stateEx) {
                    ex.addSuppressed(stateEx);
                }
                throw ex;
            }
            saveState(false);

            log.info("{} cycle finished: record={}, topic={}, status={}, reason={}, nextFireAt={}",
                    trigger, saved.getId(), saved.getTopicName(), saved.getStatus(),
                    saved.getFailureReason(), state.getNextFireAt());
            return saved;
        } finally {
            if (state != null) {
                snapshot.set(ScheduleSnapshot.of(state, false));
            }
        }
    }

    private PostRecord produceAndPublish(Topic topic, CycleTrigger trigger, Instant startedAt) {
        CycleDeadline deadline = new CycleDeadline(startedAt.plus(pipelineProperties.getScheduler().getCycleTimeout()));
        ContentDraft draft = contentGenerator.generate(topic);
        ImageArtifact image = imageGenerator.generate(draft, pipelineProperties.getImage().getProfile());
        String imageRef = imageArchiveService.archive(draft, image);

        PostRecord.PostRecordBuilder record = PostRecord.builder()
                .topicId(topic.getId())
                .topicName(topic.getName())
                .category(topic.getCategory())
                .bodyText(draft.body())
                .hashtags(List.copyOf(draft.hashtags()))
                .imageRef(imageRef)
                .generationMethod(draft.method())
                .trigger(trigger);

        try {
            PublishResult result = postPublisher.publish(draft, image, deadline);
            record.status(PostStatus.SUCCEEDED)
                    .platformPostId(result.platformPostId())
                    .attemptCount(result.attempts());
        } catch (PublishFailedException ex) {
            record.status(PostStatus.FAILED)
                    .failureReason(ex.getReason())
                    .failureStage(ex.getStage())
                    .failureDetail(truncateMessage(ex.getMessage()))
                    .attemptCount(ex.getAttempts());
        } catch (RuntimeException ex) {
            log.error("Unexpected publisher failure for topic '{}'", topic.getName(), ex);
            record.status(PostStatus.FAILED)
                    .failureReason(FailureReason.UNKNOWN_PROVIDER_ERROR)
                    .failureDetail(truncateMessage(ex.toString()))
                    .attemptCount(1);
        }
        return record.createdAt(OffsetDateTime.now(clock)).build();
    }

    private PostRecord noTopicsRecord(CycleTrigger trigger) {
        log.warn("No enabled topics; recording failed cycle without generating content");
        return PostRecord.builder()
                .status(PostStatus.FAILED)
                .failureReason(FailureReason.NO_TOPICS_AVAILABLE)
                .failureDetail("No enabled topics in the catalog")
                .trigger(trigger)
                .attemptCount(0)
                .createdAt(OffsetDateTime.now(clock))
                .build();
    }

    private void ensureState() {
        if (state != null) {
            return;
        }
        state = scheduleStateRepository.findById(ScheduleState.SINGLETON_ID)
                .orElseGet(this::initialState);
        if (state.getRecentTopicIds() == null) {
            state.setRecentTopicIds(new ArrayList<>());
        }
        saveState(false);
    }

    private ScheduleState initialState() {
        PipelineProperties.Scheduler scheduler = pipelineProperties.getScheduler();
        ScheduleState initial = new ScheduleState();
        initial.setEnabled(scheduler.isEnabled());
        initial.setIntervalSeconds(scheduler.getInterval().getSeconds());
        initial.setNextFireAt(OffsetDateTime.ofInstant(clock.instant().plus(scheduler.getInterval()), ZoneOffset.UTC));
        log.info("No persisted schedule found; starting from configured defaults");
        return initial;
    }

    private ScheduleSnapshot saveState(boolean cycleInFlight) {
        state.setUpdatedAt(OffsetDateTime.now(clock));
        state = scheduleStateRepository.save(state);
        ScheduleSnapshot updated = ScheduleSnapshot.of(state, cycleInFlight);
        snapshot.set(updated);
        return updated;
    }

    private static String truncateMessage(String message) {
        if (message == null || message.length() <= MAX_FAILURE_DETAIL_LENGTH) {
            return message;
        }
        return message.substring(0, MAX_FAILURE_DETAIL_LENGTH);
    }
}
