package com.autoposter.service;

import com.autoposter.config.PipelineProperties;
import com.autoposter.model.ContentDraft;
import com.autoposter.model.FailureReason;
import com.autoposter.model.FailureStage;
import com.autoposter.model.ImageArtifact;
import com.autoposter.provider.PlatformApiException;
import com.autoposter.provider.PlatformClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.FutureTask;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Uploads the image and creates the post, retrying per {@link PublishRetryPolicy}.
 *
 * <p>An attempt uploads the media (unless an earlier attempt already did) and then creates the post.
 * Every platform call is bounded by the request timeout and by what is left of the cycle deadline.
 */
@Service
public class PostPublisher {

    private static final Logger log = LoggerFactory.getLogger(PostPublisher.class);

    private final PlatformClient platformClient;
    private final PipelineProperties pipelineProperties;
    private final Sleeper sleeper;
    private final Clock clock;
    private final AtomicLong threadCounter = new AtomicLong();

    public PostPublisher(PlatformClient platformClient, PipelineProperties pipelineProperties, Sleeper sleeper, Clock clock) {
        this.platformClient = platformClient;
        this.pipelineProperties = pipelineProperties;
        this.sleeper = sleeper;
        this.clock = clock;
    }

    public PublishResult publish(ContentDraft draft, ImageArtifact image, CycleDeadline deadline) {
        PublishRetryPolicy policy = PublishRetryPolicy.from(pipelineProperties.getPublish());
        PublishAttemptState state = PublishAttemptState.ATTEMPTING;
        String mediaRef = null;
        int attempts = 0;

        while (state == PublishAttemptState.ATTEMPTING) {
            attempts++;
            FailureStage stage = mediaRef == null ? FailureStage.MEDIA_UPLOAD : FailureStage.POST_SUBMISSION;
            try {
                if (mediaRef == null) {
                    mediaRef = callWithinDeadline(deadline, () -> platformClient.uploadMedia(image.data(), image.mimeType()));
                    stage = FailureStage.POST_SUBMISSION;
                }
                String uploadedRef = mediaRef;
                String postId = callWithinDeadline(deadline,
                        () -> platformClient.createPost(draft.body(), draft.hashtags(), uploadedRef));
                log.info("Published topic '{}' as post {} after {} attempt(s)", draft.topicName(), postId, attempts);
                return new PublishResult(postId, mediaRef, attempts);
            } catch (PlatformApiException ex) {
                RetryDecision decision = policy.next(ex.getReason(), attempts, ex.getRetryAfter());
                if (!decision.shouldRetry()) {
                    log.warn("Publishing topic '{}' failed at {} after {} attempt(s): {} ({})",
                            draft.topicName(), stage, attempts, ex.getReason(), ex.getMessage());
                    throw new PublishFailedException(ex.getReason(), stage, attempts, ex.getMessage(), ex);
                }

                Duration delay = decision.delay();
                if (delay.compareTo(deadline.remaining(clock)) >= 0) {
                    log.warn("Publishing topic '{}' abandoned: {} backoff would pass the cycle deadline",
                            draft.topicName(), delay);
                    throw new PublishFailedException(FailureReason.NETWORK_ERROR, stage, attempts,
                            "Cycle deadline reached before retry (last failure: " + ex.getReason() + ")", ex);
                }

                log.info("Publish attempt {} for topic '{}' failed with {}; retrying in {} ms",
                        attempts, draft.topicName(), ex.getReason(), delay.toMillis());
                state = PublishAttemptState.BACKOFF;
                try {
                    sleeper.sleep(delay);
                } catch (InterruptedException interrupted) {
                    Thread.currentThread().interrupt();
                    throw new PublishFailedException(FailureReason.NETWORK_ERROR, stage, attempts,
                            "Interrupted during publish backoff", interrupted);
                }
                state = PublishAttemptState.ATTEMPTING;
            }
        }
        throw new IllegalStateException("Publish loop left in state " + state);
    }

    private <T> T callWithinDeadline(CycleDeadline deadline, Callable<T> call) {
        Duration remaining = deadline.remaining(clock);
        if (remaining.isZero()) {
            throw new PlatformApiException(FailureReason.NETWORK_ERROR, "Cycle deadline exhausted");
        }
        Duration requestTimeout = pipelineProperties.getPublish().getRequestTimeout();
        Duration timeout = requestTimeout.compareTo(remaining) < 0 ? requestTimeout : remaining;

        FutureTask<T> task = new FutureTask<>(call);
        Thread worker = new Thread(task, "platform-call-" + threadCounter.incrementAndGet());
        worker.setDaemon(true);
        worker.start();

        try {
            return task.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException ex) {
            task.cancel(true);
            throw new PlatformApiException(FailureReason.NETWORK_ERROR,
                    "Platform call timed out after " + timeout.toMillis() + " ms", null, ex);
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause() == null ? ex : ex.getCause();
            if (cause instanceof PlatformApiException platformApiException) {
                throw platformApiException;
            }
            throw new PlatformApiException(FailureReason.UNKNOWN_PROVIDER_ERROR,
                    "Unexpected platform client failure: " + cause, null, cause);
        } catch (InterruptedException ex) {
            task.cancel(true);
            Thread.currentThread().interrupt();
            throw new PlatformApiException(FailureReason.NETWORK_ERROR, "Interrupted while waiting for platform", null, ex);
        }
    }
}
