package com.autoposter.provider;

import com.autoposter.model.ContentDraft;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-process platform used for local runs. Accepts every upload and post and hands back
 * synthetic ids derived from the payload.
 */
@Component
@ConditionalOnProperty(prefix = "autoposter.platform", name = "mock", havingValue = "true", matchIfMissing = true)
public class MockPlatformClient implements PlatformClient {

    private static final Logger log = LoggerFactory.getLogger(MockPlatformClient.class);

    private final AtomicLong sequence = new AtomicLong();

    @Override
    public String uploadMedia(byte[] data, String mimeType) {
        String mediaRef = "mock-media-" + UUID.nameUUIDFromBytes(data);
        log.debug("Mock upload accepted {} bytes ({}) as {}", data.length, mimeType, mediaRef);
        return mediaRef;
    }

    @Override
    public String createPost(String text, List<String> hashtags, String mediaRef) {
        String composed = ContentDraft.compose(text, hashtags);
        String seed = sequence.incrementAndGet() + ":" + composed + ":" + mediaRef;
        String postId = "mock-post-" + UUID.nameUUIDFromBytes(seed.getBytes(StandardCharsets.UTF_8));
        log.info("Mock post created id={} length={} media={}", postId, composed.length(), mediaRef);
        return postId;
    }

    @Override
    public PlatformAccount verifyCredentials() {
        return new PlatformAccount("mock-account", "autoposter_mock");
    }
}
