package com.autoposter.model;

import java.util.List;
import java.util.Objects;

/**
 * Generated text and hashtags for one topic, prior to publishing. Never persisted on its own.
 */
public record ContentDraft(
        Long topicId,
        String topicName,
        TopicCategory category,
        String body,
        List<String> hashtags,
        GenerationMethod method
) {

    public ContentDraft {
        Objects.requireNonNull(topicName, "topicName is required");
        Objects.requireNonNull(category, "category is required");
        Objects.requireNonNull(body, "body is required");
        Objects.requireNonNull(method, "method is required");
        hashtags = hashtags == null ? List.of() : List.copyOf(hashtags);
    }

    /**
     * Text as submitted to the platform: body, a blank line, then the hashtags.
     */
    public String composedText() {
        return compose(body, hashtags);
    }

    public static String compose(String body, List<String> hashtags) {
        if (hashtags == null || hashtags.isEmpty()) {
            return body;
        }
        return body + "\n\n" + String.join(" ", hashtags);
    }
}
