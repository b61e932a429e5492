package com.autoposter.controller.dto;

import com.autoposter.model.ContentDraft;
import com.autoposter.model.GenerationMethod;
import com.autoposter.model.Topic;
import com.autoposter.model.TopicCategory;

import java.util.List;

public final class TopicResponses {

    private TopicResponses() {
    }

    public record TopicView(
            Long id,
            String name,
            TopicCategory category,
            boolean enabled,
            int priority
    ) {

        public static TopicView from(Topic topic) {
            return new TopicView(topic.getId(), topic.getName(), topic.getCategory(), topic.isEnabled(), topic.getPriority());
        }
    }

    public record DraftPreview(
            Long topicId,
            String topicName,
            TopicCategory category,
            String body,
            List<String> hashtags,
            GenerationMethod method,
            String composedText
    ) {

        public static DraftPreview from(ContentDraft draft) {
            return new DraftPreview(
                    draft.topicId(),
                    draft.topicName(),
                    draft.category(),
                    draft.body(),
                    draft.hashtags(),
                    draft.method(),
                    draft.composedText()
            );
        }
    }
}
