package com.autoposter.controller.dto;

import com.autoposter.model.CycleTrigger;
import com.autoposter.model.FailureReason;
import com.autoposter.model.FailureStage;
import com.autoposter.model.GenerationMethod;
import com.autoposter.model.PostRecord;
import com.autoposter.model.PostStatus;
import com.autoposter.model.TopicCategory;

import java.time.OffsetDateTime;
import java.util.List;

public final class HistoryResponses {

    private HistoryResponses() {
    }

    public record PostRecordView(
            Long id,
            Long topicId,
            String topicName,
            TopicCategory category,
            String bodyText,
            List<String> hashtags,
            String imageRef,
            String platformPostId,
            PostStatus status,
            FailureReason failureReason,
            FailureStage failureStage,
            String failureDetail,
            GenerationMethod generationMethod,
            CycleTrigger trigger,
            int attemptCount,
            OffsetDateTime createdAt
    ) {

        public static PostRecordView from(PostRecord record) {
            return new PostRecordView(
                    record.getId(),
                    record.getTopicId(),
                    record.getTopicName(),
                    record.getCategory(),
                    record.getBodyText(),
                    record.getHashtags(),
                    record.getImageRef(),
                    record.getPlatformPostId(),
                    record.getStatus(),
                    record.getFailureReason(),
                    record.getFailureStage(),
                    record.getFailureDetail(),
                    record.getGenerationMethod(),
                    record.getTrigger(),
                    record.getAttemptCount(),
                    record.getCreatedAt()
            );
        }
    }

    public record ClearResult(
            long deleted
    ) {
    }
}
