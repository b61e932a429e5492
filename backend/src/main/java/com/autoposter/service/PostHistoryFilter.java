package com.autoposter.service;

import com.autoposter.model.PostStatus;

import java.time.OffsetDateTime;

/**
 * Optional criteria for listing history. Null fields do not constrain.
 */
public record PostHistoryFilter(
        PostStatus status,
        Long topicId,
        OffsetDateTime createdFrom,
        OffsetDateTime createdTo
) {

    public PostHistoryFilter {
        if (createdFrom != null && createdTo != null && !createdFrom.isBefore(createdTo)) {
            throw new IllegalArgumentException("createdFrom must be before createdTo");
        }
    }

    public static PostHistoryFilter all() {
        return new PostHistoryFilter(null, null, null, null);
    }
}
