package com.autoposter.controller.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;

public final class TopicRequests {

    private TopicRequests() {
    }

    public record UpdateTopicRequest(
            Boolean enabled,
            @Min(-100)
            @Max(100)
            Integer priority
    ) {
    }
}
