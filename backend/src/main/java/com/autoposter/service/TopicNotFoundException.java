package com.autoposter.service;

import lombok.Getter;

@Getter
public class TopicNotFoundException extends RuntimeException {

    private final Long topicId;

    public TopicNotFoundException(Long topicId) {
        super("Topic not found: " + topicId);
        this.topicId = topicId;
    }
}
