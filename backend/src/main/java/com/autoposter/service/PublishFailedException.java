package com.autoposter.service;

import com.autoposter.model.FailureReason;
import com.autoposter.model.FailureStage;
import lombok.Getter;

/**
 * Terminal publish failure after the retry policy gave up.
 */
@Getter
public class PublishFailedException extends RuntimeException {

    private final FailureReason reason;
    private final FailureStage stage;
    private final int attempts;

    public PublishFailedException(FailureReason reason, FailureStage stage, int attempts, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
        this.stage = stage;
        this.attempts = attempts;
    }
}
