package com.autoposter.provider;

import com.autoposter.model.FailureReason;
import lombok.Getter;

import java.time.Duration;

@Getter
public class PlatformApiException extends RuntimeException {

    private final FailureReason reason;
    /**
     * Server supplied wait hint; only set for rate-limit responses that carry one.
     */
    private final Duration retryAfter;

    public PlatformApiException(FailureReason reason, String message) {
        this(reason, message, null, null);
    }

    public PlatformApiException(FailureReason reason, String message, Duration retryAfter, Throwable cause) {
        super(message, cause);
        this.reason = reason;
        this.retryAfter = retryAfter;
    }
}
