package com.autoposter.provider;

import lombok.Getter;

@Getter
public class TextGenerationException extends RuntimeException {

    public enum Kind {
        TIMEOUT,
        AUTH,
        QUOTA,
        MALFORMED_RESPONSE,
        UNAVAILABLE,
        NOT_CONFIGURED
    }

    private final Kind kind;

    public TextGenerationException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public TextGenerationException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }
}
