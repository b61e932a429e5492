package com.autoposter.model;

public enum GenerationMethod {
    PRIMARY,
    FALLBACK
}
