package com.autoposter.service;

/**
 * States of a single publish run.
 */
public enum PublishAttemptState {
    ATTEMPTING,
    BACKOFF,
    SUCCEEDED,
    EXHAUSTED_FAILED
}
