package com.autoposter.model;

public enum FailureStage {
    MEDIA_UPLOAD,
    POST_SUBMISSION
}
