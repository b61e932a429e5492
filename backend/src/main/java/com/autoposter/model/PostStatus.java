package com.autoposter.model;

public enum PostStatus {
    SUCCEEDED,
    FAILED
}
