package com.autoposter.model;

public enum CycleTrigger {
    TIMED,
    MANUAL
}
