package com.autoposter.service;

public record PublishResult(String platformPostId, String mediaRef, int attempts) {
}
