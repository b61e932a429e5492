package com.autoposter.provider;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MockPlatformClientTest {

    private final MockPlatformClient client = new MockPlatformClient();

    @Test
    void uploadReturnsStableSyntheticMediaId() {
        String first = client.uploadMedia(new byte[]{4, 5, 6}, "image/png");

        assertTrue(first.startsWith("mock-media-"));
        assertEquals(first, client.uploadMedia(new byte[]{4, 5, 6}, "image/png"));
    }

    @Test
    void eachPostGetsDistinctId() {
        String first = client.createPost("Same body", List.of("#Nostr"), "mock-media-1");
        String second = client.createPost("Same body", List.of("#Nostr"), "mock-media-1");

        assertTrue(first.startsWith("mock-post-"));
        assertNotEquals(first, second);
    }

    @Test
    void credentialsAlwaysVerify() {
        PlatformAccount account = client.verifyCredentials();

        assertEquals("mock-account", account.id());
        assertEquals("autoposter_mock", account.username());
    }
}
