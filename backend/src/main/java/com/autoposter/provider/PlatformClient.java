package com.autoposter.provider;

import java.util.List;

/**
 * Publishing platform API. Implementations throw {@link PlatformApiException} with a
 * classified failure reason for every unsuccessful call.
 */
public interface PlatformClient {

    /**
     * @return opaque media reference to attach to a post
     */
    String uploadMedia(byte[] data, String mimeType);

    /**
     * @param mediaRef reference returned by {@link #uploadMedia}, or null for a text-only post
     * @return platform id of the created post
     */
    String createPost(String text, List<String> hashtags, String mediaRef);

    /**
     * Checks that the configured credential is accepted and resolves the account it belongs to.
     * Rejected credentials surface as {@link com.autoposter.model.FailureReason#AUTH_ERROR}.
     */
    PlatformAccount verifyCredentials();
}
