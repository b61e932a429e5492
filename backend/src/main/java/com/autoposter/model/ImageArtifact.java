package com.autoposter.model;

import java.util.Objects;

/**
 * Rendered post image. {@code fallback} marks the degraded solid-background rendition.
 */
public record ImageArtifact(
        byte[] data,
        String mimeType,
        AspectProfile profile,
        int width,
        int height,
        boolean fallback
) {

    public ImageArtifact {
        Objects.requireNonNull(data, "data is required");
        Objects.requireNonNull(mimeType, "mimeType is required");
        Objects.requireNonNull(profile, "profile is required");
    }

    public int sizeBytes() {
        return data.length;
    }
}
