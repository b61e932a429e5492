package com.autoposter.model;

/**
 * Supported image formats for post attachments.
 */
public enum AspectProfile {
    WIDE(1200, 675),
    SQUARE(1080, 1080),
    PORTRAIT(1080, 1350);

    private final int width;
    private final int height;

    AspectProfile(int width, int height) {
        this.width = width;
        this.height = height;
    }

    public int width() {
        return width;
    }

    public int height() {
        return height;
    }
}
