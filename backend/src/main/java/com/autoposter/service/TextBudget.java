package com.autoposter.service;

/**
 * Length limiting for post bodies.
 */
public final class TextBudget {

    private TextBudget() {
    }

    /**
     * Returns {@code text} unchanged when it fits, otherwise cuts at the last whitespace that leaves
     * room for {@code marker} and appends it. A single word longer than the budget is cut hard.
     * The result never exceeds {@code maxLength}.
     */
    public static String fit(String text, int maxLength, String marker) {
        if (maxLength <= 0) {
            throw new IllegalArgumentException("maxLength must be greater than zero");
        }
        String normalized = text == null ? "" : text.strip();
        if (normalized.length() <= maxLength) {
            return normalized;
        }
        String suffix = marker == null ? "" : marker;
        int limit = maxLength - suffix.length();
        if (limit <= 0) {
            return normalized.substring(0, maxLength);
        }

        int cut = -1;
        for (int i = limit; i > 0; i--) {
            if (Character.isWhitespace(normalized.charAt(i))) {
                cut = i;
                break;
            }
        }

        String head = cut > 0
                ? normalized.substring(0, cut).stripTrailing()
                : normalized.substring(0, limit);
        return head + suffix;
    }
}
