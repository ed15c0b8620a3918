package org.lite.ai.util;

import java.util.Collection;

/**
 * Rough token counts for cost accounting when a provider does not report usage (~4 characters per token).
 */
public final class TokenEstimator {

    private static final int CHARS_PER_TOKEN = 4;

    private TokenEstimator() {
    }

    public static long estimate(String text) {
        if (text == null || text.isEmpty()) {
            return 0;
        }
        return Math.max(1, (text.length() + CHARS_PER_TOKEN - 1) / CHARS_PER_TOKEN);
    }

    public static long estimate(Collection<String> texts) {
        long total = 0;
        for (String text : texts) {
            total += estimate(text);
        }
        return total;
    }
}
