package org.lite.ai.enums;

import java.util.Locale;

public enum CacheTier {
    MEMORY,
    REDIS;

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
