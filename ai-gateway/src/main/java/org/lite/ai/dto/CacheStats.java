package org.lite.ai.dto;

import lombok.Data;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Data
public class CacheStats {
    private boolean enabled;
    private Map<String, TierStats> tiers = new LinkedHashMap<>();
    private List<KeyStats> keys = new ArrayList<>();

    @Data
    public static class TierStats {
        private String tier;
        private long hits;
        private long misses;
        private long sets;
        private long evictions;
        private long size; // -1 when the tier cannot report it
        private double hitRate;
    }

    @Data
    public static class KeyStats {
        private String tier;
        private String key;
        private long hits;
        private long misses;
        private Instant lastHitAt;
    }
}
