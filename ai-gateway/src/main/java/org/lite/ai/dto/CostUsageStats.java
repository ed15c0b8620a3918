package org.lite.ai.dto;

import lombok.Data;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

@Data
public class CostUsageStats {
    private Period period;
    private TotalUsage totalUsage = new TotalUsage();
    private Map<String, ModelUsage> modelBreakdown = new HashMap<>();
    private Map<String, ProviderUsage> providerBreakdown = new HashMap<>();
    private List<DailyUsage> dailyBreakdown = new ArrayList<>();

    @Data
    public static class Period {
        private String from;
        private String to;
    }

    @Data
    public static class TotalUsage {
        private long totalAttempts;
        private long failedAttempts;
        private long totalPromptTokens;
        private long totalCompletionTokens;
        private long totalTokens;
        private double totalCostUsd;
    }

    @Data
    public static class ModelUsage {
        private String modelName;
        private String provider;
        private long attempts;
        private long promptTokens;
        private long completionTokens;
        private double costUsd;
        private double averageLatencyMs;
    }

    @Data
    public static class ProviderUsage {
        private String provider;
        private long attempts;
        private long successes;
        private long failures;
        private long timeouts;
        private long totalTokens;
        private double costUsd;
    }

    @Data
    public static class DailyUsage {
        private String date; // yyyy-MM-dd
        private long attempts;
        private long totalTokens;
        private double costUsd;
    }
}
