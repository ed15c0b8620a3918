package org.lite.ai.config;

import lombok.Data;
import org.lite.ai.enums.ProviderCapability;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

@Configuration
@ConfigurationProperties(prefix = "linqra.ai")
@Data
public class AiGatewayProperties {

    private List<Provider> providers = new ArrayList<>();
    private Router router = new Router();
    private Cache cache = new Cache();
    private Kb kb = new Kb();
    private Search search = new Search();
    private Tasks tasks = new Tasks();
    private SourceDocuments sourceDocuments = new SourceDocuments();

    @Data
    public static class Provider {
        private String name;
        private String type = "local-stub"; // openai, gemini, claude, local-stub
        private Set<ProviderCapability> capabilities = EnumSet.allOf(ProviderCapability.class);
        private int priority = 100; // lower is preferred
        private String endpoint;
        private String apiKey;
        private String completionModel;
        private String embeddingModel;
        private int embeddingDim;
        private double inputPricePer1M;
        private double outputPricePer1M;
        private int maxConcurrency = 4;
        private boolean chargesFailedRequests = false;
        private Duration timeout = Duration.ofSeconds(60);
        private int maxOutputTokens = 1024;
    }

    @Data
    public static class Router {
        private int maxAttempts = 3;
        private Duration initialBackoff = Duration.ofMillis(200);
        private Duration maxBackoff = Duration.ofSeconds(4);
        private int healthWindowSize = 20;
        private int healthMinSamples = 5;
        private double degradedFailureRate = 0.5;
        private int downAfterConsecutiveFatal = 3;
        private Duration downCooldown = Duration.ofSeconds(60);
        private double latencyAlpha = 0.3;
    }

    @Data
    public static class Cache {
        private boolean enabled = true;
        private Duration memoryTtl = Duration.ofMinutes(5);
        private int memoryMaxEntries = 500;
        private boolean redisEnabled = true;
        private Duration redisTtl = Duration.ofHours(24);
        private Duration redisTimeout = Duration.ofMillis(500);
        private String keyPrefix = "ai:response:";
    }

    @Data
    public static class Kb {
        private String defaultEmbeddingModel = "local-stub-embed";
        private int defaultEmbeddingDim = 256;
        private int chunkMaxSize = 2000; // characters
        private int chunkOverlap = 200;
        private int embedBatchSize = 16;
        private int ingestConcurrency = 4;
    }

    @Data
    public static class Search {
        private double vectorWeight = 0.7;
        private double lexicalWeight = 0.3;
        private int defaultK = 10;
        private int maxK = 100;
    }

    @Data
    public static class Tasks {
        private int workerCount = 4;
        private int queueCapacity = 1000;
        private String defaultTemplate = "summarize_requirement";
        private int retrievalK = 5;
    }

    @Data
    public static class SourceDocuments {
        private String baseUrl = "http://localhost:8080/api/source-documents";
        private Duration timeout = Duration.ofSeconds(10);
    }
}
