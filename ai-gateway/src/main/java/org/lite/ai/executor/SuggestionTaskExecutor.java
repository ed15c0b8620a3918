package org.lite.ai.executor;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.lite.ai.dto.CachedResponse;
import org.lite.ai.dto.CompletionRequest;
import org.lite.ai.dto.PromptTemplate;
import org.lite.ai.dto.SearchHit;
import org.lite.ai.entity.Suggestion;
import org.lite.ai.entity.SuggestionTask;
import org.lite.ai.enums.CacheTier;
import org.lite.ai.enums.SuggestionReviewStatus;
import org.lite.ai.service.PromptTemplateRegistry;
import org.lite.ai.service.ProviderRouterService;
import org.lite.ai.service.ResponseCacheService;
import org.lite.ai.store.SuggestionStore;
import org.lite.ai.util.CacheKeys;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Abstract base class for suggestion task executors.
 * Each task type has its own executor; the shared part renders the prompt, consults the response cache,
 * generates through the router and persists the {@link Suggestion}.
 */
@RequiredArgsConstructor
@Slf4j
public abstract class SuggestionTaskExecutor {

    public static final int PROGRESS_RETRIEVAL_DONE = 40;
    public static final int PROGRESS_GENERATION_DONE = 80;

    protected final PromptTemplateRegistry promptTemplateRegistry;
    protected final ProviderRouterService providerRouterService;
    protected final ResponseCacheService responseCacheService;
    protected final SuggestionStore suggestionStore;
    protected final Clock clock;

    /**
     * Task type this executor serves, as submitted by callers.
     */
    public abstract String getTaskType();

    /**
     * Runs the task. Failures propagate; the orchestrator turns them into a FAILED task.
     */
    public abstract Mono<Outcome> execute(SuggestionTask task, SuggestionTaskContext context);

    /**
     * Result to store on the completed task and the KB version it was grounded on (null without retrieval).
     */
    @Data
    @AllArgsConstructor
    public static class Outcome {
        private Map<String, Object> result;
        private String kbVersion;
    }

    /**
     * Renders {@code template}, serves it from the cache when possible, otherwise generates and caches it,
     * then stores the suggestion and builds the task result.
     */
    protected Mono<Outcome> generate(SuggestionTask task, SuggestionTaskContext context, PromptTemplate template,
                                     Map<String, Object> variables, String kbVersion, List<SearchHit> sources) {
        Map<String, Object> payload = payload(task);
        String model = string(payload, "model", null);
        Map<String, Object> params = map(payload, "params");
        Double temperature = payload.get("temperature") instanceof Number
                ? ((Number) payload.get("temperature")).doubleValue() : null;
        Integer maxTokens = payload.get("max_tokens") instanceof Number
                ? ((Number) payload.get("max_tokens")).intValue() : null;
        String prompt = promptTemplateRegistry.render(template, variables);
        String cacheKey = CacheKeys.fingerprint(template.getName(), template.getVersion(), variables, model,
                decodingParams(params, temperature, maxTokens));

        return responseCacheService.get(cacheKey)
                .onErrorResume(e -> {
                    log.warn("⚠️ Response cache lookup failed for task {}: {}", task.getTaskId(), e.getMessage());
                    return Mono.empty();
                })
                .map(cached -> new Generation(cached, true))
                .switchIfEmpty(Mono.defer(() -> providerRouterService.complete(CompletionRequest.builder()
                                .systemPrompt(template.getSystemPrompt())
                                .prompt(prompt)
                                .model(model)
                                .temperature(temperature)
                                .maxTokens(maxTokens)
                                .params(params)
                                .build())
                        .flatMap(result -> {
                            CachedResponse response = CachedResponse.builder()
                                    .text(result.getText())
                                    .provider(result.getProvider())
                                    .model(result.getModel())
                                    .cachedAt(Instant.now(clock))
                                    .build();
                            return responseCacheService.put(cacheKey, response, CacheTier.REDIS)
                                    .thenReturn(new Generation(response, false));
                        })))
                .flatMap(generation -> context.reportProgress(PROGRESS_GENERATION_DONE, kbVersion)
                        .then(storeSuggestion(task, template, kbVersion, sources, generation)))
                .map(suggestion -> new Outcome(result(suggestion, sources), kbVersion));
    }

    // everything that changes what the provider would answer belongs in the cache key
    private static Map<String, Object> decodingParams(Map<String, Object> params, Double temperature, Integer maxTokens) {
        Map<String, Object> decoding = new LinkedHashMap<>();
        decoding.put("params", params);
        decoding.put("temperature", temperature);
        decoding.put("max_tokens", maxTokens);
        return decoding;
    }

    private Mono<Suggestion> storeSuggestion(SuggestionTask task, PromptTemplate template, String kbVersion,
                                             List<SearchHit> sources, Generation generation) {
        Map<String, Object> payload = payload(task);
        Suggestion suggestion = Suggestion.builder()
                .taskId(task.getTaskId())
                .taskType(task.getTaskType())
                .entityType(string(payload, "entity_type", null))
                .entityId(string(payload, "entity_id", null))
                .text(generation.response.getText())
                .kbVersion(kbVersion)
                .templateName(template.getName())
                .templateVersion(template.getVersion())
                .provider(generation.response.getProvider())
                .model(generation.response.getModel())
                .cacheHit(generation.cacheHit)
                .sourceRecordIds(sources.stream().map(hit -> hit.getRecord().getId()).collect(Collectors.toList()))
                .reviewStatus(SuggestionReviewStatus.PENDING_REVIEW)
                .createdAt(LocalDateTime.now(clock))
                .build();
        return suggestionStore.insert(suggestion)
                .doOnNext(saved -> log.info("✅ Suggestion {} for task {} generated by {} (cache hit: {}, kb_version: {})",
                        saved.getId(), task.getTaskId(), saved.getProvider(), saved.isCacheHit(), kbVersion));
    }

    private Map<String, Object> result(Suggestion suggestion, List<SearchHit> sources) {
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("suggestion_id", suggestion.getId());
        result.put("text", suggestion.getText());
        result.put("kb_version", suggestion.getKbVersion());
        result.put("provider", suggestion.getProvider());
        result.put("model", suggestion.getModel());
        result.put("cache_hit", suggestion.isCacheHit());
        result.put("template", suggestion.getTemplateName());
        result.put("template_version", suggestion.getTemplateVersion());
        List<Map<String, Object>> sourceList = new ArrayList<>();
        for (SearchHit hit : sources) {
            Map<String, Object> source = new LinkedHashMap<>();
            source.put("record_id", hit.getRecord().getId());
            source.put("entity_type", hit.getRecord().getEntityType());
            source.put("entity_id", hit.getRecord().getEntityId());
            source.put("chunk_index", hit.getRecord().getChunkIndex());
            source.put("score", hit.getScore());
            sourceList.add(source);
        }
        result.put("sources", sourceList);
        return result;
    }

    protected static Map<String, Object> payload(SuggestionTask task) {
        return task.getPayload() == null ? Map.of() : task.getPayload();
    }

    protected static String string(Map<String, Object> payload, String key, String defaultValue) {
        Object value = payload.get(key);
        if (value == null) {
            return defaultValue;
        }
        String text = String.valueOf(value);
        return text.isBlank() ? defaultValue : text;
    }

    @SuppressWarnings("unchecked")
    protected static Map<String, Object> map(Map<String, Object> payload, String key) {
        Object value = payload.get(key);
        if (value == null) {
            return new LinkedHashMap<>();
        }
        if (!(value instanceof Map)) {
            throw new IllegalArgumentException("Payload field '" + key + "' must be an object");
        }
        return new LinkedHashMap<>((Map<String, Object>) value);
    }

    private static final class Generation {
        private final CachedResponse response;
        private final boolean cacheHit;

        private Generation(CachedResponse response, boolean cacheHit) {
            this.response = response;
            this.cacheHit = cacheHit;
        }
    }
}
