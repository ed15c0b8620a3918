package org.lite.ai.executor;

import lombok.extern.slf4j.Slf4j;
import org.lite.ai.config.AiGatewayProperties;
import org.lite.ai.dto.PromptTemplate;
import org.lite.ai.dto.SearchHit;
import org.lite.ai.dto.SearchRequest;
import org.lite.ai.entity.SuggestionTask;
import org.lite.ai.service.HybridSearchService;
import org.lite.ai.service.PromptTemplateRegistry;
import org.lite.ai.service.ProviderRouterService;
import org.lite.ai.service.ResponseCacheService;
import org.lite.ai.service.SourceDocumentClient;
import org.lite.ai.store.SuggestionStore;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Retrieval-augmented suggestion: search the active knowledge base, then generate from a prompt template
 * that carries the retrieved context.
 *
 * Payload: {@code entity_type}, {@code entity_id}, and the text to ground on as {@code query} or
 * {@code text} (fetched from the source-document accessor when both are absent). Optional:
 * {@code template}, {@code template_version}, {@code k}, {@code embedding_model}, {@code entity_types},
 * {@code model}, {@code params}, {@code variables}.
 */
@Component
@Slf4j
public class RagSuggestionTaskExecutor extends SuggestionTaskExecutor {

    public static final String TASK_TYPE = "rag_suggestion";

    private final HybridSearchService hybridSearchService;
    private final SourceDocumentClient sourceDocumentClient;
    private final AiGatewayProperties properties;

    public RagSuggestionTaskExecutor(PromptTemplateRegistry promptTemplateRegistry,
                                     ProviderRouterService providerRouterService,
                                     ResponseCacheService responseCacheService,
                                     SuggestionStore suggestionStore,
                                     Clock clock,
                                     HybridSearchService hybridSearchService,
                                     SourceDocumentClient sourceDocumentClient,
                                     AiGatewayProperties properties) {
        super(promptTemplateRegistry, providerRouterService, responseCacheService, suggestionStore, clock);
        this.hybridSearchService = hybridSearchService;
        this.sourceDocumentClient = sourceDocumentClient;
        this.properties = properties;
    }

    @Override
    public String getTaskType() {
        return TASK_TYPE;
    }

    @Override
    public Mono<Outcome> execute(SuggestionTask task, SuggestionTaskContext context) {
        return Mono.defer(() -> {
            Map<String, Object> payload = payload(task);
            PromptTemplate template = promptTemplateRegistry.resolve(
                    string(payload, "template", properties.getTasks().getDefaultTemplate()),
                    string(payload, "template_version", null));

            return resolveQuery(payload)
                    .flatMap(query -> context.checkCancelled()
                            .then(hybridSearchService.search(searchRequest(payload, query)))
                            .flatMap(response -> {
                                String kbVersion = response.getKbVersion();
                                List<SearchHit> hits = response.getHits();
                                log.info("Task {} retrieved {} chunks from KB version {}",
                                        task.getTaskId(), hits.size(), kbVersion);

                                Map<String, Object> variables = map(payload, "variables");
                                variables.put("entity_type", string(payload, "entity_type", ""));
                                variables.put("entity_id", string(payload, "entity_id", ""));
                                variables.put("query", query);
                                variables.put("context", formatContext(hits));

                                return context.reportProgress(PROGRESS_RETRIEVAL_DONE, kbVersion)
                                        .then(generate(task, context, template, variables, kbVersion, hits));
                            }));
        });
    }

    private Mono<String> resolveQuery(Map<String, Object> payload) {
        String query = string(payload, "query", string(payload, "text", null));
        if (query != null) {
            return Mono.just(query);
        }
        String entityType = string(payload, "entity_type", null);
        String entityId = string(payload, "entity_id", null);
        if (entityType == null || entityId == null) {
            return Mono.error(new IllegalArgumentException(
                    TASK_TYPE + " needs 'query', 'text' or 'entity_type' with 'entity_id' in its payload"));
        }
        return sourceDocumentClient.fetch(entityType, entityId)
                .map(document -> document.getText() == null ? "" : document.getText())
                .filter(text -> !text.isBlank())
                .switchIfEmpty(Mono.error(() -> new IllegalArgumentException(
                        "Source document " + entityType + ":" + entityId + " has no text")));
    }

    private SearchRequest searchRequest(Map<String, Object> payload, String query) {
        Object k = payload.get("k");
        Object entityTypes = payload.get("entity_types");
        SearchRequest.Filters filters = null;
        if (entityTypes instanceof List) {
            filters = SearchRequest.Filters.builder()
                    .entityTypes(((List<?>) entityTypes).stream().map(String::valueOf).collect(Collectors.toList()))
                    .build();
        }
        return SearchRequest.builder()
                .query(query)
                .k(k instanceof Number ? ((Number) k).intValue() : properties.getTasks().getRetrievalK())
                .model(string(payload, "embedding_model", null))
                .filters(filters)
                .build();
    }

    static String formatContext(List<SearchHit> hits) {
        if (hits.isEmpty()) {
            return "(no related context found)";
        }
        StringBuilder context = new StringBuilder();
        for (int i = 0; i < hits.size(); i++) {
            SearchHit hit = hits.get(i);
            if (i > 0) {
                context.append("\n\n");
            }
            context.append('[').append(i + 1).append("] ")
                    .append(hit.getRecord().getEntityType()).append(' ').append(hit.getRecord().getEntityId())
                    .append(":\n")
                    .append(hit.getRecord().getText());
        }
        return context.toString();
    }
}
