package org.lite.ai.service.impl;

import lombok.extern.slf4j.Slf4j;
import org.lite.ai.config.AiGatewayProperties;
import org.lite.ai.dto.SourceDocument;
import org.lite.ai.service.SourceDocumentClient;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

@Service
@Slf4j
public class HttpSourceDocumentClient implements SourceDocumentClient {

    private final AiGatewayProperties properties;
    private final WebClient webClient;

    public HttpSourceDocumentClient(AiGatewayProperties properties, WebClient.Builder webClientBuilder) {
        this.properties = properties;
        this.webClient = webClientBuilder.baseUrl(properties.getSourceDocuments().getBaseUrl()).build();
    }

    @Override
    public Mono<SourceDocument> fetch(String entityType, String entityId) {
        log.debug("Fetching source document {}:{}", entityType, entityId);
        return webClient.get()
                .uri("/{entityType}/{entityId}", entityType, entityId)
                .retrieve()
                .onStatus(status -> status.value() == HttpStatus.NOT_FOUND.value(),
                        response -> Mono.error(new IllegalArgumentException(
                                "Source document not found: " + entityType + ":" + entityId)))
                .bodyToMono(SourceDocument.class)
                .timeout(properties.getSourceDocuments().getTimeout())
                .switchIfEmpty(Mono.error(() -> new IllegalArgumentException(
                        "Source document has no content: " + entityType + ":" + entityId)))
                .doOnError(error -> log.warn("❌ Failed to fetch source document {}:{}: {}",
                        entityType, entityId, error.getMessage()));
    }
}
