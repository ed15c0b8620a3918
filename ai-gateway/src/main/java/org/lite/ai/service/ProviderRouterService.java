package org.lite.ai.service;

import org.lite.ai.dto.CompletionRequest;
import org.lite.ai.dto.CompletionResult;
import org.lite.ai.dto.EmbeddingResult;
import org.lite.ai.dto.ProviderHealthSnapshot;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Single entry point for every LLM and embedding call. Selects providers by health, priority and latency,
 * retries and fails over within the attempt budget, bounds per-provider concurrency and emits one cost
 * record per attempt.
 */
public interface ProviderRouterService {

    /**
     * @return the generated text of the first successful attempt; errors with
     * {@link org.lite.ai.exception.GenerationFailedException} once the attempt budget is spent
     */
    Mono<CompletionResult> complete(CompletionRequest request);

    /**
     * Embeds {@code texts} with a provider serving {@code embeddingModel} (any embedding provider when null).
     * Vectors are returned in input order.
     */
    Mono<EmbeddingResult> embed(List<String> texts, String embeddingModel);

    List<ProviderHealthSnapshot> getHealth();
}
