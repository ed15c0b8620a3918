package org.lite.ai.provider;

import org.lite.ai.dto.CompletionRequest;
import org.lite.ai.dto.ProviderCompletion;
import org.lite.ai.dto.ProviderEmbedding;
import org.lite.ai.enums.ProviderCapability;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Set;

/**
 * One configured LLM / embedding backend. Implementations perform a single call and signal failures as
 * {@link org.lite.ai.exception.ProviderException}; retries, failover and accounting belong to the router.
 */
public interface LlmProvider {

    String getName();

    Set<ProviderCapability> getCapabilities();

    default boolean supports(ProviderCapability capability) {
        return getCapabilities().contains(capability);
    }

    /** Lower ranks are preferred. */
    int getPriority();

    String getCompletionModel();

    String getEmbeddingModel();

    int getEmbeddingDim();

    double getInputPricePer1M();

    double getOutputPricePer1M();

    int getMaxConcurrency();

    /** Whether rejected or failed requests are still billed for their input tokens. */
    boolean isChargesFailedRequests();

    Mono<ProviderCompletion> complete(CompletionRequest request);

    Mono<ProviderEmbedding> embed(List<String> texts);
}
