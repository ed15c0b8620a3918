package org.lite.ai.provider;

import org.lite.ai.config.AiGatewayProperties;
import org.lite.ai.dto.CompletionRequest;
import org.lite.ai.dto.ProviderCompletion;
import org.lite.ai.dto.ProviderEmbedding;
import org.lite.ai.enums.ProviderCapability;
import org.lite.ai.exception.ProviderException;
import org.lite.ai.enums.ProviderFailureKind;
import reactor.core.publisher.Mono;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Exposes the configured settings of a provider; subclasses implement the wire calls.
 */
public abstract class AbstractLlmProvider implements LlmProvider {

    protected final AiGatewayProperties.Provider settings;

    protected AbstractLlmProvider(AiGatewayProperties.Provider settings) {
        this.settings = settings;
    }

    @Override
    public String getName() {
        return settings.getName();
    }

    @Override
    public Set<ProviderCapability> getCapabilities() {
        return settings.getCapabilities() == null || settings.getCapabilities().isEmpty()
                ? EnumSet.noneOf(ProviderCapability.class)
                : EnumSet.copyOf(settings.getCapabilities());
    }

    @Override
    public int getPriority() {
        return settings.getPriority();
    }

    @Override
    public String getCompletionModel() {
        return settings.getCompletionModel();
    }

    @Override
    public String getEmbeddingModel() {
        return settings.getEmbeddingModel();
    }

    @Override
    public int getEmbeddingDim() {
        return settings.getEmbeddingDim();
    }

    @Override
    public double getInputPricePer1M() {
        return settings.getInputPricePer1M();
    }

    @Override
    public double getOutputPricePer1M() {
        return settings.getOutputPricePer1M();
    }

    @Override
    public int getMaxConcurrency() {
        return Math.max(1, settings.getMaxConcurrency());
    }

    @Override
    public boolean isChargesFailedRequests() {
        return settings.isChargesFailedRequests();
    }

    @Override
    public Mono<ProviderCompletion> complete(CompletionRequest request) {
        return Mono.error(unsupported(ProviderCapability.COMPLETION));
    }

    @Override
    public Mono<ProviderEmbedding> embed(List<String> texts) {
        return Mono.error(unsupported(ProviderCapability.EMBEDDING));
    }

    protected String completionModel(CompletionRequest request) {
        return request.getModel() != null ? request.getModel() : settings.getCompletionModel();
    }

    protected int maxTokens(CompletionRequest request) {
        return request.getMaxTokens() != null ? request.getMaxTokens() : settings.getMaxOutputTokens();
    }

    private ProviderException unsupported(ProviderCapability capability) {
        return new ProviderException(getName(), ProviderFailureKind.INVALID_RESPONSE,
                "Provider does not support " + capability);
    }
}
