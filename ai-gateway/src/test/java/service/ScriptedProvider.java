package service;

import org.lite.ai.config.AiGatewayProperties;
import org.lite.ai.dto.CompletionRequest;
import org.lite.ai.dto.ProviderCompletion;
import org.lite.ai.dto.ProviderEmbedding;
import org.lite.ai.enums.ProviderCapability;
import org.lite.ai.provider.AbstractLlmProvider;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * Test provider whose completion replies are scripted call by call. Once the script is exhausted it keeps
 * answering with the fallback.
 */
class ScriptedProvider extends AbstractLlmProvider {

    private final Queue<Function<CompletionRequest, Mono<ProviderCompletion>>> completions = new ConcurrentLinkedQueue<>();
    private final AtomicInteger completionCalls = new AtomicInteger();
    private final AtomicInteger embeddingCalls = new AtomicInteger();
    private Function<CompletionRequest, Mono<ProviderCompletion>> completionFallback;
    private Function<List<String>, Mono<ProviderEmbedding>> embeddingFallback;

    ScriptedProvider(String name, int priority, int maxConcurrency) {
        super(settings(name, priority, maxConcurrency));
        this.completionFallback = request -> Mono.just(reply(name + " says hi"));
        this.embeddingFallback = texts -> Mono.just(vectors(texts.size(), 4));
    }

    static AiGatewayProperties.Provider settings(String name, int priority, int maxConcurrency) {
        AiGatewayProperties.Provider settings = new AiGatewayProperties.Provider();
        settings.setName(name);
        settings.setType("scripted");
        settings.setPriority(priority);
        settings.setMaxConcurrency(maxConcurrency);
        settings.setCapabilities(EnumSet.allOf(ProviderCapability.class));
        settings.setCompletionModel(name + "-chat");
        settings.setEmbeddingModel("test-embed");
        settings.setEmbeddingDim(4);
        settings.setInputPricePer1M(1.0);
        settings.setOutputPricePer1M(2.0);
        return settings;
    }

    ScriptedProvider thenComplete(Function<CompletionRequest, Mono<ProviderCompletion>> step) {
        completions.add(step);
        return this;
    }

    ScriptedProvider thenFail(RuntimeException error) {
        completions.add(request -> Mono.error(error));
        return this;
    }

    ScriptedProvider alwaysComplete(Function<CompletionRequest, Mono<ProviderCompletion>> fallback) {
        this.completionFallback = fallback;
        return this;
    }

    ScriptedProvider alwaysEmbed(Function<List<String>, Mono<ProviderEmbedding>> fallback) {
        this.embeddingFallback = fallback;
        return this;
    }

    int completionCalls() {
        return completionCalls.get();
    }

    int embeddingCalls() {
        return embeddingCalls.get();
    }

    @Override
    public Mono<ProviderCompletion> complete(CompletionRequest request) {
        completionCalls.incrementAndGet();
        Function<CompletionRequest, Mono<ProviderCompletion>> step = completions.poll();
        return (step != null ? step : completionFallback).apply(request);
    }

    @Override
    public Mono<ProviderEmbedding> embed(List<String> texts) {
        embeddingCalls.incrementAndGet();
        return embeddingFallback.apply(texts);
    }

    static ProviderCompletion reply(String text) {
        return ProviderCompletion.builder()
                .text(text)
                .inputTokens(100)
                .outputTokens(50)
                .build();
    }

    static ProviderEmbedding vectors(int count, int dim) {
        List<List<Double>> vectors = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            List<Double> vector = new ArrayList<>();
            for (int d = 0; d < dim; d++) {
                vector.add(d == i % dim ? 1.0 : 0.0);
            }
            vectors.add(vector);
        }
        return ProviderEmbedding.builder().vectors(vectors).inputTokens(count * 10L).build();
    }
}
