package org.lite.ai.provider;

import com.fasterxml.jackson.databind.JsonNode;
import org.lite.ai.config.AiGatewayProperties;
import org.lite.ai.dto.CompletionRequest;
import org.lite.ai.dto.ProviderCompletion;
import org.lite.ai.dto.ProviderEmbedding;
import org.lite.ai.exception.ProviderException;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * OpenAI-compatible chat completions and embeddings, bearer auth.
 */
public class OpenAiProvider extends AbstractHttpLlmProvider {

    private static final String DEFAULT_ENDPOINT = "https://api.openai.com/v1";

    public OpenAiProvider(AiGatewayProperties.Provider settings, WebClient.Builder webClientBuilder) {
        super(settings, webClientBuilder);
    }

    @Override
    public Mono<ProviderCompletion> complete(CompletionRequest request) {
        List<Map<String, Object>> messages = new ArrayList<>();
        if (request.getSystemPrompt() != null) {
            messages.add(Map.of("role", "system", "content", request.getSystemPrompt()));
        }
        messages.add(Map.of("role", "user", "content", request.getPrompt()));

        Map<String, Object> payload = new HashMap<>();
        if (request.getParams() != null) {
            payload.putAll(request.getParams());
        }
        payload.put("model", completionModel(request));
        payload.put("messages", messages);
        payload.put("max_tokens", maxTokens(request));
        if (request.getTemperature() != null) {
            payload.put("temperature", request.getTemperature());
        }

        return postJson(endpoint() + "/chat/completions", authHeaders(), payload)
                .map(root -> ProviderCompletion.builder()
                        .text(requireText("choices[0].message.content",
                                root.path("choices").path(0).path("message").path("content")))
                        .model(root.path("model").asText(completionModel(request)))
                        .inputTokens(longOrZero(root.path("usage").path("prompt_tokens")))
                        .outputTokens(longOrZero(root.path("usage").path("completion_tokens")))
                        .build());
    }

    @Override
    public Mono<ProviderEmbedding> embed(List<String> texts) {
        Map<String, Object> payload = Map.of(
                "model", getEmbeddingModel(),
                "input", texts);

        return postJson(endpoint() + "/embeddings", authHeaders(), payload)
                .map(root -> {
                    JsonNode data = root.path("data");
                    if (!data.isArray()) {
                        throw ProviderException.invalidResponse(getName(), "Missing data array in embedding response");
                    }
                    List<List<Double>> vectors = new ArrayList<>();
                    for (int i = 0; i < texts.size(); i++) {
                        vectors.add(null);
                    }
                    for (JsonNode item : data) {
                        int index = item.path("index").asInt(-1);
                        if (index < 0 || index >= texts.size()) {
                            throw ProviderException.invalidResponse(getName(), "Embedding index out of range: " + index);
                        }
                        vectors.set(index, readVector(item.path("embedding")));
                    }
                    return ProviderEmbedding.builder()
                            .vectors(vectors)
                            .model(root.path("model").asText(getEmbeddingModel()))
                            .inputTokens(longOrZero(root.path("usage").path("prompt_tokens")))
                            .build();
                });
    }

    private List<Double> readVector(JsonNode node) {
        if (!node.isArray()) {
            throw ProviderException.invalidResponse(getName(), "Embedding is not an array");
        }
        List<Double> vector = new ArrayList<>(node.size());
        node.forEach(value -> vector.add(value.asDouble()));
        return vector;
    }

    private Map<String, String> authHeaders() {
        return Map.of("Authorization", "Bearer " + settings.getApiKey());
    }

    private String endpoint() {
        return settings.getEndpoint() != null ? settings.getEndpoint() : DEFAULT_ENDPOINT;
    }
}
