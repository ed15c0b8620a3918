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
 * Google Gemini generateContent / batchEmbedContents, API key passed as query parameter.
 */
public class GeminiProvider extends AbstractHttpLlmProvider {

    private static final String DEFAULT_ENDPOINT = "https://generativelanguage.googleapis.com/v1beta";

    public GeminiProvider(AiGatewayProperties.Provider settings, WebClient.Builder webClientBuilder) {
        super(settings, webClientBuilder);
    }

    @Override
    public Mono<ProviderCompletion> complete(CompletionRequest request) {
        String model = completionModel(request);
        Map<String, Object> payload = new HashMap<>();
        payload.put("contents", List.of(Map.of("role", "user", "parts", List.of(Map.of("text", request.getPrompt())))));
        if (request.getSystemPrompt() != null) {
            payload.put("systemInstruction", Map.of("parts", List.of(Map.of("text", request.getSystemPrompt()))));
        }
        Map<String, Object> generationConfig = new HashMap<>();
        if (request.getParams() != null) {
            generationConfig.putAll(request.getParams());
        }
        generationConfig.put("maxOutputTokens", maxTokens(request));
        if (request.getTemperature() != null) {
            generationConfig.put("temperature", request.getTemperature());
        }
        payload.put("generationConfig", generationConfig);

        return postJson(url(model, "generateContent"), Map.of(), payload)
                .map(root -> ProviderCompletion.builder()
                        .text(requireText("candidates[0].content.parts[0].text",
                                root.path("candidates").path(0).path("content").path("parts").path(0).path("text")))
                        .model(model)
                        .inputTokens(longOrZero(root.path("usageMetadata").path("promptTokenCount")))
                        .outputTokens(longOrZero(root.path("usageMetadata").path("candidatesTokenCount")))
                        .build());
    }

    @Override
    public Mono<ProviderEmbedding> embed(List<String> texts) {
        String model = getEmbeddingModel();
        List<Map<String, Object>> requests = new ArrayList<>();
        for (String text : texts) {
            requests.add(Map.of(
                    "model", "models/" + model,
                    "content", Map.of("parts", List.of(Map.of("text", text)))));
        }

        return postJson(url(model, "batchEmbedContents"), Map.of(), Map.of("requests", requests))
                .map(root -> {
                    JsonNode embeddings = root.path("embeddings");
                    if (!embeddings.isArray()) {
                        throw ProviderException.invalidResponse(getName(), "Missing embeddings array in response");
                    }
                    List<List<Double>> vectors = new ArrayList<>();
                    for (JsonNode embedding : embeddings) {
                        List<Double> vector = new ArrayList<>();
                        embedding.path("values").forEach(value -> vector.add(value.asDouble()));
                        vectors.add(vector);
                    }
                    // Gemini does not report usage for embeddings; the router estimates it
                    return ProviderEmbedding.builder()
                            .vectors(vectors)
                            .model(model)
                            .inputTokens(0)
                            .build();
                });
    }

    private String url(String model, String action) {
        String endpoint = settings.getEndpoint() != null ? settings.getEndpoint() : DEFAULT_ENDPOINT;
        return endpoint + "/models/" + model + ":" + action + "?key=" + settings.getApiKey();
    }
}
