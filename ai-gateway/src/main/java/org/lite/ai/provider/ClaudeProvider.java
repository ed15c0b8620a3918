package org.lite.ai.provider;

import com.fasterxml.jackson.databind.JsonNode;
import org.lite.ai.config.AiGatewayProperties;
import org.lite.ai.dto.CompletionRequest;
import org.lite.ai.dto.ProviderCompletion;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Anthropic messages API. Completion only; Anthropic has no embedding endpoint.
 */
public class ClaudeProvider extends AbstractHttpLlmProvider {

    private static final String DEFAULT_ENDPOINT = "https://api.anthropic.com/v1";
    private static final String API_VERSION = "2023-06-01";

    public ClaudeProvider(AiGatewayProperties.Provider settings, WebClient.Builder webClientBuilder) {
        super(settings, webClientBuilder);
    }

    @Override
    public Mono<ProviderCompletion> complete(CompletionRequest request) {
        String model = completionModel(request);
        Map<String, Object> payload = new HashMap<>();
        if (request.getParams() != null) {
            payload.putAll(request.getParams());
        }
        payload.put("model", model);
        payload.put("max_tokens", maxTokens(request));
        payload.put("messages", List.of(Map.of("role", "user", "content", request.getPrompt())));
        if (request.getSystemPrompt() != null) {
            payload.put("system", request.getSystemPrompt());
        }
        if (request.getTemperature() != null) {
            payload.put("temperature", request.getTemperature());
        }

        String endpoint = settings.getEndpoint() != null ? settings.getEndpoint() : DEFAULT_ENDPOINT;
        Map<String, String> headers = Map.of(
                "x-api-key", String.valueOf(settings.getApiKey()),
                "anthropic-version", API_VERSION);

        return postJson(endpoint + "/messages", headers, payload)
                .map(root -> {
                    JsonNode usage = root.path("usage");
                    return ProviderCompletion.builder()
                            .text(requireText("content[0].text", root.path("content").path(0).path("text")))
                            .model(root.path("model").asText(model))
                            .inputTokens(longOrZero(usage.path("input_tokens")))
                            .outputTokens(longOrZero(usage.path("output_tokens")))
                            .build();
                });
    }
}
