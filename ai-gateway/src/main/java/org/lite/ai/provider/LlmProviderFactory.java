package org.lite.ai.provider;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.lite.ai.config.AiGatewayProperties;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Builds the fixed provider list from {@code linqra.ai.providers}.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class LlmProviderFactory {

    private final AiGatewayProperties properties;
    private final WebClient.Builder webClientBuilder;

    public List<LlmProvider> createProviders() {
        List<LlmProvider> providers = new ArrayList<>();
        Set<String> names = new HashSet<>();
        for (AiGatewayProperties.Provider settings : properties.getProviders()) {
            if (settings.getName() == null || settings.getName().isBlank()) {
                throw new IllegalStateException("Every configured provider needs a name");
            }
            if (!names.add(settings.getName())) {
                throw new IllegalStateException("Duplicate provider name: " + settings.getName());
            }
            LlmProvider provider = create(settings);
            log.info("📋 Registered provider {} (type: {}, capabilities: {}, priority: {}, maxConcurrency: {})",
                    provider.getName(), settings.getType(), provider.getCapabilities(),
                    provider.getPriority(), provider.getMaxConcurrency());
            providers.add(provider);
        }
        if (providers.isEmpty()) {
            log.warn("⚠️ No AI providers configured; completion and embedding calls will fail");
        }
        return providers;
    }

    LlmProvider create(AiGatewayProperties.Provider settings) {
        String type = settings.getType() == null ? "local-stub" : settings.getType().toLowerCase(Locale.ROOT);
        switch (type) {
            case "openai":
                return new OpenAiProvider(settings, webClientBuilder);
            case "gemini":
                return new GeminiProvider(settings, webClientBuilder);
            case "claude":
                return new ClaudeProvider(settings, webClientBuilder);
            case "local-stub":
                return new LocalStubProvider(settings);
            default:
                throw new IllegalStateException("Unknown provider type '" + settings.getType() + "' for " + settings.getName());
        }
    }
}
