package org.lite.ai.provider;

import org.lite.ai.config.AiGatewayProperties;
import org.lite.ai.dto.CompletionRequest;
import org.lite.ai.dto.ProviderCompletion;
import org.lite.ai.dto.ProviderEmbedding;
import org.lite.ai.util.ContentHashes;
import org.lite.ai.util.TokenEstimator;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Offline provider for development and tests. Embeddings are unit vectors seeded from SHA-512 of the text,
 * so identical text always maps to the identical vector; completions echo a digest of the prompt.
 */
public class LocalStubProvider extends AbstractLlmProvider {

    private static final int DEFAULT_DIM = 256;

    public LocalStubProvider(AiGatewayProperties.Provider settings) {
        super(settings);
    }

    @Override
    public int getEmbeddingDim() {
        return settings.getEmbeddingDim() > 0 ? settings.getEmbeddingDim() : DEFAULT_DIM;
    }

    @Override
    public Mono<ProviderCompletion> complete(CompletionRequest request) {
        return Mono.fromSupplier(() -> {
            String prompt = request.getPrompt() == null ? "" : request.getPrompt();
            String preview = prompt.length() > 160 ? prompt.substring(0, 160) + "..." : prompt;
            String text = "{\"summary\": \"" + preview.replace("\\", "\\\\").replace("\"", "\\\"").replace("\n", " ")
                    + "\", \"digest\": \"" + ContentHashes.sha256Hex(prompt).substring(0, 12) + "\"}";
            return ProviderCompletion.builder()
                    .text(text)
                    .model(completionModel(request) != null ? completionModel(request) : "local-stub-chat")
                    .inputTokens(TokenEstimator.estimate(prompt))
                    .outputTokens(TokenEstimator.estimate(text))
                    .build();
        });
    }

    @Override
    public Mono<ProviderEmbedding> embed(List<String> texts) {
        return Mono.fromSupplier(() -> {
            List<List<Double>> vectors = new ArrayList<>(texts.size());
            for (String text : texts) {
                vectors.add(vectorFor(text, getEmbeddingDim()));
            }
            return ProviderEmbedding.builder()
                    .vectors(vectors)
                    .model(getEmbeddingModel())
                    .inputTokens(TokenEstimator.estimate(texts))
                    .build();
        });
    }

    static List<Double> vectorFor(String text, int dim) {
        double[] values = new double[dim];
        int filled = 0;
        int round = 0;
        while (filled < dim) {
            byte[] block = ContentHashes.digest("SHA-512", (round++ + ":" + text).getBytes(StandardCharsets.UTF_8));
            for (int i = 0; i < block.length && filled < dim; i++) {
                values[filled++] = (block[i] / 128.0);
            }
        }
        double norm = 0;
        for (double v : values) {
            norm += v * v;
        }
        norm = Math.sqrt(norm);
        List<Double> vector = new ArrayList<>(dim);
        for (double v : values) {
            vector.add(norm == 0 ? 0.0 : v / norm);
        }
        return vector;
    }
}
