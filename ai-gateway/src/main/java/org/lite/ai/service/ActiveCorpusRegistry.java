package org.lite.ai.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * One active-corpus pointer per embedding model family. Writers are the version manager only.
 */
@Component
@Slf4j
public class ActiveCorpusRegistry {

    private final Map<String, ActiveCorpus> corpora = new ConcurrentHashMap<>();

    public Optional<ActiveCorpus> get(String embeddingModel) {
        return Optional.ofNullable(corpora.get(embeddingModel));
    }

    /**
     * Swaps the family's pointer to {@code corpus}, returning the one it replaced.
     */
    public Optional<ActiveCorpus> publish(ActiveCorpus corpus) {
        ActiveCorpus previous = corpora.put(corpus.getEmbeddingModel(), corpus);
        log.info("🔁 Active corpus for {} is now {} ({} records, previously {})",
                corpus.getEmbeddingModel(), corpus.getKbVersion(), corpus.size(),
                previous == null ? "none" : previous.getKbVersion());
        return Optional.ofNullable(previous);
    }
}
