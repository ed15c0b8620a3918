package org.lite.ai.service;

import lombok.Getter;
import org.lite.ai.entity.EmbeddingRecord;
import org.lite.ai.util.LexicalTokenizer;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Immutable, search-ready view of one ACTIVE knowledge-base version. Published by reference so that a
 * search which read the pointer once works against exactly one version.
 */
@Getter
public final class ActiveCorpus {

    private final String kbVersion;
    private final String embeddingModel;
    private final int embeddingDim;
    private final LocalDateTime activatedAt;
    private final List<Entry> entries;

    public ActiveCorpus(String kbVersion, String embeddingModel, int embeddingDim, LocalDateTime activatedAt,
                        List<EmbeddingRecord> records) {
        this.kbVersion = kbVersion;
        this.embeddingModel = embeddingModel;
        this.embeddingDim = embeddingDim;
        this.activatedAt = activatedAt;
        List<Entry> built = new ArrayList<>(records.size());
        for (EmbeddingRecord record : records) {
            built.add(new Entry(record.toBuilder().active(true).build()));
        }
        this.entries = Collections.unmodifiableList(built);
    }

    public int size() {
        return entries.size();
    }

    /**
     * A record with its vector and term statistics precomputed.
     */
    @Getter
    public static final class Entry {
        private final EmbeddingRecord record;
        private final double[] vector;
        private final Map<String, Integer> termFrequencies;
        private final int length;
        private final String lowerText;

        Entry(EmbeddingRecord record) {
            this.record = record;
            List<Double> embedding = record.getEmbedding();
            this.vector = new double[embedding == null ? 0 : embedding.size()];
            for (int i = 0; i < vector.length; i++) {
                vector[i] = embedding.get(i);
            }
            List<String> tokens = LexicalTokenizer.tokenize(record.getText());
            this.termFrequencies = Collections.unmodifiableMap(LexicalTokenizer.termFrequencies(tokens));
            this.length = tokens.size();
            this.lowerText = record.getText() == null ? "" : record.getText().toLowerCase(Locale.ROOT);
        }
    }
}
