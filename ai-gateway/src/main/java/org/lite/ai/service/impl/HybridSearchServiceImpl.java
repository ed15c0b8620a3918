package org.lite.ai.service.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.lite.ai.config.AiGatewayProperties;
import org.lite.ai.dto.SearchHit;
import org.lite.ai.dto.SearchRequest;
import org.lite.ai.dto.SearchResponse;
import org.lite.ai.entity.EmbeddingRecord;
import org.lite.ai.exception.NoActiveVersionException;
import org.lite.ai.service.ActiveCorpus;
import org.lite.ai.service.ActiveCorpusRegistry;
import org.lite.ai.service.HybridSearchService;
import org.lite.ai.service.ProviderRouterService;
import org.lite.ai.util.LexicalTokenizer;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

@Service
@Slf4j
@RequiredArgsConstructor
public class HybridSearchServiceImpl implements HybridSearchService {

    static final double BM25_K1 = 1.2;
    static final double BM25_B = 0.75;

    // higher score, then newer source, then record id
    static final Comparator<SearchHit> RANKING = Comparator
            .comparingDouble(SearchHit::getScore).reversed()
            .thenComparing(hit -> hit.getRecord().getSourceUpdatedAt(),
                    Comparator.nullsLast(Comparator.<LocalDateTime>reverseOrder()))
            .thenComparing(hit -> hit.getRecord().getId(), Comparator.nullsLast(Comparator.<String>naturalOrder()));

    private final ActiveCorpusRegistry activeCorpusRegistry;
    private final ProviderRouterService providerRouterService;
    private final AiGatewayProperties properties;

    @Override
    public Mono<SearchResponse> search(SearchRequest request) {
        return Mono.defer(() -> {
            AiGatewayProperties.Search settings = properties.getSearch();
            if (request.getQuery() == null || request.getQuery().isBlank()) {
                return Mono.error(new IllegalArgumentException("query must not be blank"));
            }
            int k = request.getK() == null ? settings.getDefaultK() : request.getK();
            if (k <= 0) {
                return Mono.error(new IllegalArgumentException("k must be positive"));
            }
            k = Math.min(k, settings.getMaxK());

            String model = request.getModel() != null && !request.getModel().isBlank()
                    ? request.getModel()
                    : properties.getKb().getDefaultEmbeddingModel();

            // the pointer is read exactly once per search
            ActiveCorpus corpus = activeCorpusRegistry.get(model).orElse(null);
            if (corpus == null) {
                return Mono.error(new NoActiveVersionException(model));
            }
            if (request.getDim() != null && request.getDim() != corpus.getEmbeddingDim()) {
                log.warn("⚠️ Search for {} asked for dim {} but active version {} has dim {}",
                        model, request.getDim(), corpus.getKbVersion(), corpus.getEmbeddingDim());
                return Mono.error(new NoActiveVersionException(model + "@" + request.getDim()));
            }

            List<ActiveCorpus.Entry> candidates = prefilter(corpus, request.getFilters());
            if (candidates.isEmpty()) {
                log.debug("No candidates in {} for query after filtering", corpus.getKbVersion());
                return Mono.just(response(corpus, new ArrayList<>()));
            }

            int limit = k;
            return providerRouterService.embed(List.of(request.getQuery()), model)
                    .map(result -> {
                        List<SearchHit> hits = rank(candidates, toArray(result.getVectors().get(0)),
                                request.getQuery(), settings, limit);
                        log.debug("Search over {} ({} candidates) returned {} hits",
                                corpus.getKbVersion(), candidates.size(), hits.size());
                        return response(corpus, hits);
                    });
        });
    }

    private SearchResponse response(ActiveCorpus corpus, List<SearchHit> hits) {
        return SearchResponse.builder()
                .kbVersion(corpus.getKbVersion())
                .embeddingModel(corpus.getEmbeddingModel())
                .hits(hits)
                .build();
    }

    List<ActiveCorpus.Entry> prefilter(ActiveCorpus corpus, SearchRequest.Filters filters) {
        if (filters == null) {
            return corpus.getEntries();
        }
        Set<String> types = filters.getEntityTypes() == null || filters.getEntityTypes().isEmpty()
                ? null : new LinkedHashSet<>(filters.getEntityTypes());
        List<String> keywords = filters.getKeywords() == null ? List.of() : filters.getKeywords().stream()
                .filter(keyword -> keyword != null && !keyword.isBlank())
                .map(keyword -> keyword.toLowerCase(Locale.ROOT))
                .collect(Collectors.toList());
        Map<String, String> metadata = filters.getMetadata() == null ? Map.of() : filters.getMetadata();

        List<ActiveCorpus.Entry> candidates = new ArrayList<>();
        for (ActiveCorpus.Entry entry : corpus.getEntries()) {
            EmbeddingRecord record = entry.getRecord();
            if (types != null && !types.contains(record.getEntityType())) {
                continue;
            }
            if (!matchesMetadata(record.getMetadata(), metadata)) {
                continue;
            }
            if (!keywords.stream().allMatch(entry.getLowerText()::contains)) {
                continue;
            }
            candidates.add(entry);
        }
        return candidates;
    }

    // a null filter value matches records that do not carry the key
    private static boolean matchesMetadata(Map<String, String> actual, Map<String, String> required) {
        Map<String, String> present = actual == null ? Map.of() : actual;
        for (Map.Entry<String, String> expected : required.entrySet()) {
            if (!Objects.equals(expected.getValue(), present.get(expected.getKey()))) {
                return false;
            }
        }
        return true;
    }

    List<SearchHit> rank(List<ActiveCorpus.Entry> candidates, double[] queryVector, String query,
                         AiGatewayProperties.Search settings, int k) {
        double[] lexical = bm25(candidates, LexicalTokenizer.tokenize(query));
        List<SearchHit> hits = new ArrayList<>(candidates.size());
        for (int i = 0; i < candidates.size(); i++) {
            ActiveCorpus.Entry entry = candidates.get(i);
            double vectorScore = vectorScore(queryVector, entry.getVector());
            double score = settings.getVectorWeight() * vectorScore + settings.getLexicalWeight() * lexical[i];
            hits.add(SearchHit.builder()
                    .record(entry.getRecord())
                    .score(score)
                    .vectorScore(vectorScore)
                    .lexicalScore(lexical[i])
                    .build());
        }
        hits.sort(RANKING);
        return hits.size() > k ? new ArrayList<>(hits.subList(0, k)) : hits;
    }

    /**
     * Cosine similarity mapped to [0, 1]; vectors of different length (or zero vectors) score 0.
     */
    static double vectorScore(double[] a, double[] b) {
        if (a == null || b == null || a.length != b.length || a.length == 0) {
            return 0.0;
        }
        double dot = 0;
        double na = 0;
        double nb = 0;
        for (int i = 0; i < a.length; i++) {
            dot += a[i] * b[i];
            na += a[i] * a[i];
            nb += b[i] * b[i];
        }
        if (na == 0 || nb == 0) {
            return 0.0;
        }
        double cosine = dot / Math.sqrt(na * nb);
        return Math.max(0.0, Math.min(1.0, (cosine + 1.0) / 2.0));
    }

    /**
     * BM25 over the candidate set, divided by the best candidate's score so the top lexical match is 1.
     */
    static double[] bm25(List<ActiveCorpus.Entry> candidates, List<String> queryTerms) {
        double[] scores = new double[candidates.size()];
        if (candidates.isEmpty() || queryTerms.isEmpty()) {
            return scores;
        }
        Set<String> terms = new LinkedHashSet<>(queryTerms);
        Map<String, Integer> documentFrequency = new HashMap<>();
        long totalLength = 0;
        for (ActiveCorpus.Entry entry : candidates) {
            totalLength += entry.getLength();
            for (String term : terms) {
                if (entry.getTermFrequencies().containsKey(term)) {
                    documentFrequency.merge(term, 1, Integer::sum);
                }
            }
        }
        int n = candidates.size();
        double avgLength = Math.max(1.0, (double) totalLength / n);

        double max = 0;
        for (int i = 0; i < n; i++) {
            ActiveCorpus.Entry entry = candidates.get(i);
            double score = 0;
            for (String term : terms) {
                Integer tf = entry.getTermFrequencies().get(term);
                if (tf == null) {
                    continue;
                }
                int df = documentFrequency.getOrDefault(term, 0);
                double idf = Math.log(1 + (n - df + 0.5) / (df + 0.5));
                double norm = tf + BM25_K1 * (1 - BM25_B + BM25_B * entry.getLength() / avgLength);
                score += idf * (tf * (BM25_K1 + 1)) / norm;
            }
            scores[i] = score;
            max = Math.max(max, score);
        }
        if (max > 0) {
            for (int i = 0; i < n; i++) {
                scores[i] = scores[i] / max;
            }
        }
        return scores;
    }

    private static double[] toArray(List<Double> vector) {
        double[] values = new double[vector.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = vector.get(i);
        }
        return values;
    }
}
