package org.lite.ai.service;

import org.lite.ai.dto.SearchRequest;
import org.lite.ai.dto.SearchResponse;
import reactor.core.publisher.Mono;

/**
 * Retrieval over the active corpus of one embedding model: cosine similarity blended with BM25.
 */
public interface HybridSearchService {

    /**
     * @return at most {@code k} hits from the active version, best first; errors with
     * {@link org.lite.ai.exception.NoActiveVersionException} when the model has no active version
     */
    Mono<SearchResponse> search(SearchRequest request);
}
