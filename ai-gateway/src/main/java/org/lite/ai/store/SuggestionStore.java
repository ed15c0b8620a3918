package org.lite.ai.store;

import org.lite.ai.entity.Suggestion;
import org.lite.ai.enums.SuggestionReviewStatus;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;
import java.util.Set;

public interface SuggestionStore {

    Mono<Suggestion> insert(Suggestion suggestion);

    Mono<Suggestion> findByTaskId(String taskId);

    /**
     * Applies a review decision when the current review status is one of {@code from}; empty otherwise.
     */
    Mono<Suggestion> review(String taskId, Set<SuggestionReviewStatus> from, SuggestionReviewStatus to,
                            String reviewedBy, String note, String modifiedText, LocalDateTime at);
}
