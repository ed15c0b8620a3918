package org.lite.ai.store.impl;

import org.lite.ai.entity.Suggestion;
import org.lite.ai.enums.SuggestionReviewStatus;
import org.lite.ai.store.SuggestionStore;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

@Component
@Profile("in-memory")
public class InMemorySuggestionStore implements SuggestionStore {

    private final Map<String, Suggestion> suggestions = new ConcurrentHashMap<>();

    @Override
    public Mono<Suggestion> insert(Suggestion suggestion) {
        return Mono.fromSupplier(() -> {
            Suggestion stored = suggestion.toBuilder().build();
            if (stored.getId() == null) {
                stored.setId(UUID.randomUUID().toString());
            }
            suggestions.put(stored.getTaskId(), stored);
            return stored.toBuilder().build();
        });
    }

    @Override
    public Mono<Suggestion> findByTaskId(String taskId) {
        return Mono.fromSupplier(() -> {
            Suggestion found = suggestions.get(taskId);
            return found == null ? null : found.toBuilder().build();
        });
    }

    @Override
    public Mono<Suggestion> review(String taskId, Set<SuggestionReviewStatus> from, SuggestionReviewStatus to,
                                   String reviewedBy, String note, String modifiedText, LocalDateTime at) {
        return Mono.fromSupplier(() -> {
            Suggestion[] changed = new Suggestion[1];
            suggestions.computeIfPresent(taskId, (key, current) -> {
                if (!from.contains(current.getReviewStatus())) {
                    return current;
                }
                Suggestion.SuggestionBuilder next = current.toBuilder().reviewStatus(to);
                if (to == SuggestionReviewStatus.APPLIED) {
                    next.appliedAt(at);
                } else {
                    next.reviewedAt(at).reviewedBy(reviewedBy).reviewNote(note);
                }
                if (modifiedText != null) {
                    next.modifiedText(modifiedText);
                }
                changed[0] = next.build();
                return changed[0];
            });
            return changed[0] == null ? null : changed[0].toBuilder().build();
        });
    }
}
