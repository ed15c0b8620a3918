package org.lite.ai.store.impl;

import lombok.RequiredArgsConstructor;
import org.lite.ai.entity.Suggestion;
import org.lite.ai.enums.SuggestionReviewStatus;
import org.lite.ai.repository.SuggestionRepository;
import org.lite.ai.store.SuggestionStore;
import org.springframework.context.annotation.Profile;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.ReactiveMongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;
import java.util.Set;

@Component
@Profile("!in-memory")
@RequiredArgsConstructor
public class MongoSuggestionStore implements SuggestionStore {

    private final SuggestionRepository suggestionRepository;
    private final ReactiveMongoTemplate reactiveMongoTemplate;

    @Override
    public Mono<Suggestion> insert(Suggestion suggestion) {
        return reactiveMongoTemplate.insert(suggestion);
    }

    @Override
    public Mono<Suggestion> findByTaskId(String taskId) {
        return suggestionRepository.findByTaskId(taskId);
    }

    @Override
    public Mono<Suggestion> review(String taskId, Set<SuggestionReviewStatus> from, SuggestionReviewStatus to,
                                   String reviewedBy, String note, String modifiedText, LocalDateTime at) {
        Query query = Query.query(Criteria.where("taskId").is(taskId).and("reviewStatus").in(from));
        Update update = new Update().set("reviewStatus", to);
        if (to == SuggestionReviewStatus.APPLIED) {
            update.set("appliedAt", at);
        } else {
            update.set("reviewedAt", at).set("reviewedBy", reviewedBy).set("reviewNote", note);
        }
        if (modifiedText != null) {
            update.set("modifiedText", modifiedText);
        }
        return reactiveMongoTemplate.findAndModify(query, update,
                FindAndModifyOptions.options().returnNew(true), Suggestion.class);
    }
}
