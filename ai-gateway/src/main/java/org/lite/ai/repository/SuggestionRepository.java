package org.lite.ai.repository;

import org.lite.ai.entity.Suggestion;
import org.springframework.data.mongodb.repository.ReactiveMongoRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Mono;

@Repository
public interface SuggestionRepository extends ReactiveMongoRepository<Suggestion, String> {

    Mono<Suggestion> findByTaskId(String taskId);
}
