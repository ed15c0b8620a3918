package org.lite.ai.repository;

import org.lite.ai.entity.SuggestionTask;
import org.springframework.data.mongodb.repository.ReactiveMongoRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Mono;

@Repository
public interface SuggestionTaskRepository extends ReactiveMongoRepository<SuggestionTask, String> {

    Mono<SuggestionTask> findByTaskId(String taskId);
}
