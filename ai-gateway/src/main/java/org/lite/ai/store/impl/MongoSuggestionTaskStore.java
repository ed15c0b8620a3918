package org.lite.ai.store.impl;

import lombok.RequiredArgsConstructor;
import org.lite.ai.entity.SuggestionTask;
import org.lite.ai.enums.SuggestionTaskStatus;
import org.lite.ai.repository.SuggestionTaskRepository;
import org.lite.ai.store.SuggestionTaskStore;
import org.springframework.context.annotation.Profile;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.ReactiveMongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

@Component
@Profile("!in-memory")
@RequiredArgsConstructor
public class MongoSuggestionTaskStore implements SuggestionTaskStore {

    private static final FindAndModifyOptions RETURN_NEW = FindAndModifyOptions.options().returnNew(true);

    private final SuggestionTaskRepository suggestionTaskRepository;
    private final ReactiveMongoTemplate reactiveMongoTemplate;

    @Override
    public Mono<SuggestionTask> insert(SuggestionTask task) {
        return reactiveMongoTemplate.insert(task);
    }

    @Override
    public Mono<SuggestionTask> findByTaskId(String taskId) {
        return suggestionTaskRepository.findByTaskId(taskId);
    }

    @Override
    public Flux<SuggestionTask> find(SuggestionTaskStatus status, String taskType, int limit) {
        Query query = new Query();
        if (status != null) {
            query.addCriteria(Criteria.where("status").is(status));
        }
        if (taskType != null) {
            query.addCriteria(Criteria.where("taskType").is(taskType));
        }
        query.with(Sort.by(Sort.Direction.DESC, "createdAt")).limit(limit);
        return reactiveMongoTemplate.find(query, SuggestionTask.class);
    }

    @Override
    public Mono<SuggestionTask> markRunning(String taskId, LocalDateTime at) {
        Query query = Query.query(Criteria.where("taskId").is(taskId).and("status").is(SuggestionTaskStatus.PENDING));
        Update update = new Update()
                .set("status", SuggestionTaskStatus.RUNNING)
                .set("startedAt", at)
                .set("updatedAt", at);
        return reactiveMongoTemplate.findAndModify(query, update, RETURN_NEW, SuggestionTask.class);
    }

    @Override
    public Mono<SuggestionTask> updateProgress(String taskId, int progress, String kbVersion) {
        Query query = Query.query(Criteria.where("taskId").is(taskId)
                .and("status").is(SuggestionTaskStatus.RUNNING)
                .and("progress").lt(progress));
        Update update = new Update()
                .set("progress", progress)
                .set("updatedAt", LocalDateTime.now());
        if (kbVersion != null) {
            update.set("kbVersion", kbVersion);
        }
        return reactiveMongoTemplate.findAndModify(query, update, RETURN_NEW, SuggestionTask.class);
    }

    @Override
    public Mono<SuggestionTask> complete(String taskId, Map<String, Object> result, String kbVersion, LocalDateTime at) {
        Query query = Query.query(Criteria.where("taskId").is(taskId).and("status").is(SuggestionTaskStatus.RUNNING));
        Update update = new Update()
                .set("status", SuggestionTaskStatus.COMPLETED)
                .set("progress", 100)
                .set("result", result)
                .set("completedAt", at)
                .set("updatedAt", at);
        if (kbVersion != null) {
            update.set("kbVersion", kbVersion);
        }
        return reactiveMongoTemplate.findAndModify(query, update, RETURN_NEW, SuggestionTask.class);
    }

    @Override
    public Mono<SuggestionTask> fail(String taskId, String errorMessage, LocalDateTime at) {
        Query query = Query.query(Criteria.where("taskId").is(taskId)
                .and("status").in(List.of(SuggestionTaskStatus.PENDING, SuggestionTaskStatus.RUNNING)));
        Update update = new Update()
                .set("status", SuggestionTaskStatus.FAILED)
                .set("errorMessage", errorMessage)
                .set("completedAt", at)
                .set("updatedAt", at);
        return reactiveMongoTemplate.findAndModify(query, update, RETURN_NEW, SuggestionTask.class);
    }

    @Override
    public Mono<Boolean> deleteIfPending(String taskId) {
        Query query = Query.query(Criteria.where("taskId").is(taskId).and("status").is(SuggestionTaskStatus.PENDING));
        return reactiveMongoTemplate.remove(query, SuggestionTask.class)
                .map(result -> result.getDeletedCount() > 0);
    }
}
