package org.lite.ai.service;

import org.lite.ai.dto.SuggestionReviewRequest;
import org.lite.ai.entity.Suggestion;
import org.lite.ai.entity.SuggestionTask;
import org.lite.ai.enums.SuggestionTaskStatus;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Asynchronous suggestion generation. Submission only persists and enqueues; a bounded worker pool runs
 * the tasks away from request threads.
 */
public interface SuggestionTaskService {

    /**
     * Persists a PENDING task and enqueues it; never waits for generation.
     */
    Mono<SuggestionTask> submit(String taskType, Map<String, Object> payload, String requestedBy);

    /**
     * Pure read; errors with {@link org.lite.ai.exception.TaskNotFoundException} for unknown ids.
     */
    Mono<SuggestionTask> getStatus(String taskId);

    /**
     * PENDING tasks are removed, RUNNING tasks fail with "Task cancelled"; terminal tasks are left alone.
     * @return whether the task was cancelled by this call
     */
    Mono<Boolean> cancel(String taskId);

    Flux<SuggestionTask> list(SuggestionTaskStatus status, String taskType, int limit);

    Mono<Suggestion> getSuggestion(String taskId);

    Mono<Suggestion> review(String taskId, SuggestionReviewRequest request);

    /**
     * Fails tasks left RUNNING by a previous process and re-enqueues PENDING ones.
     * @return number of tasks re-enqueued
     */
    Mono<Integer> recoverTasks();
}
