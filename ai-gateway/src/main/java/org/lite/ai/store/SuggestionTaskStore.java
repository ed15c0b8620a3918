package org.lite.ai.store;

import org.lite.ai.entity.SuggestionTask;
import org.lite.ai.enums.SuggestionTaskStatus;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * Task persistence. Every mutator is a conditional update that completes empty when the task is not in a
 * state that allows it, so terminal tasks can never be changed.
 */
public interface SuggestionTaskStore {

    Mono<SuggestionTask> insert(SuggestionTask task);

    Mono<SuggestionTask> findByTaskId(String taskId);

    Flux<SuggestionTask> find(SuggestionTaskStatus status, String taskType, int limit);

    /** PENDING to RUNNING. */
    Mono<SuggestionTask> markRunning(String taskId, LocalDateTime at);

    /**
     * Raises progress of a RUNNING task; lower or equal values are ignored. {@code kbVersion} is recorded
     * when non-null.
     */
    Mono<SuggestionTask> updateProgress(String taskId, int progress, String kbVersion);

    /** RUNNING to COMPLETED, writing the result in the same update. */
    Mono<SuggestionTask> complete(String taskId, Map<String, Object> result, String kbVersion, LocalDateTime at);

    /** PENDING or RUNNING to FAILED. */
    Mono<SuggestionTask> fail(String taskId, String errorMessage, LocalDateTime at);

    /** Removes a task that has not started yet; emits false when it is no longer PENDING. */
    Mono<Boolean> deleteIfPending(String taskId);
}
