package org.lite.ai.store.impl;

import org.lite.ai.entity.SuggestionTask;
import org.lite.ai.enums.SuggestionTaskStatus;
import org.lite.ai.store.SuggestionTaskStore;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

@Component
@Profile("in-memory")
public class InMemorySuggestionTaskStore implements SuggestionTaskStore {

    private final Map<String, SuggestionTask> tasks = new ConcurrentHashMap<>();

    @Override
    public Mono<SuggestionTask> insert(SuggestionTask task) {
        return Mono.fromSupplier(() -> {
            SuggestionTask stored = task.toBuilder().build();
            if (stored.getId() == null) {
                stored.setId(UUID.randomUUID().toString());
            }
            if (tasks.putIfAbsent(stored.getTaskId(), stored) != null) {
                throw new IllegalStateException("Duplicate task id " + stored.getTaskId());
            }
            return stored.toBuilder().build();
        });
    }

    @Override
    public Mono<SuggestionTask> findByTaskId(String taskId) {
        return Mono.fromSupplier(() -> {
            SuggestionTask task = tasks.get(taskId);
            return task == null ? null : task.toBuilder().build();
        });
    }

    @Override
    public Flux<SuggestionTask> find(SuggestionTaskStatus status, String taskType, int limit) {
        return Flux.defer(() -> Flux.fromIterable(new ArrayList<>(tasks.values())))
                .filter(t -> status == null || t.getStatus() == status)
                .filter(t -> taskType == null || taskType.equals(t.getTaskType()))
                .sort(Comparator.comparing(SuggestionTask::getCreatedAt).reversed())
                .take(limit)
                .map(t -> t.toBuilder().build());
    }

    @Override
    public Mono<SuggestionTask> markRunning(String taskId, LocalDateTime at) {
        return update(taskId, t -> t.getStatus() == SuggestionTaskStatus.PENDING, t -> t.toBuilder()
                .status(SuggestionTaskStatus.RUNNING)
                .startedAt(at)
                .updatedAt(at)
                .build());
    }

    @Override
    public Mono<SuggestionTask> updateProgress(String taskId, int progress, String kbVersion) {
        return update(taskId,
                t -> t.getStatus() == SuggestionTaskStatus.RUNNING && t.getProgress() < progress,
                t -> t.toBuilder()
                        .progress(progress)
                        .kbVersion(kbVersion != null ? kbVersion : t.getKbVersion())
                        .updatedAt(LocalDateTime.now())
                        .build());
    }

    @Override
    public Mono<SuggestionTask> complete(String taskId, Map<String, Object> result, String kbVersion, LocalDateTime at) {
        return update(taskId, t -> t.getStatus() == SuggestionTaskStatus.RUNNING, t -> t.toBuilder()
                .status(SuggestionTaskStatus.COMPLETED)
                .progress(100)
                .result(result)
                .kbVersion(kbVersion != null ? kbVersion : t.getKbVersion())
                .completedAt(at)
                .updatedAt(at)
                .build());
    }

    @Override
    public Mono<SuggestionTask> fail(String taskId, String errorMessage, LocalDateTime at) {
        return update(taskId, t -> !t.getStatus().isTerminal(), t -> t.toBuilder()
                .status(SuggestionTaskStatus.FAILED)
                .errorMessage(errorMessage)
                .completedAt(at)
                .updatedAt(at)
                .build());
    }

    @Override
    public Mono<Boolean> deleteIfPending(String taskId) {
        return Mono.fromSupplier(() -> {
            boolean[] removed = new boolean[1];
            tasks.computeIfPresent(taskId, (key, current) -> {
                if (current.getStatus() == SuggestionTaskStatus.PENDING) {
                    removed[0] = true;
                    return null;
                }
                return current;
            });
            return removed[0];
        });
    }

    private Mono<SuggestionTask> update(String taskId, Predicate<SuggestionTask> condition,
                                        UnaryOperator<SuggestionTask> change) {
        return Mono.fromSupplier(() -> {
            SuggestionTask[] changed = new SuggestionTask[1];
            tasks.computeIfPresent(taskId, (key, current) -> {
                if (!condition.test(current)) {
                    return current;
                }
                changed[0] = change.apply(current);
                return changed[0];
            });
            return changed[0] == null ? null : changed[0].toBuilder().build();
        });
    }
}
