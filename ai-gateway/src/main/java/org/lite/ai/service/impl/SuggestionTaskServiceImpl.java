package org.lite.ai.service.impl;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.lite.ai.config.AiGatewayProperties;
import org.lite.ai.dto.SuggestionReviewRequest;
import org.lite.ai.entity.Suggestion;
import org.lite.ai.entity.SuggestionTask;
import org.lite.ai.enums.SuggestionReviewStatus;
import org.lite.ai.enums.SuggestionTaskStatus;
import org.lite.ai.exception.TaskCancelledException;
import org.lite.ai.exception.TaskNotFoundException;
import org.lite.ai.executor.SuggestionTaskContext;
import org.lite.ai.executor.SuggestionTaskExecutor;
import org.lite.ai.service.SuggestionTaskService;
import org.lite.ai.store.SuggestionStore;
import org.lite.ai.store.SuggestionTaskStore;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

@Service
@Slf4j
public class SuggestionTaskServiceImpl implements SuggestionTaskService {

    static final String RESTART_MESSAGE = "Task interrupted by gateway restart";
    private static final int RECOVERY_BATCH = 10_000;

    private final SuggestionTaskStore taskStore;
    private final SuggestionStore suggestionStore;
    private final AiGatewayProperties properties;
    private final Clock clock;
    private final Map<String, SuggestionTaskExecutor> executors = new HashMap<>();

    // Track running tasks for cancellation
    private final ConcurrentHashMap<String, AtomicBoolean> cancellationFlags = new ConcurrentHashMap<>();

    private final Sinks.Many<String> queue;
    private Scheduler workerScheduler;
    private Disposable dispatcher;

    public SuggestionTaskServiceImpl(SuggestionTaskStore taskStore,
                                     SuggestionStore suggestionStore,
                                     List<SuggestionTaskExecutor> executors,
                                     AiGatewayProperties properties,
                                     Clock clock) {
        this.taskStore = taskStore;
        this.suggestionStore = suggestionStore;
        this.properties = properties;
        this.clock = clock;
        for (SuggestionTaskExecutor executor : executors) {
            if (this.executors.putIfAbsent(executor.getTaskType(), executor) != null) {
                throw new IllegalStateException("Duplicate executor for task type " + executor.getTaskType());
            }
        }
        this.queue = Sinks.many().unicast()
                .onBackpressureBuffer(new ArrayBlockingQueue<>(Math.max(1, properties.getTasks().getQueueCapacity())));
    }

    @PostConstruct
    public void start() {
        int workers = Math.max(1, properties.getTasks().getWorkerCount());
        workerScheduler = Schedulers.newBoundedElastic(workers, Math.max(1, properties.getTasks().getQueueCapacity()),
                "suggestion-worker");
        dispatcher = queue.asFlux()
                .flatMap(taskId -> runTask(taskId).subscribeOn(workerScheduler), workers)
                .subscribe(
                        null,
                        error -> log.error("❌ Suggestion dispatcher stopped: {}", error.getMessage(), error));
        log.info("🚀 Suggestion workers started (workers: {}, task types: {})", workers, executors.keySet());
    }

    @PreDestroy
    public void stop() {
        if (dispatcher != null) {
            dispatcher.dispose();
        }
        if (workerScheduler != null) {
            workerScheduler.dispose();
        }
    }

    @Override
    public Mono<SuggestionTask> submit(String taskType, Map<String, Object> payload, String requestedBy) {
        return Mono.defer(() -> {
            if (taskType == null || !executors.containsKey(taskType)) {
                return Mono.error(new IllegalArgumentException(
                        "Unknown task type '" + taskType + "', expected one of " + executors.keySet()));
            }
            LocalDateTime now = LocalDateTime.now(clock);
            SuggestionTask task = SuggestionTask.builder()
                    .taskId(UUID.randomUUID().toString())
                    .taskType(taskType)
                    .status(SuggestionTaskStatus.PENDING)
                    .progress(0)
                    .payload(payload == null ? new LinkedHashMap<>() : new LinkedHashMap<>(payload))
                    .requestedBy(requestedBy)
                    .createdAt(now)
                    .updatedAt(now)
                    .build();
            return taskStore.insert(task)
                    .flatMap(saved -> enqueue(saved.getTaskId())
                            ? Mono.just(saved)
                            : taskStore.fail(saved.getTaskId(), "Task queue is full", LocalDateTime.now(clock))
                                    .defaultIfEmpty(saved))
                    .doOnNext(saved -> log.info("📥 Submitted {} task {} ({})", taskType, saved.getTaskId(),
                            saved.getStatus()));
        });
    }

    private boolean enqueue(String taskId) {
        Sinks.EmitResult result;
        // unicast sinks reject concurrent emitters
        synchronized (queue) {
            result = queue.tryEmitNext(taskId);
        }
        if (result.isFailure()) {
            log.error("❌ Could not enqueue task {}: {}", taskId, result);
            return false;
        }
        return true;
    }

    private Mono<Void> runTask(String taskId) {
        AtomicBoolean cancelled = new AtomicBoolean(false);
        return taskStore.markRunning(taskId, LocalDateTime.now(clock))
                .flatMap(task -> {
                    cancellationFlags.put(taskId, cancelled);
                    log.info("Processing {} task {}", task.getTaskType(), taskId);
                    SuggestionTaskExecutor executor = executors.get(task.getTaskType());
                    if (executor == null) {
                        return Mono.error(new IllegalArgumentException("Unknown task type: " + task.getTaskType()));
                    }
                    SuggestionTaskContext context = new SuggestionTaskContext(taskId, cancelled, taskStore);
                    return executor.execute(task, context)
                            .switchIfEmpty(Mono.error(() -> new IllegalStateException("Executor produced no result")))
                            .flatMap(outcome -> context.checkCancelled()
                                    .then(taskStore.complete(taskId, outcome.getResult(), outcome.getKbVersion(),
                                            LocalDateTime.now(clock))));
                })
                .doOnNext(completed -> log.info("✅ Task {} completed (kb_version: {})", taskId, completed.getKbVersion()))
                .switchIfEmpty(Mono.fromRunnable(() -> log.debug("Task {} was not pending or was cancelled, skipping", taskId)))
                .onErrorResume(error -> failTask(taskId, error))
                .doFinally(signal -> cancellationFlags.remove(taskId, cancelled))
                .then()
                .onErrorResume(error -> {
                    log.error("❌ Could not record outcome of task {}: {}", taskId, error.getMessage(), error);
                    return Mono.empty();
                });
    }

    private Mono<SuggestionTask> failTask(String taskId, Throwable error) {
        String message = error instanceof TaskCancelledException
                ? TaskCancelledException.MESSAGE
                : (error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName());
        if (error instanceof TaskCancelledException) {
            log.info("Task {} stopped after cancellation", taskId);
        } else {
            log.error("❌ Task {} failed: {}", taskId, message, error);
        }
        return taskStore.fail(taskId, message, LocalDateTime.now(clock));
    }

    @Override
    public Mono<SuggestionTask> getStatus(String taskId) {
        return taskStore.findByTaskId(taskId)
                .switchIfEmpty(Mono.error(() -> new TaskNotFoundException(taskId)));
    }

    @Override
    public Mono<Boolean> cancel(String taskId) {
        return getStatus(taskId)
                .flatMap(task -> {
                    switch (task.getStatus()) {
                        case PENDING:
                            return taskStore.deleteIfPending(taskId)
                                    .flatMap(deleted -> {
                                        if (deleted) {
                                            log.info("Cancelled pending task {}", taskId);
                                            return Mono.just(true);
                                        }
                                        // picked up by a worker in the meantime
                                        return cancel(taskId);
                                    });
                        case RUNNING:
                            AtomicBoolean flag = cancellationFlags.get(taskId);
                            if (flag != null) {
                                flag.set(true);
                            }
                            return taskStore.fail(taskId, TaskCancelledException.MESSAGE, LocalDateTime.now(clock))
                                    .map(failed -> {
                                        log.info("Cancelled running task {}", taskId);
                                        return true;
                                    })
                                    .defaultIfEmpty(false);
                        default:
                            log.warn("Cannot cancel task {} with status: {}", taskId, task.getStatus());
                            return Mono.just(false);
                    }
                });
    }

    @Override
    public Flux<SuggestionTask> list(SuggestionTaskStatus status, String taskType, int limit) {
        if (limit <= 0) {
            return Flux.error(new IllegalArgumentException("limit must be positive"));
        }
        return taskStore.find(status, taskType, limit);
    }

    @Override
    public Mono<Suggestion> getSuggestion(String taskId) {
        return suggestionStore.findByTaskId(taskId)
                .switchIfEmpty(Mono.error(() -> new TaskNotFoundException(taskId)));
    }

    @Override
    public Mono<Suggestion> review(String taskId, SuggestionReviewRequest request) {
        return Mono.defer(() -> {
            SuggestionReviewStatus target = request.getStatus();
            if (target == null || target == SuggestionReviewStatus.PENDING_REVIEW) {
                return Mono.error(new IllegalArgumentException("Review status must be APPROVED, REJECTED, MODIFIED or APPLIED"));
            }
            if (target == SuggestionReviewStatus.MODIFIED
                    && (request.getModifiedText() == null || request.getModifiedText().isBlank())) {
                return Mono.error(new IllegalArgumentException("modifiedText is required for MODIFIED"));
            }
            Set<SuggestionReviewStatus> from = EnumSet.noneOf(SuggestionReviewStatus.class);
            for (SuggestionReviewStatus status : SuggestionReviewStatus.values()) {
                if (status.allowedNext().contains(target)) {
                    from.add(status);
                }
            }
            return getSuggestion(taskId)
                    .flatMap(current -> suggestionStore.review(taskId, from, target, request.getReviewedBy(),
                                    request.getNote(), request.getModifiedText(), LocalDateTime.now(clock))
                            .switchIfEmpty(Mono.defer(() -> suggestionStore.findByTaskId(taskId)
                                    .flatMap(latest -> Mono.error(new IllegalArgumentException(String.format(
                                            "Cannot move suggestion for task %s from %s to %s",
                                            taskId, latest.getReviewStatus(), target)))))))
                    .doOnNext(reviewed -> log.info("Suggestion for task {} reviewed: {} by {}",
                            taskId, reviewed.getReviewStatus(), reviewed.getReviewedBy()));
        });
    }

    @Override
    public Mono<Integer> recoverTasks() {
        LocalDateTime now = LocalDateTime.now(clock);
        Mono<Long> interrupted = taskStore.find(SuggestionTaskStatus.RUNNING, null, RECOVERY_BATCH)
                // a RUNNING task owned by this process is never recovered
                .filter(task -> !cancellationFlags.containsKey(task.getTaskId()))
                .concatMap(task -> taskStore.fail(task.getTaskId(), RESTART_MESSAGE, now))
                .count();
        Mono<Integer> requeued = taskStore.find(SuggestionTaskStatus.PENDING, null, RECOVERY_BATCH)
                .sort(Comparator.comparing(SuggestionTask::getCreatedAt))
                .filter(task -> enqueue(task.getTaskId()))
                .count()
                .map(Long::intValue);
        return interrupted
                .doOnNext(count -> {
                    if (count > 0) {
                        log.warn("⚠️ Marked {} interrupted tasks as failed", count);
                    }
                })
                .then(requeued);
    }

    @EventListener(ApplicationReadyEvent.class)
    public void recoverOnStartup() {
        recoverTasks().subscribe(
                count -> log.info("✅ Re-enqueued {} pending suggestion tasks", count),
                error -> log.error("❌ Failed to recover suggestion tasks: {}", error.getMessage(), error));
    }
}
