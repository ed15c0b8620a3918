package org.lite.ai.executor;

import lombok.Getter;
import org.lite.ai.exception.TaskCancelledException;
import org.lite.ai.store.SuggestionTaskStore;
import reactor.core.publisher.Mono;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Per-run handle given to executors: progress milestones and the cancellation check.
 */
public class SuggestionTaskContext {

    @Getter
    private final String taskId;
    private final AtomicBoolean cancelled;
    private final SuggestionTaskStore taskStore;

    public SuggestionTaskContext(String taskId, AtomicBoolean cancelled, SuggestionTaskStore taskStore) {
        this.taskId = taskId;
        this.cancelled = cancelled;
        this.taskStore = taskStore;
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * Completes empty, or errors with {@link TaskCancelledException} when cancellation was requested.
     */
    public Mono<Void> checkCancelled() {
        return Mono.defer(() -> cancelled.get() ? Mono.error(new TaskCancelledException()) : Mono.empty());
    }

    /**
     * Records a milestone. Values at or below the stored progress are ignored by the store.
     */
    public Mono<Void> reportProgress(int progress, String kbVersion) {
        return checkCancelled()
                .then(taskStore.updateProgress(taskId, progress, kbVersion))
                .then();
    }
}
