package org.lite.ai.store;

import org.lite.ai.entity.KbVersion;
import org.lite.ai.enums.KbVersionStatus;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Set;

/**
 * Persistence of knowledge-base versions. Status changes are conditional so concurrent writers
 * cannot both win the same transition.
 */
public interface KbVersionStore {

    /**
     * Inserts a new version; errors with {@link org.lite.ai.exception.VersionConflictException}
     * when the label is already taken.
     */
    Mono<KbVersion> insert(KbVersion version);

    Mono<KbVersion> findByVersion(String version);

    Flux<KbVersion> findAll(String embeddingModel);

    Flux<KbVersion> findByStatus(KbVersionStatus status);

    Mono<KbVersion> findActive(String embeddingModel);

    /**
     * Moves {@code version} to {@code to} only when its current status is one of {@code from}.
     * Completes empty when the condition does not hold.
     */
    Mono<KbVersion> transition(String version, Set<KbVersionStatus> from, KbVersionStatus to, LocalDateTime at);

    Mono<KbVersion> updateCounts(String version, long totalEntities, long totalChunks);

    Mono<KbVersion> addFailedChunks(String version, List<KbVersion.FailedChunk> failedChunks);
}
