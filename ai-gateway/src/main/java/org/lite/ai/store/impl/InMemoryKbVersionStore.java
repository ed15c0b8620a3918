package org.lite.ai.store.impl;

import lombok.extern.slf4j.Slf4j;
import org.lite.ai.entity.KbVersion;
import org.lite.ai.enums.KbVersionStatus;
import org.lite.ai.exception.VersionConflictException;
import org.lite.ai.store.KbVersionStore;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

@Component
@Slf4j
@Profile("in-memory")
public class InMemoryKbVersionStore implements KbVersionStore {

    private final Map<String, KbVersion> versions = new ConcurrentHashMap<>();

    @Override
    public Mono<KbVersion> insert(KbVersion version) {
        return Mono.defer(() -> {
            KbVersion stored = copy(version);
            if (stored.getId() == null) {
                stored.setId(UUID.randomUUID().toString());
            }
            KbVersion previous = versions.putIfAbsent(stored.getVersion(), stored);
            if (previous != null) {
                return Mono.error(new VersionConflictException("Version label '" + version.getVersion() + "' already exists"));
            }
            return Mono.just(copy(stored));
        });
    }

    @Override
    public Mono<KbVersion> findByVersion(String version) {
        return Mono.fromSupplier(() -> {
            KbVersion found = versions.get(version);
            return found == null ? null : copy(found);
        });
    }

    @Override
    public Flux<KbVersion> findAll(String embeddingModel) {
        return Flux.defer(() -> Flux.fromIterable(new ArrayList<>(versions.values())))
                .filter(v -> embeddingModel == null || embeddingModel.equals(v.getEmbeddingModel()))
                .map(this::copy);
    }

    @Override
    public Flux<KbVersion> findByStatus(KbVersionStatus status) {
        return findAll(null).filter(v -> v.getStatus() == status);
    }

    @Override
    public Mono<KbVersion> findActive(String embeddingModel) {
        return findAll(embeddingModel).filter(v -> v.getStatus() == KbVersionStatus.ACTIVE).next();
    }

    @Override
    public Mono<KbVersion> transition(String version, Set<KbVersionStatus> from, KbVersionStatus to, LocalDateTime at) {
        return Mono.fromSupplier(() -> {
            KbVersion[] changed = new KbVersion[1];
            versions.computeIfPresent(version, (key, current) -> {
                if (!from.contains(current.getStatus())) {
                    return current;
                }
                KbVersion next = copy(current);
                next.setStatus(to);
                next.setUpdatedAt(at);
                if (to == KbVersionStatus.ACTIVE) {
                    next.setActivatedAt(at);
                    next.setArchivedAt(null);
                } else if (to == KbVersionStatus.ARCHIVED) {
                    next.setArchivedAt(at);
                }
                changed[0] = next;
                return next;
            });
            return changed[0] == null ? null : copy(changed[0]);
        });
    }

    @Override
    public Mono<KbVersion> updateCounts(String version, long totalEntities, long totalChunks) {
        return Mono.fromSupplier(() -> {
            KbVersion updated = versions.computeIfPresent(version, (key, current) -> {
                KbVersion next = copy(current);
                next.setTotalEntities(totalEntities);
                next.setTotalChunks(totalChunks);
                next.setUpdatedAt(LocalDateTime.now());
                return next;
            });
            return updated == null ? null : copy(updated);
        });
    }

    @Override
    public Mono<KbVersion> addFailedChunks(String version, List<KbVersion.FailedChunk> failedChunks) {
        return Mono.fromSupplier(() -> {
            KbVersion updated = versions.computeIfPresent(version, (key, current) -> {
                KbVersion next = copy(current);
                next.getFailedChunks().addAll(failedChunks);
                next.setUpdatedAt(LocalDateTime.now());
                return next;
            });
            return updated == null ? null : copy(updated);
        });
    }

    private KbVersion copy(KbVersion source) {
        return source.toBuilder()
                .failedChunks(source.getFailedChunks() == null
                        ? new ArrayList<>() : new ArrayList<>(source.getFailedChunks()))
                .build();
    }
}
