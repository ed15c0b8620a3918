package org.lite.ai.store.impl;

import org.lite.ai.entity.EmbeddingRecord;
import org.lite.ai.store.EmbeddingRecordStore;
import org.lite.ai.store.InsertOutcome;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

@Component
@Profile("in-memory")
public class InMemoryEmbeddingRecordStore implements EmbeddingRecordStore {

    // keyed by kbVersion|entityType|entityId|contentHash, the same tuple the Mongo unique index covers
    private final Map<String, EmbeddingRecord> records = new ConcurrentHashMap<>();

    @Override
    public Mono<InsertOutcome<EmbeddingRecord>> insertIfAbsent(EmbeddingRecord record) {
        return Mono.fromSupplier(() -> {
            EmbeddingRecord candidate = record.toBuilder().build();
            if (candidate.getId() == null) {
                candidate.setId(UUID.randomUUID().toString());
            }
            EmbeddingRecord existing = records.putIfAbsent(key(candidate), candidate);
            return existing == null
                    ? new InsertOutcome<>(candidate.toBuilder().build(), true)
                    : new InsertOutcome<>(existing.toBuilder().build(), false);
        });
    }

    @Override
    public Flux<EmbeddingRecord> findByVersion(String kbVersion) {
        return Flux.defer(() -> Flux.fromIterable(new ArrayList<>(records.values())))
                .filter(r -> kbVersion.equals(r.getKbVersion()))
                .sort(Comparator.comparing(EmbeddingRecord::getEntityType)
                        .thenComparing(EmbeddingRecord::getEntityId)
                        .thenComparing(EmbeddingRecord::getChunkIndex))
                .map(r -> r.toBuilder().build());
    }

    @Override
    public Flux<EmbeddingRecord> findByVersionAndEntity(String kbVersion, String entityType, String entityId) {
        return findByVersion(kbVersion)
                .filter(r -> entityType.equals(r.getEntityType()) && entityId.equals(r.getEntityId()));
    }

    @Override
    public Mono<Long> deleteByVersionAndEntityExcept(String kbVersion, String entityType, String entityId,
                                                     Set<String> keepHashes) {
        return Mono.fromSupplier(() -> {
            long removed = 0;
            for (Map.Entry<String, EmbeddingRecord> entry : records.entrySet()) {
                EmbeddingRecord current = entry.getValue();
                if (kbVersion.equals(current.getKbVersion())
                        && entityType.equals(current.getEntityType())
                        && entityId.equals(current.getEntityId())
                        && !keepHashes.contains(current.getContentHash())
                        && records.remove(entry.getKey(), current)) {
                    removed++;
                }
            }
            return removed;
        });
    }

    @Override
    public Mono<Long> setActive(String kbVersion, boolean active) {
        return Mono.fromSupplier(() -> {
            long changed = 0;
            for (Map.Entry<String, EmbeddingRecord> entry : records.entrySet()) {
                EmbeddingRecord current = entry.getValue();
                if (kbVersion.equals(current.getKbVersion()) && current.isActive() != active) {
                    if (records.replace(entry.getKey(), current, current.toBuilder().active(active).build())) {
                        changed++;
                    }
                }
            }
            return changed;
        });
    }

    @Override
    public Mono<Long> countByVersion(String kbVersion) {
        return findByVersion(kbVersion).count();
    }

    @Override
    public Mono<Long> countActiveByVersion(String kbVersion) {
        return findByVersion(kbVersion).filter(EmbeddingRecord::isActive).count();
    }

    private static String key(EmbeddingRecord record) {
        return record.getKbVersion() + "|" + record.getEntityType() + "|" + record.getEntityId() + "|" + record.getContentHash();
    }
}
