package org.lite.ai.store;

import org.lite.ai.entity.EmbeddingRecord;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Set;

public interface EmbeddingRecordStore {

    /**
     * Stores the record unless one with the same (kbVersion, entityType, entityId, contentHash) exists,
     * in which case the existing record is returned with {@code created = false}.
     */
    Mono<InsertOutcome<EmbeddingRecord>> insertIfAbsent(EmbeddingRecord record);

    Flux<EmbeddingRecord> findByVersion(String kbVersion);

    Flux<EmbeddingRecord> findByVersionAndEntity(String kbVersion, String entityType, String entityId);

    /**
     * Removes the entity's records in the version whose content hash is not in {@code keepHashes};
     * returns the number of records removed.
     */
    Mono<Long> deleteByVersionAndEntityExcept(String kbVersion, String entityType, String entityId, Set<String> keepHashes);

    /**
     * Flips the {@code active} flag of every record in the version; returns the number of records changed.
     */
    Mono<Long> setActive(String kbVersion, boolean active);

    Mono<Long> countByVersion(String kbVersion);

    Mono<Long> countActiveByVersion(String kbVersion);
}
