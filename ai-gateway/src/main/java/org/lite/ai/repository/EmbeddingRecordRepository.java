package org.lite.ai.repository;

import org.lite.ai.entity.EmbeddingRecord;
import org.springframework.data.mongodb.repository.ReactiveMongoRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@Repository
public interface EmbeddingRecordRepository extends ReactiveMongoRepository<EmbeddingRecord, String> {

    Flux<EmbeddingRecord> findByKbVersion(String kbVersion);

    Flux<EmbeddingRecord> findByKbVersionAndEntityTypeAndEntityId(String kbVersion, String entityType, String entityId);

    Mono<EmbeddingRecord> findByKbVersionAndEntityTypeAndEntityIdAndContentHash(
            String kbVersion, String entityType, String entityId, String contentHash);

    Mono<Long> countByKbVersion(String kbVersion);

    Mono<Long> countByKbVersionAndActive(String kbVersion, boolean active);
}
