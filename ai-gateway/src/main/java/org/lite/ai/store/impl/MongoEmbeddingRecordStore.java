package org.lite.ai.store.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.lite.ai.entity.EmbeddingRecord;
import org.lite.ai.repository.EmbeddingRecordRepository;
import org.lite.ai.store.EmbeddingRecordStore;
import org.lite.ai.store.InsertOutcome;
import org.springframework.context.annotation.Profile;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.mongodb.core.ReactiveMongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Set;

/**
 * Relies on the unique (kbVersion, entityType, entityId, contentHash) index: the losing writer of a race
 * gets a duplicate-key error and reads back the winner's record.
 */
@Component
@Slf4j
@Profile("!in-memory")
@RequiredArgsConstructor
public class MongoEmbeddingRecordStore implements EmbeddingRecordStore {

    private final EmbeddingRecordRepository embeddingRecordRepository;
    private final ReactiveMongoTemplate reactiveMongoTemplate;

    @Override
    public Mono<InsertOutcome<EmbeddingRecord>> insertIfAbsent(EmbeddingRecord record) {
        return reactiveMongoTemplate.insert(record)
                .map(saved -> new InsertOutcome<>(saved, true))
                .onErrorResume(DuplicateKeyException.class, e -> {
                    log.debug("Embedding for {}:{} hash {} already stored in version {}",
                            record.getEntityType(), record.getEntityId(), record.getContentHash(), record.getKbVersion());
                    return embeddingRecordRepository.findByKbVersionAndEntityTypeAndEntityIdAndContentHash(
                                    record.getKbVersion(), record.getEntityType(), record.getEntityId(), record.getContentHash())
                            .map(existing -> new InsertOutcome<>(existing, false));
                });
    }

    @Override
    public Flux<EmbeddingRecord> findByVersion(String kbVersion) {
        return embeddingRecordRepository.findByKbVersion(kbVersion);
    }

    @Override
    public Flux<EmbeddingRecord> findByVersionAndEntity(String kbVersion, String entityType, String entityId) {
        return embeddingRecordRepository.findByKbVersionAndEntityTypeAndEntityId(kbVersion, entityType, entityId);
    }

    @Override
    public Mono<Long> deleteByVersionAndEntityExcept(String kbVersion, String entityType, String entityId,
                                                     Set<String> keepHashes) {
        Query query = Query.query(Criteria.where("kbVersion").is(kbVersion)
                .and("entityType").is(entityType)
                .and("entityId").is(entityId)
                .and("contentHash").nin(keepHashes));
        return reactiveMongoTemplate.remove(query, EmbeddingRecord.class)
                .map(result -> result.getDeletedCount());
    }

    @Override
    public Mono<Long> setActive(String kbVersion, boolean active) {
        Query query = Query.query(Criteria.where("kbVersion").is(kbVersion).and("active").is(!active));
        return reactiveMongoTemplate.updateMulti(query, Update.update("active", active), EmbeddingRecord.class)
                .map(result -> result.getModifiedCount());
    }

    @Override
    public Mono<Long> countByVersion(String kbVersion) {
        return embeddingRecordRepository.countByKbVersion(kbVersion);
    }

    @Override
    public Mono<Long> countActiveByVersion(String kbVersion) {
        return embeddingRecordRepository.countByKbVersionAndActive(kbVersion, true);
    }
}
