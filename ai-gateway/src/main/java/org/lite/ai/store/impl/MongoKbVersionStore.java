package org.lite.ai.store.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.lite.ai.entity.KbVersion;
import org.lite.ai.enums.KbVersionStatus;
import org.lite.ai.exception.VersionConflictException;
import org.lite.ai.repository.KbVersionRepository;
import org.lite.ai.store.KbVersionStore;
import org.springframework.context.annotation.Profile;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.ReactiveMongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Set;

@Component
@Slf4j
@Profile("!in-memory")
@RequiredArgsConstructor
public class MongoKbVersionStore implements KbVersionStore {

    private final KbVersionRepository kbVersionRepository;
    private final ReactiveMongoTemplate reactiveMongoTemplate;

    @Override
    public Mono<KbVersion> insert(KbVersion version) {
        return reactiveMongoTemplate.insert(version)
                .onErrorMap(DuplicateKeyException.class,
                        e -> new VersionConflictException("Version label '" + version.getVersion() + "' already exists"));
    }

    @Override
    public Mono<KbVersion> findByVersion(String version) {
        return kbVersionRepository.findByVersion(version);
    }

    @Override
    public Flux<KbVersion> findAll(String embeddingModel) {
        return embeddingModel == null
                ? kbVersionRepository.findAll()
                : kbVersionRepository.findByEmbeddingModel(embeddingModel);
    }

    @Override
    public Flux<KbVersion> findByStatus(KbVersionStatus status) {
        return kbVersionRepository.findByStatus(status);
    }

    @Override
    public Mono<KbVersion> findActive(String embeddingModel) {
        return kbVersionRepository.findFirstByEmbeddingModelAndStatus(embeddingModel, KbVersionStatus.ACTIVE);
    }

    @Override
    public Mono<KbVersion> transition(String version, Set<KbVersionStatus> from, KbVersionStatus to, LocalDateTime at) {
        Query query = Query.query(Criteria.where("version").is(version).and("status").in(from));
        Update update = new Update()
                .set("status", to)
                .set("updatedAt", at);
        if (to == KbVersionStatus.ACTIVE) {
            update.set("activatedAt", at).unset("archivedAt");
        } else if (to == KbVersionStatus.ARCHIVED) {
            update.set("archivedAt", at);
        }
        return reactiveMongoTemplate.findAndModify(query, update,
                FindAndModifyOptions.options().returnNew(true), KbVersion.class);
    }

    @Override
    public Mono<KbVersion> updateCounts(String version, long totalEntities, long totalChunks) {
        Query query = Query.query(Criteria.where("version").is(version));
        Update update = new Update()
                .set("totalEntities", totalEntities)
                .set("totalChunks", totalChunks)
                .set("updatedAt", LocalDateTime.now());
        return reactiveMongoTemplate.findAndModify(query, update,
                FindAndModifyOptions.options().returnNew(true), KbVersion.class);
    }

    @Override
    public Mono<KbVersion> addFailedChunks(String version, List<KbVersion.FailedChunk> failedChunks) {
        if (failedChunks.isEmpty()) {
            return findByVersion(version);
        }
        Query query = Query.query(Criteria.where("version").is(version));
        Update update = new Update()
                .push("failedChunks").each(failedChunks.toArray())
                .set("updatedAt", LocalDateTime.now());
        return reactiveMongoTemplate.findAndModify(query, update,
                FindAndModifyOptions.options().returnNew(true), KbVersion.class);
    }
}
