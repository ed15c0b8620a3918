package org.lite.ai.repository;

import org.lite.ai.entity.KbVersion;
import org.lite.ai.enums.KbVersionStatus;
import org.springframework.data.mongodb.repository.ReactiveMongoRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@Repository
public interface KbVersionRepository extends ReactiveMongoRepository<KbVersion, String> {

    Mono<KbVersion> findByVersion(String version);

    Flux<KbVersion> findByEmbeddingModel(String embeddingModel);

    Flux<KbVersion> findByStatus(KbVersionStatus status);

    Mono<KbVersion> findFirstByEmbeddingModelAndStatus(String embeddingModel, KbVersionStatus status);
}
