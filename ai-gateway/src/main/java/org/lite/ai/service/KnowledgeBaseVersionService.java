package org.lite.ai.service;

import org.lite.ai.dto.CreateKbVersionRequest;
import org.lite.ai.dto.IngestRequest;
import org.lite.ai.dto.IngestResult;
import org.lite.ai.dto.KbVersionDiff;
import org.lite.ai.dto.KbVersionStats;
import org.lite.ai.dto.StaleEmbeddingReport;
import org.lite.ai.entity.KbVersion;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;

/**
 * Lifecycle of knowledge-base versions: build, ingest, activate, archive. Activation is the only way a
 * version becomes searchable and is never implicit.
 */
public interface KnowledgeBaseVersionService {

    /**
     * Creates a BUILDING version. The label is allocated (next patch) when the request carries none.
     */
    Mono<KbVersion> beginBuild(CreateKbVersionRequest request);

    /**
     * Chunks, embeds and stores one source entity into a BUILDING version. Re-ingesting unchanged content
     * creates nothing.
     */
    Mono<IngestResult> ingest(String version, IngestRequest request);

    /**
     * Makes {@code version} the single ACTIVE version of its embedding model, archiving the previous one.
     * Works from BUILDING and from ARCHIVED (rollback).
     */
    Mono<KbVersion> activate(String version);

    Mono<KbVersion> archive(String version);

    Mono<KbVersion> getVersion(String version);

    Flux<KbVersion> list(String embeddingModel);

    Mono<KbVersionStats> getStats(String version);

    Mono<KbVersionDiff> diff(String fromVersion, String toVersion);

    /**
     * Entities in {@code version} that need re-ingesting. Without {@code updatedBefore} only records with no
     * content hash or no source timestamp are reported.
     */
    Mono<StaleEmbeddingReport> findStaleEmbeddings(String version, LocalDateTime updatedBefore);

    /**
     * Rebuilds the in-process search snapshots from the ACTIVE versions in the store.
     * @return number of corpora published
     */
    Mono<Integer> loadActiveCorpora();
}
