package org.lite.ai.service.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.lite.ai.config.AiGatewayProperties;
import org.lite.ai.dto.CreateKbVersionRequest;
import org.lite.ai.dto.EmbeddingResult;
import org.lite.ai.dto.IngestRequest;
import org.lite.ai.dto.IngestResult;
import org.lite.ai.dto.KbVersionDiff;
import org.lite.ai.dto.KbVersionStats;
import org.lite.ai.dto.SourceDocument;
import org.lite.ai.dto.StaleEmbeddingReport;
import org.lite.ai.entity.EmbeddingRecord;
import org.lite.ai.entity.KbVersion;
import org.lite.ai.enums.KbVersionStatus;
import org.lite.ai.exception.InvalidVersionStateException;
import org.lite.ai.exception.VersionConflictException;
import org.lite.ai.exception.VersionNotFoundException;
import org.lite.ai.service.ActiveCorpus;
import org.lite.ai.service.ActiveCorpusRegistry;
import org.lite.ai.service.ChunkingService;
import org.lite.ai.service.KnowledgeBaseVersionService;
import org.lite.ai.service.ProviderRouterService;
import org.lite.ai.service.SourceDocumentClient;
import org.lite.ai.store.EmbeddingRecordStore;
import org.lite.ai.store.InsertOutcome;
import org.lite.ai.store.KbVersionStore;
import org.lite.ai.util.ContentHashes;
import org.lite.ai.util.VersionLabels;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;

@Service
@Slf4j
@RequiredArgsConstructor
public class KnowledgeBaseVersionServiceImpl implements KnowledgeBaseVersionService {

    private static final int LABEL_ALLOCATION_ATTEMPTS = 3;

    private final KbVersionStore kbVersionStore;
    private final EmbeddingRecordStore embeddingRecordStore;
    private final ChunkingService chunkingService;
    private final ProviderRouterService providerRouterService;
    private final SourceDocumentClient sourceDocumentClient;
    private final ActiveCorpusRegistry activeCorpusRegistry;
    private final AiGatewayProperties properties;
    private final Clock clock;

    // one activation at a time per embedding model family
    private final Map<String, AtomicBoolean> switching = new ConcurrentHashMap<>();

    @Override
    public Mono<KbVersion> beginBuild(CreateKbVersionRequest request) {
        return Mono.defer(() -> buildVersion(request));
    }

    private Mono<KbVersion> buildVersion(CreateKbVersionRequest request) {
        String model = request.getEmbeddingModel() != null && !request.getEmbeddingModel().isBlank()
                ? request.getEmbeddingModel()
                : properties.getKb().getDefaultEmbeddingModel();
        int dim = resolveDimension(model, request.getEmbeddingDim());

        if (request.getVersion() != null) {
            if (request.getVersion().isBlank()) {
                return Mono.error(new IllegalArgumentException("Version label must not be blank"));
            }
            return createVersion(request.getVersion().trim(), model, dim, request);
        }

        // allocate next patch label; a concurrent creator taking the same label makes us pick again
        return Mono.defer(() -> kbVersionStore.findAll(null)
                        .map(KbVersion::getVersion)
                        .collectList()
                        .map(VersionLabels::nextPatch)
                        .flatMap(label -> createVersion(label, model, dim, request)))
                .retryWhen(Retry.max(LABEL_ALLOCATION_ATTEMPTS - 1)
                        .filter(VersionConflictException.class::isInstance)
                        .onRetryExhaustedThrow((retrySpec, signal) -> signal.failure()));
    }

    private Mono<KbVersion> createVersion(String label, String model, int dim, CreateKbVersionRequest request) {
        LocalDateTime now = LocalDateTime.now(clock);
        KbVersion version = KbVersion.builder()
                .version(label)
                .description(request.getDescription())
                .embeddingModel(model)
                .embeddingDim(dim)
                .status(KbVersionStatus.BUILDING)
                .createdBy(request.getCreatedBy())
                .createdAt(now)
                .updatedAt(now)
                .build();
        return kbVersionStore.insert(version)
                .doOnNext(created -> log.info("🚀 Created KB version {} (model: {}, dim: {})",
                        created.getVersion(), created.getEmbeddingModel(), created.getEmbeddingDim()));
    }

    private int resolveDimension(String model, Integer requested) {
        if (requested != null) {
            if (requested <= 0) {
                throw new IllegalArgumentException("embeddingDim must be positive");
            }
            return requested;
        }
        return properties.getProviders().stream()
                .filter(p -> model.equals(p.getEmbeddingModel()) && p.getEmbeddingDim() > 0)
                .map(AiGatewayProperties.Provider::getEmbeddingDim)
                .findFirst()
                .orElse(properties.getKb().getDefaultEmbeddingDim());
    }

    @Override
    public Mono<IngestResult> ingest(String version, IngestRequest request) {
        return requireVersion(version)
                .flatMap(kbVersion -> {
                    if (kbVersion.getStatus() != KbVersionStatus.BUILDING) {
                        return Mono.error(new InvalidVersionStateException(version, kbVersion.getStatus(), "ingest into"));
                    }
                    return resolveDocument(request)
                            .flatMap(document -> ingestDocument(kbVersion, request, document));
                });
    }

    private Mono<SourceDocument> resolveDocument(IngestRequest request) {
        if (request.getText() != null) {
            return Mono.just(SourceDocument.builder()
                    .entityType(request.getEntityType())
                    .entityId(request.getEntityId())
                    .text(request.getText())
                    .updatedAt(request.getSourceUpdatedAt())
                    .build());
        }
        return sourceDocumentClient.fetch(request.getEntityType(), request.getEntityId())
                .map(document -> request.getSourceUpdatedAt() == null
                        ? document
                        : SourceDocument.builder()
                                .entityType(document.getEntityType())
                                .entityId(document.getEntityId())
                                .text(document.getText())
                                .updatedAt(request.getSourceUpdatedAt())
                                .build());
    }

    private Mono<IngestResult> ingestDocument(KbVersion kbVersion, IngestRequest request, SourceDocument document) {
        String version = kbVersion.getVersion();
        AiGatewayProperties.Kb kb = properties.getKb();

        // identical chunks of the same entity collapse to one record
        Map<String, ChunkingService.ChunkResult> uniqueChunks = new LinkedHashMap<>();
        for (ChunkingService.ChunkResult chunk : chunkingService.chunk(document.getText(), kb.getChunkMaxSize(), kb.getChunkOverlap())) {
            uniqueChunks.putIfAbsent(ContentHashes.sha256Hex(chunk.getText()), chunk);
        }

        return embeddingRecordStore.findByVersionAndEntity(version, request.getEntityType(), request.getEntityId())
                .collectList()
                .flatMap(existing -> {
                    List<String> recordIds = new ArrayList<>();
                    Set<String> storedHashes = new HashSet<>();
                    for (EmbeddingRecord record : existing) {
                        if (uniqueChunks.containsKey(record.getContentHash())) {
                            recordIds.add(record.getId());
                        }
                        storedHashes.add(record.getContentHash());
                    }
                    List<PendingChunk> pending = uniqueChunks.entrySet().stream()
                            .filter(entry -> !storedHashes.contains(entry.getKey()))
                            .map(entry -> new PendingChunk(entry.getKey(), entry.getValue()))
                            .collect(Collectors.toList());
                    int alreadyStored = uniqueChunks.size() - pending.size();

                    log.info("Ingesting {}:{} into {}: {} chunks, {} already stored, {} to embed",
                            request.getEntityType(), request.getEntityId(), version,
                            uniqueChunks.size(), alreadyStored, pending.size());

                    return Flux.fromIterable(partition(pending, kb.getEmbedBatchSize()))
                            .flatMap(batch -> embedBatch(kbVersion, batch), Math.max(1, kb.getIngestConcurrency()))
                            .collectList()
                            .flatMap(batches -> {
                                List<EmbeddedChunk> embedded = new ArrayList<>();
                                List<KbVersion.FailedChunk> failures = new ArrayList<>();
                                for (BatchOutcome outcome : batches) {
                                    embedded.addAll(outcome.embedded);
                                    for (Map.Entry<PendingChunk, String> failure : outcome.failures.entrySet()) {
                                        failures.add(toFailedChunk(request, failure.getKey(), failure.getValue()));
                                    }
                                }
                                return storeRecords(kbVersion, request, document, embedded)
                                        .zipWith(removeSuperseded(version, request, uniqueChunks.keySet()))
                                        .flatMap(stored -> {
                                            List<InsertOutcome<EmbeddingRecord>> outcomes = stored.getT1();
                                            int created = 0;
                                            for (InsertOutcome<EmbeddingRecord> outcome : outcomes) {
                                                recordIds.add(outcome.value().getId());
                                                if (outcome.created()) {
                                                    created++;
                                                }
                                            }
                                            IngestResult result = IngestResult.builder()
                                                    .kbVersion(version)
                                                    .entityType(request.getEntityType())
                                                    .entityId(request.getEntityId())
                                                    .totalChunks(uniqueChunks.size())
                                                    .created(created)
                                                    .skipped(uniqueChunks.size() - created - failures.size())
                                                    .failed(failures.size())
                                                    .removed(stored.getT2().intValue())
                                                    .recordIds(recordIds)
                                                    .build();
                                            return recordFailures(version, failures)
                                                    .then(refreshCounts(version))
                                                    .thenReturn(result);
                                        });
                            });
                })
                .doOnNext(result -> log.info("✅ Ingested {}:{} into {} (created: {}, skipped: {}, failed: {}, removed: {})",
                        result.getEntityType(), result.getEntityId(), version,
                        result.getCreated(), result.getSkipped(), result.getFailed(), result.getRemoved()));
    }

    /**
     * Drops the entity's records whose content no longer appears in its text, so a re-ingest replaces
     * the entity instead of adding to it.
     */
    private Mono<Long> removeSuperseded(String version, IngestRequest request, Set<String> currentHashes) {
        return embeddingRecordStore.deleteByVersionAndEntityExcept(version, request.getEntityType(),
                        request.getEntityId(), new HashSet<>(currentHashes))
                .doOnNext(removed -> {
                    if (removed > 0) {
                        log.info("Removed {} superseded chunks of {}:{} from {}",
                                removed, request.getEntityType(), request.getEntityId(), version);
                    }
                });
    }

    /**
     * Embeds a batch in one call; when the batch fails each chunk gets its own call so one bad chunk
     * does not sink its neighbours.
     */
    private Mono<BatchOutcome> embedBatch(KbVersion kbVersion, List<PendingChunk> batch) {
        List<String> texts = batch.stream().map(p -> p.chunk.getText()).collect(Collectors.toList());
        return embed(kbVersion, texts)
                .map(vectors -> {
                    BatchOutcome outcome = new BatchOutcome();
                    for (int i = 0; i < batch.size(); i++) {
                        outcome.embedded.add(new EmbeddedChunk(batch.get(i), vectors.get(i)));
                    }
                    return outcome;
                })
                .onErrorResume(error -> {
                    if (batch.size() == 1) {
                        log.warn("❌ Embedding failed for chunk {} of {}: {}",
                                batch.get(0).chunk.getChunkIndex(), kbVersion.getVersion(), error.getMessage());
                        BatchOutcome outcome = new BatchOutcome();
                        outcome.failures.put(batch.get(0), error.getMessage());
                        return Mono.just(outcome);
                    }
                    log.warn("⚠️ Embedding batch of {} failed for {}, retrying chunk by chunk: {}",
                            batch.size(), kbVersion.getVersion(), error.getMessage());
                    return Flux.fromIterable(batch)
                            .concatMap(single -> embedBatch(kbVersion, List.of(single)))
                            .reduce(new BatchOutcome(), BatchOutcome::merge);
                });
    }

    private Mono<List<List<Double>>> embed(KbVersion kbVersion, List<String> texts) {
        return providerRouterService.embed(texts, kbVersion.getEmbeddingModel())
                .flatMap(result -> validateDimension(kbVersion, result));
    }

    private Mono<List<List<Double>>> validateDimension(KbVersion kbVersion, EmbeddingResult result) {
        for (List<Double> vector : result.getVectors()) {
            if (vector.size() != kbVersion.getEmbeddingDim()) {
                return Mono.error(new IllegalStateException(String.format(
                        "Provider %s returned %d-dimensional vectors, version %s expects %d",
                        result.getProvider(), vector.size(), kbVersion.getVersion(), kbVersion.getEmbeddingDim())));
            }
        }
        return Mono.just(result.getVectors());
    }

    private Mono<List<InsertOutcome<EmbeddingRecord>>> storeRecords(KbVersion kbVersion, IngestRequest request,
                                                                    SourceDocument document, List<EmbeddedChunk> embedded) {
        LocalDateTime now = LocalDateTime.now(clock);
        return Flux.fromIterable(embedded)
                .map(item -> EmbeddingRecord.builder()
                        .kbVersion(kbVersion.getVersion())
                        .entityType(request.getEntityType())
                        .entityId(request.getEntityId())
                        .chunkIndex(item.pending.chunk.getChunkIndex())
                        .chunkOffset(item.pending.chunk.getStartPosition())
                        .text(item.pending.chunk.getText())
                        .contentHash(item.pending.contentHash)
                        .embedding(item.vector)
                        .embeddingModel(kbVersion.getEmbeddingModel())
                        .embeddingDim(kbVersion.getEmbeddingDim())
                        .active(false)
                        .sourceUpdatedAt(document.getUpdatedAt())
                        .metadata(request.getMetadata() == null ? Map.of() : new LinkedHashMap<>(request.getMetadata()))
                        .createdAt(now)
                        .build())
                .concatMap(embeddingRecordStore::insertIfAbsent)
                .collectList();
    }

    private Mono<Void> recordFailures(String version, List<KbVersion.FailedChunk> failures) {
        if (failures.isEmpty()) {
            return Mono.empty();
        }
        log.warn("⚠️ {} chunks excluded from {} after embedding failures", failures.size(), version);
        return kbVersionStore.addFailedChunks(version, failures).then();
    }

    private Mono<KbVersion> refreshCounts(String version) {
        return embeddingRecordStore.findByVersion(version)
                .collectList()
                .flatMap(records -> {
                    long entities = records.stream()
                            .map(r -> entityRef(r.getEntityType(), r.getEntityId()))
                            .distinct()
                            .count();
                    return kbVersionStore.updateCounts(version, entities, records.size());
                })
                .doOnNext(updated -> {
                    if (updated.getStatus() != KbVersionStatus.BUILDING) {
                        log.warn("⚠️ Version {} left BUILDING while ingesting; new records stay out of search until it is activated again",
                                version);
                    }
                });
    }

    private KbVersion.FailedChunk toFailedChunk(IngestRequest request, PendingChunk chunk, String error) {
        return KbVersion.FailedChunk.builder()
                .entityType(request.getEntityType())
                .entityId(request.getEntityId())
                .chunkIndex(chunk.chunk.getChunkIndex())
                .contentHash(chunk.contentHash)
                .error(error)
                .failedAt(LocalDateTime.now(clock))
                .build();
    }

    @Override
    public Mono<KbVersion> activate(String version) {
        return requireVersion(version)
                .flatMap(target -> {
                    if (target.getStatus() == KbVersionStatus.ACTIVE) {
                        return Mono.error(new VersionConflictException("Version '" + version + "' is already active"));
                    }
                    String family = target.getEmbeddingModel();
                    AtomicBoolean flag = switching.computeIfAbsent(family, f -> new AtomicBoolean(false));
                    if (!flag.compareAndSet(false, true)) {
                        return Mono.error(new VersionConflictException(
                                "Another activation for embedding model '" + family + "' is in progress"));
                    }
                    // re-read under the flag: a previous holder may have just activated this version
                    return requireVersion(version)
                            .flatMap(this::switchActive)
                            .doFinally(signal -> flag.set(false));
                });
    }

    private Mono<KbVersion> switchActive(KbVersion target) {
        String version = target.getVersion();
        if (target.getStatus() == KbVersionStatus.ACTIVE) {
            return Mono.error(new VersionConflictException("Version '" + version + "' is already active"));
        }
        String family = target.getEmbeddingModel();
        LocalDateTime now = LocalDateTime.now(clock);
        log.info("🚀 Activating KB version {} for {}", version, family);

        return embeddingRecordStore.findByVersion(version)
                .collectList()
                .flatMap(records -> kbVersionStore.findActive(family)
                        .map(Optional::of)
                        .defaultIfEmpty(Optional.empty())
                        .flatMap(previous -> archivePrevious(previous, now)
                                .then(kbVersionStore.transition(version,
                                        EnumSet.of(KbVersionStatus.BUILDING, KbVersionStatus.ARCHIVED),
                                        KbVersionStatus.ACTIVE, now))
                                .switchIfEmpty(Mono.<KbVersion>error(() -> new VersionConflictException(
                                        "Version '" + version + "' changed state during activation")))
                                .flatMap(activated -> embeddingRecordStore.setActive(version, true)
                                        .onErrorResume(error -> demote(target, now).then(Mono.<Long>error(error)))
                                        .map(changed -> {
                                            activeCorpusRegistry.publish(new ActiveCorpus(version, family,
                                                    activated.getEmbeddingDim(), activated.getActivatedAt(), records));
                                            log.info("✅ KB version {} active for {} ({} records, previous: {})",
                                                    version, family, records.size(),
                                                    previous.map(KbVersion::getVersion).orElse("none"));
                                            return activated;
                                        }))
                                .onErrorResume(error -> restorePrevious(previous, now).then(Mono.<KbVersion>error(error)))));
    }

    /**
     * Puts a version that failed half-way through activation back into the status it had before.
     */
    private Mono<Void> demote(KbVersion target, LocalDateTime now) {
        String version = target.getVersion();
        log.warn("⚠️ Activation of {} failed, returning it to {}", version, target.getStatus());
        return kbVersionStore.transition(version, EnumSet.of(KbVersionStatus.ACTIVE), target.getStatus(), now)
                .flatMap(demoted -> embeddingRecordStore.setActive(version, false))
                .then()
                .onErrorResume(error -> {
                    log.error("❌ Could not return {} to {}: {}", version, target.getStatus(), error.getMessage());
                    return Mono.empty();
                });
    }

    private Mono<Void> archivePrevious(Optional<KbVersion> previous, LocalDateTime now) {
        if (previous.isEmpty()) {
            return Mono.empty();
        }
        String version = previous.get().getVersion();
        return kbVersionStore.transition(version, EnumSet.of(KbVersionStatus.ACTIVE), KbVersionStatus.ARCHIVED, now)
                .flatMap(archived -> embeddingRecordStore.setActive(version, false))
                .doOnNext(changed -> log.info("Archived previously active version {} ({} records deactivated)", version, changed))
                .then();
    }

    private Mono<Void> restorePrevious(Optional<KbVersion> previous, LocalDateTime now) {
        if (previous.isEmpty()) {
            return Mono.empty();
        }
        String version = previous.get().getVersion();
        log.warn("⚠️ Activation aborted, restoring {} as active", version);
        return kbVersionStore.transition(version, EnumSet.of(KbVersionStatus.ARCHIVED), KbVersionStatus.ACTIVE, now)
                .flatMap(restored -> embeddingRecordStore.setActive(version, true))
                .then()
                .onErrorResume(error -> {
                    log.error("❌ Could not restore {} as active: {}", version, error.getMessage());
                    return Mono.empty();
                });
    }

    @Override
    public Mono<KbVersion> archive(String version) {
        return requireVersion(version)
                .flatMap(current -> {
                    switch (current.getStatus()) {
                        case ACTIVE:
                            return Mono.error(new InvalidVersionStateException(version, current.getStatus(), "archive"));
                        case ARCHIVED:
                            return Mono.just(current);
                        default:
                            return kbVersionStore.transition(version, EnumSet.of(KbVersionStatus.BUILDING),
                                            KbVersionStatus.ARCHIVED, LocalDateTime.now(clock))
                                    .doOnNext(archived -> log.info("✅ Archived KB version {}", version))
                                    .switchIfEmpty(Mono.defer(() -> archive(version)));
                    }
                });
    }

    @Override
    public Mono<KbVersion> getVersion(String version) {
        return requireVersion(version);
    }

    @Override
    public Flux<KbVersion> list(String embeddingModel) {
        return kbVersionStore.findAll(embeddingModel)
                .sort((a, b) -> VersionLabels.compare(b.getVersion(), a.getVersion()));
    }

    @Override
    public Mono<KbVersionStats> getStats(String version) {
        return requireVersion(version)
                .flatMap(kbVersion -> embeddingRecordStore.findByVersion(version)
                        .collectList()
                        .map(records -> {
                            Map<String, Set<String>> entitiesByType = new TreeMap<>();
                            long active = 0;
                            for (EmbeddingRecord record : records) {
                                entitiesByType.computeIfAbsent(record.getEntityType(), t -> new HashSet<>())
                                        .add(record.getEntityId());
                                if (record.isActive()) {
                                    active++;
                                }
                            }
                            Map<String, Long> counts = new TreeMap<>();
                            entitiesByType.forEach((type, ids) -> counts.put(type, (long) ids.size()));
                            boolean serving = activeCorpusRegistry.get(kbVersion.getEmbeddingModel())
                                    .map(corpus -> corpus.getKbVersion().equals(version))
                                    .orElse(false);
                            return KbVersionStats.builder()
                                    .version(kbVersion)
                                    .recordCount(records.size())
                                    .activeRecordCount(active)
                                    .entityCount(counts.values().stream().mapToLong(Long::longValue).sum())
                                    .entitiesByType(counts)
                                    .failedChunkCount(kbVersion.getFailedChunks() == null ? 0 : kbVersion.getFailedChunks().size())
                                    .servingSearch(serving)
                                    .build();
                        }));
    }

    @Override
    public Mono<KbVersionDiff> diff(String fromVersion, String toVersion) {
        return Mono.zip(requireVersion(fromVersion).then(contentByEntity(fromVersion)),
                        requireVersion(toVersion).then(contentByEntity(toVersion)))
                .map(tuple -> {
                    Map<String, Set<String>> from = tuple.getT1();
                    Map<String, Set<String>> to = tuple.getT2();
                    Set<String> added = new TreeSet<>();
                    Set<String> removed = new TreeSet<>();
                    Set<String> changed = new TreeSet<>();
                    Set<String> unchanged = new TreeSet<>();
                    for (Map.Entry<String, Set<String>> entry : to.entrySet()) {
                        Set<String> before = from.get(entry.getKey());
                        if (before == null) {
                            added.add(entry.getKey());
                        } else if (before.equals(entry.getValue())) {
                            unchanged.add(entry.getKey());
                        } else {
                            changed.add(entry.getKey());
                        }
                    }
                    for (String entity : from.keySet()) {
                        if (!to.containsKey(entity)) {
                            removed.add(entity);
                        }
                    }
                    return KbVersionDiff.builder()
                            .fromVersion(fromVersion)
                            .toVersion(toVersion)
                            .added(new ArrayList<>(added))
                            .removed(new ArrayList<>(removed))
                            .changed(new ArrayList<>(changed))
                            .unchanged(new ArrayList<>(unchanged))
                            .build();
                });
    }

    @Override
    public Mono<StaleEmbeddingReport> findStaleEmbeddings(String version, LocalDateTime updatedBefore) {
        return requireVersion(version)
                .flatMap(kbVersion -> embeddingRecordStore.findByVersion(version)
                        .filter(record -> isStale(record, updatedBefore))
                        .collectList()
                        .map(records -> {
                            Map<String, StaleEmbeddingReport.StaleEntity> byEntity = new TreeMap<>();
                            for (EmbeddingRecord record : records) {
                                StaleEmbeddingReport.StaleEntity entity = byEntity.computeIfAbsent(
                                        entityRef(record.getEntityType(), record.getEntityId()),
                                        ref -> StaleEmbeddingReport.StaleEntity.builder()
                                                .entityType(record.getEntityType())
                                                .entityId(record.getEntityId())
                                                .sourceUpdatedAt(record.getSourceUpdatedAt())
                                                .build());
                                entity.setChunkCount(entity.getChunkCount() + 1);
                                if (record.getSourceUpdatedAt() == null) {
                                    entity.setSourceUpdatedAt(null);
                                } else if (entity.getSourceUpdatedAt() != null
                                        && record.getSourceUpdatedAt().isBefore(entity.getSourceUpdatedAt())) {
                                    entity.setSourceUpdatedAt(record.getSourceUpdatedAt());
                                }
                            }
                            log.info("Found {} stale entities in {} (updated before: {})",
                                    byEntity.size(), version, updatedBefore);
                            return StaleEmbeddingReport.builder()
                                    .kbVersion(version)
                                    .updatedBefore(updatedBefore)
                                    .staleEntities(new ArrayList<>(byEntity.values()))
                                    .total(byEntity.size())
                                    .build();
                        }));
    }

    private static boolean isStale(EmbeddingRecord record, LocalDateTime updatedBefore) {
        if (record.getContentHash() == null || record.getSourceUpdatedAt() == null) {
            return true;
        }
        return updatedBefore != null && record.getSourceUpdatedAt().isBefore(updatedBefore);
    }

    private Mono<Map<String, Set<String>>> contentByEntity(String version) {
        return embeddingRecordStore.findByVersion(version)
                .collectList()
                .map(records -> {
                    Map<String, Set<String>> hashesByEntity = new TreeMap<>();
                    for (EmbeddingRecord record : records) {
                        hashesByEntity.computeIfAbsent(entityRef(record.getEntityType(), record.getEntityId()),
                                k -> new HashSet<>()).add(record.getContentHash());
                    }
                    return hashesByEntity;
                });
    }

    @Override
    public Mono<Integer> loadActiveCorpora() {
        return kbVersionStore.findByStatus(KbVersionStatus.ACTIVE)
                .concatMap(version -> embeddingRecordStore.findByVersion(version.getVersion())
                        .collectList()
                        .map(records -> activeCorpusRegistry.publish(new ActiveCorpus(version.getVersion(),
                                version.getEmbeddingModel(), version.getEmbeddingDim(), version.getActivatedAt(), records))))
                .count()
                .map(Long::intValue);
    }

    @EventListener(ApplicationReadyEvent.class)
    public void initializeActiveCorpora() {
        log.info("Loading active knowledge-base versions into the search index...");
        loadActiveCorpora()
                .subscribe(
                        count -> log.info("✅ Loaded {} active corpora", count),
                        error -> log.error("❌ Failed to load active corpora: {}", error.getMessage(), error));
    }

    private Mono<KbVersion> requireVersion(String version) {
        return kbVersionStore.findByVersion(version)
                .switchIfEmpty(Mono.error(() -> new VersionNotFoundException(version)));
    }

    private static String entityRef(String entityType, String entityId) {
        return entityType + ":" + entityId;
    }

    private static <T> List<List<T>> partition(List<T> items, int size) {
        int step = Math.max(1, size);
        List<List<T>> batches = new ArrayList<>();
        for (int i = 0; i < items.size(); i += step) {
            batches.add(items.subList(i, Math.min(items.size(), i + step)));
        }
        return batches;
    }

    private static final class PendingChunk {
        private final String contentHash;
        private final ChunkingService.ChunkResult chunk;

        private PendingChunk(String contentHash, ChunkingService.ChunkResult chunk) {
            this.contentHash = contentHash;
            this.chunk = chunk;
        }
    }

    private static final class EmbeddedChunk {
        private final PendingChunk pending;
        private final List<Double> vector;

        private EmbeddedChunk(PendingChunk pending, List<Double> vector) {
            this.pending = pending;
            this.vector = vector;
        }
    }

    private static final class BatchOutcome {
        private final List<EmbeddedChunk> embedded = new ArrayList<>();
        private final Map<PendingChunk, String> failures = new LinkedHashMap<>();

        private BatchOutcome merge(BatchOutcome other) {
            embedded.addAll(other.embedded);
            failures.putAll(other.failures);
            return this;
        }
    }
}
