package service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.lite.ai.config.AiGatewayProperties;
import org.lite.ai.dto.CreateKbVersionRequest;
import org.lite.ai.dto.IngestRequest;
import org.lite.ai.dto.IngestResult;
import org.lite.ai.dto.KbVersionDiff;
import org.lite.ai.dto.SourceDocument;
import org.lite.ai.dto.StaleEmbeddingReport;
import org.lite.ai.entity.EmbeddingRecord;
import org.lite.ai.entity.KbVersion;
import org.lite.ai.enums.KbVersionStatus;
import org.lite.ai.exception.InvalidVersionStateException;
import org.lite.ai.exception.VersionConflictException;
import org.lite.ai.exception.VersionNotFoundException;
import org.lite.ai.provider.LlmProvider;
import org.lite.ai.provider.LocalStubProvider;
import org.lite.ai.provider.ProviderHealthTracker;
import org.lite.ai.service.ActiveCorpusRegistry;
import org.lite.ai.service.ChunkingService;
import org.lite.ai.service.SourceDocumentClient;
import org.lite.ai.service.impl.CostAccountingServiceImpl;
import org.lite.ai.service.impl.KnowledgeBaseVersionServiceImpl;
import org.lite.ai.service.impl.ProviderRouterServiceImpl;
import org.lite.ai.store.impl.InMemoryCostRecordStore;
import org.lite.ai.store.impl.InMemoryEmbeddingRecordStore;
import org.lite.ai.store.impl.InMemoryKbVersionStore;
import org.lite.ai.util.ContentHashes;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Schedulers;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class KnowledgeBaseVersionServiceImplTest {

    private static final String MODEL = "local-stub-embed";

    private AiGatewayProperties properties;
    private InMemoryKbVersionStore kbVersionStore;
    private InMemoryEmbeddingRecordStore embeddingRecordStore;
    private ActiveCorpusRegistry registry;
    private AtomicInteger sourceFetches;
    private KnowledgeBaseVersionServiceImpl service;

    @BeforeEach
    void setUp() {
        properties = new AiGatewayProperties();
        properties.getRouter().setInitialBackoff(Duration.ofMillis(1));
        properties.getRouter().setMaxBackoff(Duration.ofMillis(5));
        AiGatewayProperties.Provider local = new AiGatewayProperties.Provider();
        local.setName("local");
        local.setType("local-stub");
        local.setEmbeddingModel(MODEL);
        local.setEmbeddingDim(16);
        properties.getProviders().add(local);
        properties.getKb().setChunkMaxSize(60);
        properties.getKb().setChunkOverlap(0);

        sourceFetches = new AtomicInteger();
        SourceDocumentClient sourceDocuments = (entityType, entityId) -> {
            sourceFetches.incrementAndGet();
            return Mono.just(SourceDocument.builder()
                    .entityType(entityType)
                    .entityId(entityId)
                    .text("Fetched body of " + entityId + ".")
                    .updatedAt(LocalDateTime.of(2024, 3, 1, 12, 0))
                    .build());
        };
        service = newService(List.of(new LocalStubProvider(local)), sourceDocuments);
    }

    private KnowledgeBaseVersionServiceImpl newService(List<LlmProvider> providers, SourceDocumentClient sourceDocuments) {
        return newService(providers, sourceDocuments, new InMemoryKbVersionStore(), new InMemoryEmbeddingRecordStore());
    }

    private KnowledgeBaseVersionServiceImpl newService(List<LlmProvider> providers, SourceDocumentClient sourceDocuments,
                                                       InMemoryKbVersionStore versions, InMemoryEmbeddingRecordStore records) {
        kbVersionStore = versions;
        embeddingRecordStore = records;
        registry = new ActiveCorpusRegistry();
        ProviderRouterServiceImpl router = new ProviderRouterServiceImpl(providers,
                new ProviderHealthTracker(properties, Clock.systemUTC()),
                new CostAccountingServiceImpl(new InMemoryCostRecordStore()), properties);
        return new KnowledgeBaseVersionServiceImpl(kbVersionStore, embeddingRecordStore, new ChunkingService(),
                router, sourceDocuments, registry, properties, Clock.systemUTC());
    }

    private KbVersion build(String label) {
        return service.beginBuild(CreateKbVersionRequest.builder().version(label).build()).block();
    }

    private IngestResult ingest(String version, String entityId, String text) {
        return service.ingest(version, IngestRequest.builder()
                .entityType("requirement")
                .entityId(entityId)
                .text(text)
                .build()).block();
    }

    @Test
    void testBeginBuildAllocatesNextPatchLabel() {
        // Given
        build("2.0.9");

        // When
        KbVersion created = service.beginBuild(new CreateKbVersionRequest()).block();

        // Then
        assertNotNull(created);
        assertEquals("2.0.10", created.getVersion());
        assertEquals(KbVersionStatus.BUILDING, created.getStatus());
        assertEquals(MODEL, created.getEmbeddingModel());
        assertEquals(16, created.getEmbeddingDim());
    }

    @Test
    void testBeginBuildRejectsDuplicateLabel() {
        build("1.0.0");
        StepVerifier.create(service.beginBuild(CreateKbVersionRequest.builder().version("1.0.0").build()))
                .expectError(VersionConflictException.class)
                .verify();
    }

    @Test
    void testReingestingUnchangedContentCreatesNothing() {
        // Given
        build("1.0.0");
        String text = "Users can reset their password.\n\nReset links expire after one hour.";

        // When
        IngestResult first = ingest("1.0.0", "REQ-1", text);
        IngestResult second = ingest("1.0.0", "REQ-1", text);

        // Then
        assertEquals(2, first.getTotalChunks());
        assertEquals(2, first.getCreated());
        assertEquals(0, second.getCreated());
        assertEquals(2, second.getSkipped());
        assertEquals(first.getRecordIds().size(), second.getRecordIds().size());
        assertTrue(second.getRecordIds().containsAll(first.getRecordIds()));
        assertEquals(2L, embeddingRecordStore.countByVersion("1.0.0").block());

        KbVersion version = service.getVersion("1.0.0").block();
        assertEquals(1, version.getTotalEntities());
        assertEquals(2, version.getTotalChunks());
    }

    @Test
    void testIngestFetchesSourceWhenTextIsAbsent() {
        // Given
        build("1.0.0");

        // When
        IngestResult result = service.ingest("1.0.0", IngestRequest.builder()
                .entityType("requirement")
                .entityId("REQ-7")
                .build()).block();

        // Then
        assertEquals(1, sourceFetches.get());
        assertEquals(1, result.getCreated());
        EmbeddingRecord record = embeddingRecordStore.findByVersion("1.0.0").blockFirst();
        assertEquals("Fetched body of REQ-7.", record.getText());
        assertEquals(LocalDateTime.of(2024, 3, 1, 12, 0), record.getSourceUpdatedAt());
        assertFalse(record.isActive(), "Records of a building version are not active");
    }

    @Test
    void testIngestIntoActiveVersionIsRejected() {
        build("1.0.0");
        ingest("1.0.0", "REQ-1", "Some text.");
        service.activate("1.0.0").block();

        StepVerifier.create(service.ingest("1.0.0", IngestRequest.builder()
                        .entityType("requirement").entityId("REQ-2").text("More text.").build()))
                .expectError(InvalidVersionStateException.class)
                .verify();
    }

    @Test
    void testIngestIntoUnknownVersionFails() {
        StepVerifier.create(service.ingest("9.9.9", IngestRequest.builder()
                        .entityType("requirement").entityId("REQ-2").text("More text.").build()))
                .expectError(VersionNotFoundException.class)
                .verify();
    }

    @Test
    void testFailedChunksAreRecordedAndExcluded() {
        // Given
        ScriptedProvider flaky = new ScriptedProvider("flaky", 1, 4)
                .alwaysEmbed(texts -> texts.stream().anyMatch(t -> t.contains("poison"))
                        ? Mono.error(new IllegalStateException("upstream rejected input"))
                        : Mono.just(ScriptedProvider.vectors(texts.size(), 4)));
        properties.getKb().setChunkMaxSize(30);
        service = newService(List.of(flaky), (type, id) -> Mono.empty());
        service.beginBuild(CreateKbVersionRequest.builder().version("1.0.0").embeddingModel("test-embed").embeddingDim(4).build())
                .block();

        // When
        IngestResult result = ingest("1.0.0", "REQ-3", "A perfectly good paragraph.\n\nThis paragraph is poison.");

        // Then
        assertEquals(2, result.getTotalChunks());
        assertEquals(1, result.getCreated());
        assertEquals(1, result.getFailed());
        KbVersion version = service.getVersion("1.0.0").block();
        assertEquals(1, version.getFailedChunks().size());
        assertEquals("REQ-3", version.getFailedChunks().get(0).getEntityId());
        assertEquals(1L, embeddingRecordStore.countByVersion("1.0.0").block());
    }

    @Test
    void testActivateArchivesPreviousAndPublishesCorpus() {
        // Given
        build("1.0.0");
        ingest("1.0.0", "REQ-1", "Version one text.");
        build("1.1.0");
        ingest("1.1.0", "REQ-1", "Version two text.");
        service.activate("1.0.0").block();

        // When
        KbVersion activated = service.activate("1.1.0").block();

        // Then
        assertEquals(KbVersionStatus.ACTIVE, activated.getStatus());
        assertNotNull(activated.getActivatedAt());
        assertEquals(KbVersionStatus.ARCHIVED, service.getVersion("1.0.0").block().getStatus());
        assertEquals("1.1.0", registry.get(MODEL).orElseThrow().getKbVersion());
        assertEquals(1L, embeddingRecordStore.countActiveByVersion("1.1.0").block());
        assertEquals(0L, embeddingRecordStore.countActiveByVersion("1.0.0").block());
        assertEquals(1L, kbVersionStore.findAll(MODEL)
                .filter(v -> v.getStatus() == KbVersionStatus.ACTIVE).count().block());
    }

    @Test
    void testActivatingActiveVersionConflicts() {
        build("1.0.0");
        service.activate("1.0.0").block();

        StepVerifier.create(service.activate("1.0.0"))
                .expectError(VersionConflictException.class)
                .verify();
    }

    @Test
    void testArchivingActiveVersionIsRejected() {
        build("1.0.0");
        service.activate("1.0.0").block();

        StepVerifier.create(service.archive("1.0.0"))
                .expectError(InvalidVersionStateException.class)
                .verify();
        assertEquals(KbVersionStatus.ACTIVE, service.getVersion("1.0.0").block().getStatus());
    }

    @Test
    void testArchiveBuildingVersionIsIdempotent() {
        build("1.0.0");

        KbVersion archived = service.archive("1.0.0").block();
        KbVersion again = service.archive("1.0.0").block();

        assertEquals(KbVersionStatus.ARCHIVED, archived.getStatus());
        assertEquals(KbVersionStatus.ARCHIVED, again.getStatus());
        assertTrue(registry.get(MODEL).isEmpty());
    }

    @Test
    void testRollbackReactivatesArchivedVersion() {
        // Given
        build("1.0.0");
        ingest("1.0.0", "REQ-1", "Old wording.");
        build("1.1.0");
        ingest("1.1.0", "REQ-1", "New wording.");
        service.activate("1.0.0").block();
        service.activate("1.1.0").block();

        // When
        KbVersion rolledBack = service.activate("1.0.0").block();

        // Then
        assertEquals(KbVersionStatus.ACTIVE, rolledBack.getStatus());
        assertEquals(KbVersionStatus.ARCHIVED, service.getVersion("1.1.0").block().getStatus());
        assertEquals("1.0.0", registry.get(MODEL).orElseThrow().getKbVersion());
        assertEquals("Old wording.", registry.get(MODEL).orElseThrow().getEntries().get(0).getRecord().getText());
    }

    @Test
    void testConcurrentActivationsLeaveExactlyOneActiveVersion() throws Exception {
        // Given
        Sinks.Empty<Void> gate = Sinks.empty();
        InMemoryKbVersionStore gated = new InMemoryKbVersionStore() {
            @Override
            public Mono<KbVersion> transition(String version, Set<KbVersionStatus> from, KbVersionStatus to, LocalDateTime at) {
                Mono<KbVersion> transition = super.transition(version, from, to, at);
                return to == KbVersionStatus.ACTIVE ? gate.asMono().then(transition) : transition;
            }
        };
        service = newService(List.of(new LocalStubProvider(properties.getProviders().get(0))),
                (type, id) -> Mono.empty(), gated, new InMemoryEmbeddingRecordStore());
        for (int i = 0; i < 5; i++) {
            build("1.0." + i);
            ingest("1.0." + i, "REQ-1", "Text of build " + i + ".");
        }
        CountDownLatch rejected = new CountDownLatch(4);

        // When
        CompletableFuture<List<Object>> outcomes = Flux.range(0, 5)
                .flatMap(i -> service.activate("1.0." + i)
                        .subscribeOn(Schedulers.parallel())
                        .<Object>map(v -> v)
                        .onErrorResume(VersionConflictException.class, e -> {
                            rejected.countDown();
                            return Mono.just(e);
                        }))
                .collectList()
                .toFuture();
        assertTrue(rejected.await(5, TimeUnit.SECONDS), "Activations overlapping the held one are rejected");
        gate.tryEmitEmpty();

        // Then
        List<Object> results = outcomes.get(10, TimeUnit.SECONDS);
        assertEquals(1, results.stream().filter(KbVersion.class::isInstance).count());
        assertEquals(4, results.stream().filter(VersionConflictException.class::isInstance).count());
        List<KbVersion> active = kbVersionStore.findAll(MODEL)
                .filter(v -> v.getStatus() == KbVersionStatus.ACTIVE)
                .collectList()
                .block();
        assertEquals(1, active.size());
        KbVersion winner = (KbVersion) results.stream().filter(KbVersion.class::isInstance).findFirst().orElseThrow();
        assertEquals(winner.getVersion(), active.get(0).getVersion());
        assertEquals(winner.getVersion(), registry.get(MODEL).orElseThrow().getKbVersion());
    }

    @Test
    void testFailedRecordActivationRestoresPreviousVersion() {
        // Given
        InMemoryEmbeddingRecordStore failing = new InMemoryEmbeddingRecordStore() {
            @Override
            public Mono<Long> setActive(String kbVersion, boolean active) {
                if ("1.1.0".equals(kbVersion) && active) {
                    return Mono.error(new IllegalStateException("write concern timeout"));
                }
                return super.setActive(kbVersion, active);
            }
        };
        service = newService(List.of(new LocalStubProvider(properties.getProviders().get(0))),
                (type, id) -> Mono.empty(), new InMemoryKbVersionStore(), failing);
        build("1.0.0");
        ingest("1.0.0", "REQ-1", "Serving text.");
        service.activate("1.0.0").block();
        build("1.1.0");
        ingest("1.1.0", "REQ-1", "Replacement text.");

        // When
        StepVerifier.create(service.activate("1.1.0"))
                .expectErrorMessage("write concern timeout")
                .verify();

        // Then
        assertEquals(KbVersionStatus.ACTIVE, service.getVersion("1.0.0").block().getStatus());
        assertEquals(KbVersionStatus.BUILDING, service.getVersion("1.1.0").block().getStatus());
        assertEquals(1L, embeddingRecordStore.countActiveByVersion("1.0.0").block());
        assertEquals(0L, embeddingRecordStore.countActiveByVersion("1.1.0").block());
        assertEquals("1.0.0", registry.get(MODEL).orElseThrow().getKbVersion());

        IngestResult more = ingest("1.1.0", "REQ-2", "Still building.");
        assertEquals(1, more.getCreated());
    }

    @Test
    void testReingestWithChangedTextReplacesEntityChunks() {
        // Given
        build("1.0.0");
        ingest("1.0.0", "REQ-1", "Users can reset their password.\n\nReset links expire after one hour.");
        ingest("1.0.0", "REQ-2", "Unrelated requirement.");

        // When
        IngestResult result = ingest("1.0.0", "REQ-1",
                "Users can reset their password.\n\nReset links expire after ten minutes.");
        service.activate("1.0.0").block();

        // Then
        assertEquals(1, result.getCreated());
        assertEquals(1, result.getSkipped());
        assertEquals(1, result.getRemoved());
        List<String> texts = registry.get(MODEL).orElseThrow().getEntries().stream()
                .map(entry -> entry.getRecord())
                .filter(record -> "REQ-1".equals(record.getEntityId()))
                .map(EmbeddingRecord::getText)
                .sorted()
                .collect(Collectors.toList());
        assertEquals(List.of("Reset links expire after ten minutes.", "Users can reset their password."), texts);
        KbVersion version = service.getVersion("1.0.0").block();
        assertEquals(2, version.getTotalEntities());
        assertEquals(3, version.getTotalChunks());
    }

    @Test
    void testConcurrentIngestOfSameContentStoresOneRecord() throws Exception {
        // Given
        CountDownLatch bothEmbedding = new CountDownLatch(2);
        Sinks.Empty<Void> release = Sinks.empty();
        ScriptedProvider slow = new ScriptedProvider("slow", 1, 4)
                .alwaysEmbed(texts -> {
                    bothEmbedding.countDown();
                    return release.asMono().then(Mono.just(ScriptedProvider.vectors(texts.size(), 4)));
                });
        service = newService(List.of(slow), (type, id) -> Mono.empty());
        service.beginBuild(CreateKbVersionRequest.builder().version("1.0.0").embeddingModel("test-embed").embeddingDim(4).build())
                .block();
        IngestRequest request = IngestRequest.builder()
                .entityType("requirement")
                .entityId("REQ-9")
                .text("Session tokens rotate every hour.")
                .build();

        // When
        CompletableFuture<IngestResult> first = service.ingest("1.0.0", request).subscribeOn(Schedulers.parallel()).toFuture();
        CompletableFuture<IngestResult> second = service.ingest("1.0.0", request).subscribeOn(Schedulers.parallel()).toFuture();
        assertTrue(bothEmbedding.await(5, TimeUnit.SECONDS), "Both calls embed before either stores");
        release.tryEmitEmpty();

        // Then
        IngestResult a = first.get(5, TimeUnit.SECONDS);
        IngestResult b = second.get(5, TimeUnit.SECONDS);
        assertEquals(1, a.getCreated() + b.getCreated());
        assertEquals(a.getRecordIds(), b.getRecordIds());
        List<EmbeddingRecord> records = embeddingRecordStore.findByVersion("1.0.0").collectList().block();
        assertEquals(1, records.size());
        assertEquals(ContentHashes.sha256Hex("Session tokens rotate every hour."), records.get(0).getContentHash());
        assertEquals(1, service.getVersion("1.0.0").block().getTotalChunks());
    }

    @Test
    void testDiffReportsAddedRemovedChangedAndUnchanged() {
        // Given
        build("1.0.0");
        ingest("1.0.0", "REQ-1", "Stays the same.");
        ingest("1.0.0", "REQ-2", "Original text.");
        ingest("1.0.0", "REQ-3", "Dropped later.");
        build("1.1.0");
        ingest("1.1.0", "REQ-1", "Stays the same.");
        ingest("1.1.0", "REQ-2", "Edited text.");
        ingest("1.1.0", "REQ-4", "Brand new.");

        // When
        KbVersionDiff diff = service.diff("1.0.0", "1.1.0").block();

        // Then
        assertEquals(List.of("requirement:REQ-4"), diff.getAdded());
        assertEquals(List.of("requirement:REQ-3"), diff.getRemoved());
        assertEquals(List.of("requirement:REQ-2"), diff.getChanged());
        assertEquals(List.of("requirement:REQ-1"), diff.getUnchanged());
    }

    @Test
    void testStaleEmbeddingsReportOldAndUndatedSources() {
        // Given
        build("1.0.0");
        service.ingest("1.0.0", IngestRequest.builder().entityType("requirement").entityId("REQ-1")
                .text("Written long ago.").sourceUpdatedAt(LocalDateTime.of(2024, 1, 10, 9, 0)).build()).block();
        service.ingest("1.0.0", IngestRequest.builder().entityType("requirement").entityId("REQ-2")
                .text("Recently edited.").sourceUpdatedAt(LocalDateTime.of(2024, 6, 1, 9, 0)).build()).block();
        ingest("1.0.0", "REQ-3", "No source timestamp.");

        // When
        StaleEmbeddingReport undated = service.findStaleEmbeddings("1.0.0", null).block();
        StaleEmbeddingReport old = service.findStaleEmbeddings("1.0.0", LocalDateTime.of(2024, 3, 1, 0, 0)).block();

        // Then
        assertEquals(1, undated.getTotal());
        assertEquals("REQ-3", undated.getStaleEntities().get(0).getEntityId());
        assertNull(undated.getStaleEntities().get(0).getSourceUpdatedAt());

        assertEquals(2, old.getTotal());
        assertEquals(List.of("REQ-1", "REQ-3"), old.getStaleEntities().stream()
                .map(StaleEmbeddingReport.StaleEntity::getEntityId)
                .collect(Collectors.toList()));
        assertEquals(LocalDateTime.of(2024, 1, 10, 9, 0), old.getStaleEntities().get(0).getSourceUpdatedAt());
        assertEquals(1, old.getStaleEntities().get(0).getChunkCount());
    }

    @Test
    void testStaleEmbeddingsOfUnknownVersionFails() {
        StepVerifier.create(service.findStaleEmbeddings("9.9.9", null))
                .expectError(VersionNotFoundException.class)
                .verify();
    }

    @Test
    void testListIsNewestFirst() {
        build("1.0.0");
        build("1.10.0");
        build("1.2.0");

        List<String> labels = service.list(MODEL).map(KbVersion::getVersion).collectList().block();

        assertEquals(List.of("1.10.0", "1.2.0", "1.0.0"), labels);
    }

    @Test
    void testLoadActiveCorporaRestoresSearchPointer() {
        // Given
        build("1.0.0");
        ingest("1.0.0", "REQ-1", "Persisted active text.");
        service.activate("1.0.0").block();
        ActiveCorpusRegistry fresh = new ActiveCorpusRegistry();
        KnowledgeBaseVersionServiceImpl restarted = new KnowledgeBaseVersionServiceImpl(kbVersionStore,
                embeddingRecordStore, new ChunkingService(), null, null, fresh, properties, Clock.systemUTC());

        // When
        Integer loaded = restarted.loadActiveCorpora().block();

        // Then
        assertEquals(1, loaded);
        assertEquals("1.0.0", fresh.get(MODEL).orElseThrow().getKbVersion());
        assertEquals(1, fresh.get(MODEL).orElseThrow().size());
    }
}
