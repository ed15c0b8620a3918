package service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.lite.ai.config.AiGatewayProperties;
import org.lite.ai.dto.EmbeddingResult;
import org.lite.ai.dto.SearchHit;
import org.lite.ai.dto.SearchRequest;
import org.lite.ai.dto.SearchResponse;
import org.lite.ai.entity.EmbeddingRecord;
import org.lite.ai.exception.NoActiveVersionException;
import org.lite.ai.service.ActiveCorpus;
import org.lite.ai.service.ActiveCorpusRegistry;
import org.lite.ai.service.ProviderRouterService;
import org.lite.ai.service.impl.HybridSearchServiceImpl;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class HybridSearchServiceImplTest {

    private static final String MODEL = "local-stub-embed";

    @Mock
    private ProviderRouterService providerRouterService;

    private ActiveCorpusRegistry registry;
    private HybridSearchServiceImpl searchService;

    @BeforeEach
    void setUp() {
        registry = new ActiveCorpusRegistry();
        searchService = new HybridSearchServiceImpl(registry, providerRouterService, new AiGatewayProperties());
    }

    private static EmbeddingRecord record(String id, String type, String text, List<Double> vector,
                                          LocalDateTime sourceUpdatedAt, Map<String, String> metadata) {
        return EmbeddingRecord.builder()
                .id(id)
                .kbVersion("2.1.0")
                .entityType(type)
                .entityId(id.toUpperCase())
                .chunkIndex(0)
                .text(text)
                .contentHash(id)
                .embedding(vector)
                .embeddingModel(MODEL)
                .embeddingDim(vector.size())
                .sourceUpdatedAt(sourceUpdatedAt)
                .metadata(metadata)
                .build();
    }

    private void publish(String version, List<EmbeddingRecord> records) {
        registry.publish(new ActiveCorpus(version, MODEL, 3, LocalDateTime.now(), records));
    }

    private void queryVector(List<Double> vector) {
        when(providerRouterService.embed(anyList(), eq(MODEL))).thenReturn(Mono.just(EmbeddingResult.builder()
                .vectors(List.of(vector))
                .provider("local")
                .model(MODEL)
                .dim(vector.size())
                .build()));
    }

    private static SearchRequest query(String text, int k) {
        return SearchRequest.builder().query(text).k(k).build();
    }

    @Test
    void testSearchRanksByBlendedScore() {
        // Given
        publish("2.1.0", List.of(
                record("r1", "requirement", "Password reset via email link", List.of(1.0, 0.0, 0.0), null, Map.of()),
                record("r2", "requirement", "Export audit report as CSV", List.of(0.0, 1.0, 0.0), null, Map.of())));
        queryVector(List.of(1.0, 0.0, 0.0));

        // When
        SearchResponse response = searchService.search(query("password reset", 10)).block();

        // Then
        assertEquals("2.1.0", response.getKbVersion());
        assertEquals(MODEL, response.getEmbeddingModel());
        assertEquals(2, response.getHits().size());
        SearchHit top = response.getHits().get(0);
        assertEquals("r1", top.getRecord().getId());
        assertEquals(1.0, top.getVectorScore(), 1e-9);
        assertEquals(1.0, top.getLexicalScore(), 1e-9);
        assertEquals(1.0, top.getScore(), 1e-9);
        SearchHit second = response.getHits().get(1);
        assertEquals(0.5, second.getVectorScore(), 1e-9);
        assertEquals(0.0, second.getLexicalScore(), 1e-9);
        assertEquals(0.35, second.getScore(), 1e-9);
    }

    @Test
    void testTiesGoToMoreRecentlyUpdatedSource() {
        // Given
        List<Double> vector = List.of(0.0, 0.0, 1.0);
        publish("2.1.0", List.of(
                record("old", "requirement", "Same text", vector, LocalDateTime.of(2023, 1, 1, 0, 0), Map.of()),
                record("undated", "requirement", "Same text", vector, null, Map.of()),
                record("new", "requirement", "Same text", vector, LocalDateTime.of(2024, 6, 1, 0, 0), Map.of())));
        queryVector(vector);

        // When
        SearchResponse response = searchService.search(query("same", 3)).block();

        // Then
        List<String> order = response.getHits().stream().map(hit -> hit.getRecord().getId()).collect(Collectors.toList());
        assertEquals(List.of("new", "old", "undated"), order);
    }

    @Test
    void testSearchReturnsAtMostK() {
        publish("2.1.0", List.of(
                record("a", "requirement", "alpha", List.of(1.0, 0.0, 0.0), null, Map.of()),
                record("b", "requirement", "beta", List.of(0.0, 1.0, 0.0), null, Map.of()),
                record("c", "requirement", "gamma", List.of(0.0, 0.0, 1.0), null, Map.of())));
        queryVector(List.of(1.0, 0.0, 0.0));

        SearchResponse response = searchService.search(query("alpha", 2)).block();

        assertEquals(2, response.getHits().size());
        assertEquals("a", response.getHits().get(0).getRecord().getId());
    }

    @Test
    void testEmptyCandidateSetReturnsNoHitsWithoutEmbedding() {
        // Given
        publish("2.1.0", List.of(
                record("r1", "requirement", "Password reset", List.of(1.0, 0.0, 0.0), null, Map.of())));
        SearchRequest request = SearchRequest.builder()
                .query("password")
                .filters(SearchRequest.Filters.builder().entityTypes(List.of("test_case")).build())
                .build();

        // When & Then
        StepVerifier.create(searchService.search(request))
                .assertNext(response -> {
                    assertTrue(response.getHits().isEmpty());
                    assertEquals("2.1.0", response.getKbVersion());
                })
                .verifyComplete();
        verifyNoInteractions(providerRouterService);
    }

    @Test
    void testFiltersOnMetadataAndKeywords() {
        // Given
        publish("2.1.0", List.of(
                record("r1", "requirement", "Password reset via email", List.of(1.0, 0.0, 0.0), null, Map.of("project", "alpha")),
                record("r2", "requirement", "Password reset via SMS", List.of(1.0, 0.0, 0.0), null, Map.of("project", "beta")),
                record("r3", "requirement", "Login via email", List.of(1.0, 0.0, 0.0), null, Map.of("project", "alpha"))));
        queryVector(List.of(1.0, 0.0, 0.0));
        SearchRequest request = SearchRequest.builder()
                .query("reset")
                .filters(SearchRequest.Filters.builder()
                        .metadata(Map.of("project", "alpha"))
                        .keywords(List.of("PASSWORD"))
                        .build())
                .build();

        // When
        SearchResponse response = searchService.search(request).block();

        // Then
        assertEquals(1, response.getHits().size());
        assertEquals("r1", response.getHits().get(0).getRecord().getId());
    }

    @Test
    void testNullMetadataFilterMatchesRecordsWithoutTheKey() {
        // Given
        publish("2.1.0", List.of(
                record("r1", "requirement", "Password reset via email", List.of(1.0, 0.0, 0.0), null, Map.of("project", "alpha")),
                record("r2", "requirement", "Password reset via SMS", List.of(1.0, 0.0, 0.0), null, Map.of("team", "qa")),
                record("r3", "requirement", "Password reset via phone", List.of(1.0, 0.0, 0.0), null, null)));
        queryVector(List.of(1.0, 0.0, 0.0));
        Map<String, String> metadata = new HashMap<>();
        metadata.put("project", null);
        SearchRequest request = SearchRequest.builder()
                .query("password reset")
                .filters(SearchRequest.Filters.builder().metadata(metadata).build())
                .build();

        // When
        SearchResponse response = searchService.search(request).block();

        // Then
        List<String> ids = response.getHits().stream()
                .map(hit -> hit.getRecord().getId())
                .sorted()
                .collect(Collectors.toList());
        assertEquals(List.of("r2", "r3"), ids);
    }

    @Test
    void testNoActiveVersionFails() {
        StepVerifier.create(searchService.search(query("anything", 5)))
                .expectError(NoActiveVersionException.class)
                .verify();
        verifyNoInteractions(providerRouterService);
    }

    @Test
    void testDimensionMismatchIsTreatedAsNoActiveVersion() {
        publish("2.1.0", List.of(record("r1", "requirement", "text", List.of(1.0, 0.0, 0.0), null, Map.of())));
        SearchRequest request = SearchRequest.builder().query("text").dim(1536).build();

        StepVerifier.create(searchService.search(request))
                .expectError(NoActiveVersionException.class)
                .verify();
    }

    @Test
    void testInvalidRequestsAreRejected() {
        StepVerifier.create(searchService.search(query(" ", 5)))
                .expectError(IllegalArgumentException.class)
                .verify();
        StepVerifier.create(searchService.search(query("text", 0)))
                .expectError(IllegalArgumentException.class)
                .verify();
    }

    @Test
    void testSearchKeepsTheVersionItStartedWithDuringActivation() {
        // Given
        publish("2.1.0", List.of(record("old-1", "requirement", "old corpus text", List.of(1.0, 0.0, 0.0), null, Map.of())));
        when(providerRouterService.embed(anyList(), eq(MODEL))).thenAnswer(invocation -> Mono.fromSupplier(() -> {
            // activation lands while the query is being embedded
            publish("2.2.0", List.of(record("new-1", "requirement", "new corpus text", List.of(1.0, 0.0, 0.0), null, Map.of())));
            return EmbeddingResult.builder().vectors(List.of(List.of(1.0, 0.0, 0.0))).model(MODEL).dim(3).build();
        }));

        // When
        SearchResponse during = searchService.search(query("corpus", 5)).block();
        SearchResponse after = searchService.search(query("corpus", 5)).block();

        // Then
        assertEquals("2.1.0", during.getKbVersion());
        assertTrue(during.getHits().stream().allMatch(hit -> hit.getRecord().getId().startsWith("old")));
        assertEquals("2.2.0", after.getKbVersion());
        assertTrue(after.getHits().stream().allMatch(hit -> hit.getRecord().getId().startsWith("new")));
    }
}
