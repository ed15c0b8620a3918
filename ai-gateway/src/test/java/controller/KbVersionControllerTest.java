package controller;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.lite.ai.controller.KbVersionController;
import org.lite.ai.dto.CreateKbVersionRequest;
import org.lite.ai.dto.IngestRequest;
import org.lite.ai.dto.IngestResult;
import org.lite.ai.dto.StaleEmbeddingReport;
import org.lite.ai.entity.KbVersion;
import org.lite.ai.enums.KbVersionStatus;
import org.lite.ai.exception.GlobalExceptionHandler;
import org.lite.ai.exception.InvalidVersionStateException;
import org.lite.ai.exception.VersionConflictException;
import org.lite.ai.exception.VersionNotFoundException;
import org.lite.ai.service.KnowledgeBaseVersionService;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class KbVersionControllerTest {

    @Mock
    private KnowledgeBaseVersionService knowledgeBaseVersionService;

    private WebTestClient client;

    @BeforeEach
    void setUp() {
        client = WebTestClient.bindToController(new KbVersionController(knowledgeBaseVersionService))
                .controllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    void testCreateVersionReturnsCreated() {
        // Given
        when(knowledgeBaseVersionService.beginBuild(any(CreateKbVersionRequest.class)))
                .thenReturn(Mono.just(KbVersion.builder()
                        .version("2.1.0")
                        .embeddingModel("local-stub-embed")
                        .status(KbVersionStatus.BUILDING)
                        .build()));

        // When / Then
        client.post().uri("/ai/kb-versions")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("version", "2.1.0", "embeddingModel", "local-stub-embed"))
                .exchange()
                .expectStatus().isCreated()
                .expectBody()
                .jsonPath("$.version").isEqualTo("2.1.0")
                .jsonPath("$.status").isEqualTo("BUILDING");

        ArgumentCaptor<CreateKbVersionRequest> captor = ArgumentCaptor.forClass(CreateKbVersionRequest.class);
        verify(knowledgeBaseVersionService).beginBuild(captor.capture());
        assertEquals("2.1.0", captor.getValue().getVersion());
    }

    @Test
    void testCreateVersionWithoutBodyAllocatesLabel() {
        when(knowledgeBaseVersionService.beginBuild(any(CreateKbVersionRequest.class)))
                .thenReturn(Mono.just(KbVersion.builder().version("2.0.10").status(KbVersionStatus.BUILDING).build()));

        client.post().uri("/ai/kb-versions")
                .exchange()
                .expectStatus().isCreated()
                .expectBody()
                .jsonPath("$.version").isEqualTo("2.0.10");
    }

    @Test
    void testDuplicateLabelIsConflict() {
        when(knowledgeBaseVersionService.beginBuild(any(CreateKbVersionRequest.class)))
                .thenReturn(Mono.error(new VersionConflictException("KB version 2.1.0 already exists")));

        client.post().uri("/ai/kb-versions")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("version", "2.1.0"))
                .exchange()
                .expectStatus().isEqualTo(409)
                .expectBody()
                .jsonPath("$.message").isEqualTo("KB version 2.1.0 already exists");
    }

    @Test
    void testIngestValidatesBody() {
        client.post().uri("/ai/kb-versions/2.1.0/ingest")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("entityType", "requirement"))
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("VALIDATION_FAILED");

        verify(knowledgeBaseVersionService, never()).ingest(any(), any());
    }

    @Test
    void testIngestReturnsCounts() {
        when(knowledgeBaseVersionService.ingest(eq("2.1.0"), any(IngestRequest.class)))
                .thenReturn(Mono.just(IngestResult.builder()
                        .kbVersion("2.1.0")
                        .entityType("requirement")
                        .entityId("REQ-42")
                        .totalChunks(2)
                        .created(2)
                        .build()));

        client.post().uri("/ai/kb-versions/2.1.0/ingest")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("entityType", "requirement", "entityId", "REQ-42", "text", "Users can reset passwords."))
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.created").isEqualTo(2);
    }

    @Test
    void testArchivingActiveVersionIsConflict() {
        when(knowledgeBaseVersionService.archive("2.1.0"))
                .thenReturn(Mono.error(new InvalidVersionStateException("2.1.0", KbVersionStatus.ACTIVE, "archive")));

        client.post().uri("/ai/kb-versions/2.1.0/archive")
                .exchange()
                .expectStatus().isEqualTo(409);
    }

    @Test
    void testUnknownVersionIsNotFound() {
        when(knowledgeBaseVersionService.activate("9.9.9"))
                .thenReturn(Mono.error(new VersionNotFoundException("9.9.9")));

        client.post().uri("/ai/kb-versions/9.9.9/activate")
                .exchange()
                .expectStatus().isNotFound();
    }

    @Test
    void testStaleEmbeddingsParsesTheThreshold() {
        // Given
        LocalDateTime threshold = LocalDateTime.of(2024, 3, 1, 0, 0);
        when(knowledgeBaseVersionService.findStaleEmbeddings("2.1.0", threshold))
                .thenReturn(Mono.just(StaleEmbeddingReport.builder()
                        .kbVersion("2.1.0")
                        .staleEntities(List.of(StaleEmbeddingReport.StaleEntity.builder()
                                .entityType("requirement")
                                .entityId("REQ-7")
                                .chunkCount(2)
                                .build()))
                        .total(1)
                        .build()));

        // When / Then
        client.get().uri("/ai/kb-versions/2.1.0/stale?updatedBefore=2024-03-01T00:00:00")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.total").isEqualTo(1)
                .jsonPath("$.staleEntities[0].entityId").isEqualTo("REQ-7")
                .jsonPath("$.staleEntities[0].chunkCount").isEqualTo(2);
    }
}
