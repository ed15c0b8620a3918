package org.lite.ai.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.lite.ai.dto.CreateKbVersionRequest;
import org.lite.ai.dto.IngestRequest;
import org.lite.ai.dto.IngestResult;
import org.lite.ai.dto.KbVersionDiff;
import org.lite.ai.dto.KbVersionStats;
import org.lite.ai.dto.StaleEmbeddingReport;
import org.lite.ai.entity.KbVersion;
import org.lite.ai.service.KnowledgeBaseVersionService;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;

@Slf4j
@RestController
@RequestMapping("/ai/kb-versions")
@RequiredArgsConstructor
@Tag(name = "Knowledge Base Versions", description = "Build, ingest, activate and archive knowledge-base versions")
public class KbVersionController {

    private final KnowledgeBaseVersionService knowledgeBaseVersionService;

    @PostMapping
    @Operation(summary = "Create a building version", description = "Allocates the next patch label when none is given")
    public Mono<ResponseEntity<KbVersion>> createVersion(@RequestBody(required = false) CreateKbVersionRequest request) {
        CreateKbVersionRequest body = request != null ? request : new CreateKbVersionRequest();
        log.info("Creating KB version {} (model: {})", body.getVersion(), body.getEmbeddingModel());
        return knowledgeBaseVersionService.beginBuild(body)
                .map(version -> ResponseEntity.status(HttpStatus.CREATED).body(version));
    }

    @GetMapping
    @Operation(summary = "List versions", description = "Newest label first, optionally for one embedding model")
    public Flux<KbVersion> listVersions(@RequestParam(required = false) String model) {
        return knowledgeBaseVersionService.list(model);
    }

    @GetMapping("/{version}")
    @Operation(summary = "Get a version with live record statistics")
    public Mono<KbVersionStats> getVersion(@PathVariable String version) {
        return knowledgeBaseVersionService.getStats(version);
    }

    @PostMapping("/{version}/ingest")
    @Operation(summary = "Ingest a source entity", description = "Chunks and embeds the entity text; unchanged chunks are skipped")
    public Mono<IngestResult> ingest(@PathVariable String version, @Valid @RequestBody IngestRequest request) {
        log.info("Ingest request for {}:{} into {}", request.getEntityType(), request.getEntityId(), version);
        return knowledgeBaseVersionService.ingest(version, request)
                .doOnError(error -> log.error("Error ingesting {}:{} into {}: {}",
                        request.getEntityType(), request.getEntityId(), version, error.getMessage()));
    }

    @PostMapping("/{version}/activate")
    @Operation(summary = "Activate a version", description = "Atomically replaces the active version of the same embedding model")
    public Mono<KbVersion> activate(@PathVariable String version) {
        return knowledgeBaseVersionService.activate(version);
    }

    @PostMapping("/{version}/archive")
    @Operation(summary = "Archive a version that is not active")
    public Mono<KbVersion> archive(@PathVariable String version) {
        return knowledgeBaseVersionService.archive(version);
    }

    @GetMapping("/{fromVersion}/diff/{toVersion}")
    @Operation(summary = "Compare two versions", description = "Entities added, removed, changed or unchanged by content hash")
    public Mono<KbVersionDiff> diff(@PathVariable String fromVersion, @PathVariable String toVersion) {
        return knowledgeBaseVersionService.diff(fromVersion, toVersion);
    }

    @GetMapping("/{version}/stale")
    @Operation(summary = "Find stale embeddings",
            description = "Entities without a content hash or source timestamp, or whose source snapshot predates updatedBefore")
    public Mono<StaleEmbeddingReport> findStaleEmbeddings(
            @PathVariable String version,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime updatedBefore) {
        return knowledgeBaseVersionService.findStaleEmbeddings(version, updatedBefore);
    }
}
