package org.lite.ai.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.lite.ai.dto.SearchRequest;
import org.lite.ai.dto.SearchResponse;
import org.lite.ai.service.HybridSearchService;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

@Slf4j
@RestController
@RequestMapping("/ai/search")
@RequiredArgsConstructor
@Tag(name = "Search", description = "Hybrid vector and lexical search over the active knowledge base")
public class SearchController {

    private final HybridSearchService hybridSearchService;

    @PostMapping
    @Operation(summary = "Search the active version", description = "Returns at most k hits scored 0.7 vector + 0.3 lexical by default")
    public Mono<SearchResponse> search(@Valid @RequestBody SearchRequest request) {
        log.debug("Search request (k: {}, model: {})", request.getK(), request.getModel());
        return hybridSearchService.search(request)
                .doOnSuccess(response -> log.debug("Search over {} returned {} hits",
                        response.getKbVersion(), response.getHits().size()));
    }
}
