package org.lite.ai.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.lite.ai.dto.CacheStats;
import org.lite.ai.dto.CostUsageStats;
import org.lite.ai.dto.ProviderHealthSnapshot;
import org.lite.ai.service.CostAccountingService;
import org.lite.ai.service.ProviderRouterService;
import org.lite.ai.service.ResponseCacheService;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/ai")
@RequiredArgsConstructor
@Tag(name = "AI Gateway Observability", description = "Cache statistics, provider health and cost usage")
public class ObservabilityController {

    private final ResponseCacheService responseCacheService;
    private final ProviderRouterService providerRouterService;
    private final CostAccountingService costAccountingService;

    @GetMapping("/cache-stats")
    @Operation(summary = "Response cache statistics", description = "Hits, misses, sets and evictions per tier and per key")
    public Mono<CacheStats> getCacheStats() {
        return Mono.fromSupplier(responseCacheService::getStats);
    }

    @DeleteMapping("/cache")
    @Operation(summary = "Invalidate cached responses", description = "Removes one key, or every cached response when no key is given")
    public Mono<Map<String, Object>> invalidateCache(@RequestParam(required = false) String key) {
        Mono<Long> removed = key == null
                ? responseCacheService.invalidateAll()
                : responseCacheService.invalidate(key).map(found -> found ? 1L : 0L);
        return removed.map(count -> {
            log.info("Invalidated {} cached responses{}", count, key == null ? "" : " for key " + key);
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("removed", count);
            return body;
        });
    }

    @GetMapping("/providers/health")
    @Operation(summary = "Provider health", description = "Health state, failure counters and in-flight calls of each provider")
    public Mono<List<ProviderHealthSnapshot>> getProviderHealth() {
        return Mono.fromSupplier(providerRouterService::getHealth);
    }

    @GetMapping("/costs/usage")
    @Operation(summary = "Cost usage", description = "Cost and token totals per provider, model and day between two dates (inclusive)")
    public Mono<CostUsageStats> getCostUsage(
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate fromDate,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate toDate) {
        LocalDate to = toDate != null ? toDate : LocalDate.now();
        LocalDate from = fromDate != null ? fromDate : to.withDayOfMonth(1);
        if (from.isAfter(to)) {
            return Mono.error(new IllegalArgumentException("fromDate must not be after toDate"));
        }
        LocalDateTime start = from.atStartOfDay();
        LocalDateTime end = to.atTime(LocalTime.MAX);
        return costAccountingService.getUsageStats(start, end)
                .doOnError(error -> log.error("Error computing cost usage from {} to {}: {}", from, to, error.getMessage()));
    }
}
