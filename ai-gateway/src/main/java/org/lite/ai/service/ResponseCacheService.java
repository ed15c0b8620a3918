package org.lite.ai.service;

import org.lite.ai.dto.CacheStats;
import org.lite.ai.dto.CachedResponse;
import org.lite.ai.enums.CacheTier;
import reactor.core.publisher.Mono;

/**
 * Two-tier cache of generated responses keyed by prompt fingerprint. Failures of either tier behave as
 * misses and never fail the caller.
 */
public interface ResponseCacheService {

    /**
     * Looks the key up in memory, then Redis. Every tier consulted counts exactly one hit or miss.
     */
    Mono<CachedResponse> get(String key);

    /**
     * Stores into {@code tier}; a Redis write also fills the memory tier.
     */
    Mono<Void> put(String key, CachedResponse value, CacheTier tier);

    Mono<Boolean> invalidate(String key);

    /**
     * @return number of entries removed across both tiers
     */
    Mono<Long> invalidateAll();

    CacheStats getStats();

    /**
     * Drops expired memory entries.
     * @return number of entries removed
     */
    int cleanupExpired();
}
