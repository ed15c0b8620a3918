package org.lite.ai.service.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.lite.ai.config.AiGatewayProperties;
import org.lite.ai.dto.CacheStats;
import org.lite.ai.dto.CachedResponse;
import org.lite.ai.enums.CacheTier;
import org.lite.ai.service.CacheService;
import org.lite.ai.service.ResponseCacheService;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

@Service
@Slf4j
public class ResponseCacheServiceImpl implements ResponseCacheService {

    private final CacheService cacheService;
    private final AiGatewayProperties properties;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    private final Map<String, MemoryEntry> memory = new ConcurrentHashMap<>();
    private final Map<CacheTier, TierCounters> counters = new EnumMap<>(CacheTier.class);
    private final Map<String, KeyCounters> keyCounters = new ConcurrentHashMap<>();

    public ResponseCacheServiceImpl(CacheService cacheService, AiGatewayProperties properties,
                                    ObjectMapper objectMapper, Clock clock) {
        this.cacheService = cacheService;
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.clock = clock;
        for (CacheTier tier : CacheTier.values()) {
            counters.put(tier, new TierCounters());
        }
    }

    private record MemoryEntry(CachedResponse value, Instant expiresAt) {
        boolean isExpired(Instant now) {
            return !now.isBefore(expiresAt);
        }
    }

    private static final class TierCounters {
        private final AtomicLong hits = new AtomicLong();
        private final AtomicLong misses = new AtomicLong();
        private final AtomicLong sets = new AtomicLong();
        private final AtomicLong evictions = new AtomicLong();
    }

    private static final class KeyCounters {
        private final CacheTier tier;
        private final String key;
        private final AtomicLong hits = new AtomicLong();
        private final AtomicLong misses = new AtomicLong();
        private volatile Instant lastHitAt;

        private KeyCounters(CacheTier tier, String key) {
            this.tier = tier;
            this.key = key;
        }
    }

    @Override
    public Mono<CachedResponse> get(String key) {
        AiGatewayProperties.Cache settings = properties.getCache();
        if (!settings.isEnabled()) {
            return Mono.empty();
        }
        return Mono.defer(() -> {
            CachedResponse local = getFromMemory(key);
            if (local != null) {
                return Mono.just(local);
            }
            if (!settings.isRedisEnabled()) {
                return Mono.empty();
            }
            return cacheService.get(redisKey(key))
                    .onErrorResume(e -> {
                        log.warn("⚠️ Redis cache lookup failed for {}: {}", key, e.getMessage());
                        return Mono.empty();
                    })
                    .flatMap(json -> Mono.fromCallable(() -> objectMapper.readValue(json, CachedResponse.class))
                            .onErrorResume(e -> {
                                log.warn("⚠️ Discarding unreadable cache entry {}: {}", key, e.getMessage());
                                return Mono.empty();
                            }))
                    .doOnNext(value -> {
                        recordHit(CacheTier.REDIS, key);
                        putInMemory(key, value);
                    })
                    .switchIfEmpty(Mono.fromRunnable(() -> recordMiss(CacheTier.REDIS, key)));
        });
    }

    private CachedResponse getFromMemory(String key) {
        Instant now = clock.instant();
        MemoryEntry entry = memory.get(key);
        if (entry != null && entry.isExpired(now)) {
            if (memory.remove(key, entry)) {
                counters.get(CacheTier.MEMORY).evictions.incrementAndGet();
            }
            entry = null;
        }
        if (entry == null) {
            recordMiss(CacheTier.MEMORY, key);
            return null;
        }
        recordHit(CacheTier.MEMORY, key);
        return entry.value();
    }

    @Override
    public Mono<Void> put(String key, CachedResponse value, CacheTier tier) {
        AiGatewayProperties.Cache settings = properties.getCache();
        if (!settings.isEnabled()) {
            return Mono.empty();
        }
        return Mono.defer(() -> {
            putInMemory(key, value);
            if (tier != CacheTier.REDIS || !settings.isRedisEnabled()) {
                return Mono.<Void>empty();
            }
            return Mono.fromCallable(() -> objectMapper.writeValueAsString(value))
                    .flatMap(json -> cacheService.set(redisKey(key), json, settings.getRedisTtl()))
                    .doOnSuccess(ignored -> counters.get(CacheTier.REDIS).sets.incrementAndGet());
        }).onErrorResume(e -> {
            log.warn("⚠️ Failed to cache response {}: {}", key, e.getMessage());
            return Mono.empty();
        });
    }

    private void putInMemory(String key, CachedResponse value) {
        AiGatewayProperties.Cache settings = properties.getCache();
        memory.put(key, new MemoryEntry(value, clock.instant().plus(settings.getMemoryTtl())));
        counters.get(CacheTier.MEMORY).sets.incrementAndGet();
        if (memory.size() > settings.getMemoryMaxEntries()) {
            evictOverflow(settings.getMemoryMaxEntries());
        }
    }

    // expired entries go first, then the ones closest to expiry
    private synchronized void evictOverflow(int maxEntries) {
        cleanupExpired();
        int overflow = memory.size() - maxEntries;
        if (overflow <= 0) {
            return;
        }
        List<Map.Entry<String, MemoryEntry>> entries = new ArrayList<>(memory.entrySet());
        entries.sort(Comparator.comparing(entry -> entry.getValue().expiresAt()));
        for (int i = 0; i < overflow && i < entries.size(); i++) {
            Map.Entry<String, MemoryEntry> victim = entries.get(i);
            if (memory.remove(victim.getKey(), victim.getValue())) {
                counters.get(CacheTier.MEMORY).evictions.incrementAndGet();
            }
        }
    }

    @Override
    public Mono<Boolean> invalidate(String key) {
        return Mono.defer(() -> {
            boolean local = memory.remove(key) != null;
            keyCounters.remove(statsKey(CacheTier.MEMORY, key));
            keyCounters.remove(statsKey(CacheTier.REDIS, key));
            if (!properties.getCache().isRedisEnabled()) {
                return Mono.just(local);
            }
            return cacheService.delete(redisKey(key))
                    .defaultIfEmpty(false)
                    .map(remote -> local || remote);
        }).doOnNext(removed -> log.info("Invalidated cache key {} (found: {})", key, removed));
    }

    @Override
    public Mono<Long> invalidateAll() {
        return Mono.defer(() -> {
            long local = memory.size();
            memory.clear();
            keyCounters.clear();
            if (!properties.getCache().isRedisEnabled()) {
                return Mono.just(local);
            }
            return cacheService.scanKeys(properties.getCache().getKeyPrefix())
                    .flatMap(cacheService::delete)
                    .filter(Boolean::booleanValue)
                    .count()
                    .map(remote -> local + remote);
        }).doOnNext(count -> log.info("🧹 Invalidated {} cached responses", count));
    }

    @Override
    public CacheStats getStats() {
        CacheStats stats = new CacheStats();
        stats.setEnabled(properties.getCache().isEnabled());
        for (CacheTier tier : CacheTier.values()) {
            if (tier == CacheTier.REDIS && !properties.getCache().isRedisEnabled()) {
                continue;
            }
            TierCounters tierCounters = counters.get(tier);
            CacheStats.TierStats tierStats = new CacheStats.TierStats();
            tierStats.setTier(tier.label());
            tierStats.setHits(tierCounters.hits.get());
            tierStats.setMisses(tierCounters.misses.get());
            tierStats.setSets(tierCounters.sets.get());
            tierStats.setEvictions(tierCounters.evictions.get());
            tierStats.setSize(tier == CacheTier.MEMORY ? memory.size() : -1);
            long lookups = tierStats.getHits() + tierStats.getMisses();
            tierStats.setHitRate(lookups == 0 ? 0.0 : (double) tierStats.getHits() / lookups);
            stats.getTiers().put(tier.label(), tierStats);
        }
        List<CacheStats.KeyStats> keys = new ArrayList<>();
        for (KeyCounters key : keyCounters.values()) {
            CacheStats.KeyStats keyStats = new CacheStats.KeyStats();
            keyStats.setTier(key.tier.label());
            keyStats.setKey(key.key);
            keyStats.setHits(key.hits.get());
            keyStats.setMisses(key.misses.get());
            keyStats.setLastHitAt(key.lastHitAt);
            keys.add(keyStats);
        }
        keys.sort(Comparator.comparingLong(CacheStats.KeyStats::getHits).reversed()
                .thenComparing(CacheStats.KeyStats::getKey)
                .thenComparing(CacheStats.KeyStats::getTier));
        stats.setKeys(keys);
        return stats;
    }

    @Override
    public int cleanupExpired() {
        Instant now = clock.instant();
        int removed = 0;
        for (Map.Entry<String, MemoryEntry> entry : memory.entrySet()) {
            if (entry.getValue().isExpired(now) && memory.remove(entry.getKey(), entry.getValue())) {
                counters.get(CacheTier.MEMORY).evictions.incrementAndGet();
                removed++;
            }
        }
        return removed;
    }

    @Scheduled(fixedDelayString = "${linqra.ai.cache.cleanup-interval-ms:60000}")
    public void scheduledCleanup() {
        int removed = cleanupExpired();
        if (removed > 0) {
            log.debug("Removed {} expired cache entries", removed);
        }
    }

    private void recordHit(CacheTier tier, String key) {
        counters.get(tier).hits.incrementAndGet();
        KeyCounters keyStats = keyCounters(tier, key);
        if (keyStats != null) {
            keyStats.hits.incrementAndGet();
            keyStats.lastHitAt = clock.instant();
        }
    }

    private void recordMiss(CacheTier tier, String key) {
        counters.get(tier).misses.incrementAndGet();
        KeyCounters keyStats = keyCounters(tier, key);
        if (keyStats != null) {
            keyStats.misses.incrementAndGet();
        }
    }

    private KeyCounters keyCounters(CacheTier tier, String key) {
        String statsKey = statsKey(tier, key);
        KeyCounters existing = keyCounters.get(statsKey);
        if (existing != null) {
            return existing;
        }
        // per-key tracking is bounded; tier totals are always kept
        if (keyCounters.size() >= properties.getCache().getMemoryMaxEntries() * 4) {
            return null;
        }
        return keyCounters.computeIfAbsent(statsKey, k -> new KeyCounters(tier, key));
    }

    private String redisKey(String key) {
        return properties.getCache().getKeyPrefix() + key;
    }

    private static String statsKey(CacheTier tier, String key) {
        return tier.name() + "|" + key;
    }
}
