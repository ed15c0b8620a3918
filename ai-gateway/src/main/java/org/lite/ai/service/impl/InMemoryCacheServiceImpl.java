package org.lite.ai.service.impl;

import lombok.extern.slf4j.Slf4j;
import org.lite.ai.service.CacheService;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Process-local stand-in for Redis when running without external services.
 */
@Service
@Slf4j
@Profile("in-memory")
public class InMemoryCacheServiceImpl implements CacheService {

    private final Map<String, CacheEntry> cache = new ConcurrentHashMap<>();

    private record CacheEntry(String value, Instant expiresAt) {
        boolean isExpired() {
            return Instant.now().isAfter(expiresAt);
        }
    }

    @Override
    public Mono<String> get(String key) {
        return Mono.fromSupplier(() -> {
            CacheEntry entry = cache.get(key);
            if (entry == null) {
                return null;
            }
            if (entry.isExpired()) {
                cache.remove(key, entry);
                return null;
            }
            return entry.value();
        });
    }

    @Override
    public Mono<Void> set(String key, String value, Duration ttl) {
        return Mono.fromRunnable(() -> cache.put(key, new CacheEntry(value, Instant.now().plus(ttl))));
    }

    @Override
    public Mono<Boolean> delete(String key) {
        return Mono.fromSupplier(() -> cache.remove(key) != null);
    }

    @Override
    public Flux<String> scanKeys(String prefix) {
        return Flux.defer(() -> Flux.fromIterable(cache.keySet().stream()
                .filter(key -> key.startsWith(prefix))
                .collect(Collectors.toList())));
    }
}
