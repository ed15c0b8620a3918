package org.lite.ai.service;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Shared tier of the response cache, holding serialized responses under prefixed fingerprint keys.
 * Implementations turn backend errors and timeouts into absent values.
 */
public interface CacheService {

    Mono<String> get(String key);

    Mono<Void> set(String key, String value, Duration ttl);

    Mono<Boolean> delete(String key);

    /**
     * Keys starting with {@code prefix}; used only for bulk invalidation.
     */
    Flux<String> scanKeys(String prefix);
}
