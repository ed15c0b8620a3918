package org.lite.ai.service.impl;

import lombok.extern.slf4j.Slf4j;
import org.lite.ai.config.AiGatewayProperties;
import org.lite.ai.service.CacheService;
import org.springframework.context.annotation.Profile;
import org.springframework.data.redis.core.ReactiveStringRedisTemplate;
import org.springframework.data.redis.core.ScanOptions;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Redis tier of the response cache. A slow or unreachable Redis reads as a miss so generation never
 * waits on it.
 */
@Service
@Slf4j
@Profile("!in-memory")
public class RedisCacheServiceImpl implements CacheService {

    private static final long SCAN_BATCH = 500;

    private final ReactiveStringRedisTemplate redisTemplate;
    private final Duration timeout;

    public RedisCacheServiceImpl(ReactiveStringRedisTemplate redisTemplate, AiGatewayProperties properties) {
        this.redisTemplate = redisTemplate;
        this.timeout = properties.getCache().getRedisTimeout();
    }

    @Override
    public Mono<String> get(String key) {
        return redisTemplate.opsForValue().get(key)
                .timeout(timeout)
                .onErrorResume(e -> {
                    log.warn("⚠️ Redis read of {} failed, treating as miss: {}", key, e.getMessage());
                    return Mono.empty();
                });
    }

    @Override
    public Mono<Void> set(String key, String value, Duration ttl) {
        return redisTemplate.opsForValue().set(key, value, ttl)
                .timeout(timeout)
                .doOnNext(stored -> log.debug("Cached response {} in Redis for {}", key, ttl))
                .onErrorResume(e -> {
                    log.warn("⚠️ Redis write of {} failed: {}", key, e.getMessage());
                    return Mono.empty();
                })
                .then();
    }

    @Override
    public Mono<Boolean> delete(String key) {
        return redisTemplate.delete(key)
                .map(removed -> removed > 0)
                .timeout(timeout)
                .onErrorResume(e -> {
                    log.warn("⚠️ Redis delete of {} failed: {}", key, e.getMessage());
                    return Mono.just(false);
                });
    }

    @Override
    public Flux<String> scanKeys(String prefix) {
        ScanOptions options = ScanOptions.scanOptions().match(prefix + "*").count(SCAN_BATCH).build();
        return redisTemplate.scan(options)
                .onErrorResume(e -> {
                    log.error("❌ Redis scan for {} failed: {}", prefix, e.getMessage());
                    return Flux.empty();
                });
    }
}
