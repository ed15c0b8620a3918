package org.lite.ai.provider;

import lombok.extern.slf4j.Slf4j;
import org.lite.ai.config.AiGatewayProperties;
import org.lite.ai.enums.ProviderFailureKind;
import org.lite.ai.enums.ProviderHealthState;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-wide provider health. Only the router reports outcomes here; nothing is persisted.
 */
@Component
@Slf4j
public class ProviderHealthTracker {

    private final AiGatewayProperties properties;
    private final Clock clock;
    private final Map<String, ProviderHealth> health = new ConcurrentHashMap<>();

    public ProviderHealthTracker(AiGatewayProperties properties, Clock clock) {
        this.properties = properties;
        this.clock = clock;
    }

    public ProviderHealth get(String provider) {
        return health.computeIfAbsent(provider, name -> new ProviderHealth(properties.getRouter()));
    }

    public ProviderHealthState state(String provider) {
        return get(provider).getState();
    }

    public boolean tryAdmit(String provider) {
        return get(provider).tryAdmit(clock.instant());
    }

    public boolean isProbeDue(String provider) {
        return get(provider).isProbeDue(clock.instant());
    }

    public void recordSuccess(String provider, long latencyMs) {
        ProviderHealth providerHealth = get(provider);
        ProviderHealthState before = providerHealth.getState();
        providerHealth.recordSuccess(latencyMs);
        logTransition(provider, before, providerHealth.getState());
    }

    public void recordFailure(String provider, ProviderFailureKind kind, String message, long latencyMs) {
        ProviderHealth providerHealth = get(provider);
        ProviderHealthState before = providerHealth.getState();
        providerHealth.recordFailure(kind, message, latencyMs, now());
        logTransition(provider, before, providerHealth.getState());
    }

    public void abandonProbe(String provider) {
        get(provider).abandonProbe();
    }

    public Instant now() {
        return clock.instant();
    }

    private void logTransition(String provider, ProviderHealthState before, ProviderHealthState after) {
        if (before == after) {
            return;
        }
        if (after == ProviderHealthState.HEALTHY) {
            log.info("✅ Provider {} recovered: {} -> {}", provider, before, after);
        } else {
            log.warn("⚠️ Provider {} health changed: {} -> {}", provider, before, after);
        }
    }
}
