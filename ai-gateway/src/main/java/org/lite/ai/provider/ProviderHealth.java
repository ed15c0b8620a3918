package org.lite.ai.provider;

import org.lite.ai.config.AiGatewayProperties;
import org.lite.ai.enums.ProviderFailureKind;
import org.lite.ai.enums.ProviderHealthState;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Rolling health estimate of one provider. All mutation happens under the instance lock.
 */
public class ProviderHealth {

    private final AiGatewayProperties.Router settings;
    private final Deque<Boolean> window = new ArrayDeque<>(); // true = failure
    private ProviderHealthState state = ProviderHealthState.HEALTHY;
    private int failuresInWindow;
    private int consecutiveFatal;
    private double ewmaLatencyMs = -1;
    private Instant downSince;
    private boolean probeInFlight;
    private String lastError;

    public ProviderHealth(AiGatewayProperties.Router settings) {
        this.settings = settings;
    }

    public synchronized ProviderHealthState getState() {
        return state;
    }

    public synchronized double getEwmaLatencyMs() {
        return ewmaLatencyMs < 0 ? 0 : ewmaLatencyMs;
    }

    /**
     * Whether a new attempt may be sent now. For a DOWN provider past its cooldown this admits exactly
     * one probe until that probe reports back.
     */
    public synchronized boolean tryAdmit(Instant now) {
        if (state != ProviderHealthState.DOWN) {
            return true;
        }
        if (probeInFlight || downSince == null) {
            return false;
        }
        if (now.isBefore(downSince.plus(cooldown()))) {
            return false;
        }
        probeInFlight = true;
        return true;
    }

    /** True when a DOWN provider would admit a probe at {@code now}. */
    public synchronized boolean isProbeDue(Instant now) {
        return state == ProviderHealthState.DOWN && !probeInFlight && downSince != null
                && !now.isBefore(downSince.plus(cooldown()));
    }

    public synchronized void recordSuccess(long latencyMs) {
        updateLatency(latencyMs);
        consecutiveFatal = 0;
        lastError = null;
        if (state == ProviderHealthState.DOWN) {
            // successful probe after cooldown
            probeInFlight = false;
            downSince = null;
            window.clear();
            failuresInWindow = 0;
            state = ProviderHealthState.HEALTHY;
            return;
        }
        push(false);
        if (state == ProviderHealthState.DEGRADED && !overThreshold()) {
            state = ProviderHealthState.HEALTHY;
        }
    }

    public synchronized void recordFailure(ProviderFailureKind kind, String message, long latencyMs, Instant now) {
        if (kind != ProviderFailureKind.AUTH_FAILED) {
            updateLatency(latencyMs);
        }
        lastError = message;
        if (state == ProviderHealthState.DOWN) {
            // failed probe restarts the cooldown
            probeInFlight = false;
            downSince = now;
            return;
        }
        push(true);
        if (kind.isFatal()) {
            consecutiveFatal++;
        }
        if (kind == ProviderFailureKind.AUTH_FAILED) {
            markDown(now);
            return;
        }
        if (state == ProviderHealthState.HEALTHY && overThreshold()) {
            state = ProviderHealthState.DEGRADED;
        }
        if (state == ProviderHealthState.DEGRADED && consecutiveFatal >= settings.getDownAfterConsecutiveFatal()) {
            markDown(now);
        }
    }

    /** Releases a probe slot whose attempt was abandoned without an outcome. */
    public synchronized void abandonProbe() {
        probeInFlight = false;
    }

    public synchronized Snapshot snapshot() {
        return new Snapshot(state, window.size(), failureRate(), getEwmaLatencyMs(), consecutiveFatal, lastError, downSince);
    }

    private void markDown(Instant now) {
        state = ProviderHealthState.DOWN;
        downSince = now;
        probeInFlight = false;
    }

    private void push(boolean failure) {
        window.addLast(failure);
        if (failure) {
            failuresInWindow++;
        }
        while (window.size() > Math.max(1, settings.getHealthWindowSize())) {
            if (window.removeFirst()) {
                failuresInWindow--;
            }
        }
    }

    private boolean overThreshold() {
        return window.size() >= settings.getHealthMinSamples() && failureRate() > settings.getDegradedFailureRate();
    }

    private double failureRate() {
        return window.isEmpty() ? 0 : (double) failuresInWindow / window.size();
    }

    private void updateLatency(long latencyMs) {
        double alpha = settings.getLatencyAlpha();
        ewmaLatencyMs = ewmaLatencyMs < 0 ? latencyMs : alpha * latencyMs + (1 - alpha) * ewmaLatencyMs;
    }

    private Duration cooldown() {
        return settings.getDownCooldown();
    }

    public record Snapshot(ProviderHealthState state, int windowSize, double failureRate, double ewmaLatencyMs,
                           int consecutiveFatal, String lastError, Instant downSince) {
    }
}
