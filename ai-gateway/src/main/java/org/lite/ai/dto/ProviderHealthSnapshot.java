package org.lite.ai.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.lite.ai.enums.ProviderCapability;
import org.lite.ai.enums.ProviderHealthState;

import java.time.Instant;
import java.util.Set;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProviderHealthSnapshot {
    private String name;
    private ProviderHealthState state;
    private Set<ProviderCapability> capabilities;
    private int priority;
    private int windowSize;
    private double failureRate;
    private double ewmaLatencyMs;
    private int consecutiveFatal;
    private int inFlight;
    private int maxConcurrency;
    private String lastError;
    private Instant downSince;
}
