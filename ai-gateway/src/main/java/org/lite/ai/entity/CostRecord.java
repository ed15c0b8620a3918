package org.lite.ai.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.lite.ai.enums.AttemptOutcome;
import org.lite.ai.enums.ProviderCapability;
import org.lite.ai.enums.ProviderFailureKind;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.LocalDateTime;

/**
 * Append-only accounting entry for one provider attempt, successful or not.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "ai_cost_records")
@CompoundIndex(name = "provider_timestamp_idx", def = "{'provider': 1, 'timestamp': -1}")
public class CostRecord {

    @Id
    private String id;

    private String provider;

    private String model;

    private ProviderCapability operation;

    private int attempt; // 1-based position within the routed call

    private long tokensIn;

    private long tokensOut;

    private double costUsd;

    private long latencyMs;

    private AttemptOutcome outcome;

    private ProviderFailureKind errorKind;

    private String errorMessage;

    private LocalDateTime timestamp;
}
