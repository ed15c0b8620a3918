package org.lite.ai.service;

import org.lite.ai.dto.CostUsageStats;
import org.lite.ai.entity.CostRecord;
import org.lite.ai.provider.LlmProvider;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;

public interface CostAccountingService {

    /**
     * Cost in USD from the provider's per-1M-token prices.
     */
    double calculateCost(LlmProvider provider, long tokensIn, long tokensOut);

    /**
     * Appends a cost record. Persistence failures are logged and never fail the caller.
     */
    Mono<CostRecord> record(CostRecord record);

    Mono<CostUsageStats> getUsageStats(LocalDateTime from, LocalDateTime to);
}
