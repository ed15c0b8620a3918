package org.lite.ai.service.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.lite.ai.dto.CostUsageStats;
import org.lite.ai.entity.CostRecord;
import org.lite.ai.enums.AttemptOutcome;
import org.lite.ai.provider.LlmProvider;
import org.lite.ai.service.CostAccountingService;
import org.lite.ai.store.CostRecordStore;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Comparator;
import java.util.Map;
import java.util.TreeMap;

@Service
@RequiredArgsConstructor
@Slf4j
public class CostAccountingServiceImpl implements CostAccountingService {

    private static final Duration PERSIST_TIMEOUT = Duration.ofSeconds(5);

    private final CostRecordStore costRecordStore;

    @Override
    public double calculateCost(LlmProvider provider, long tokensIn, long tokensOut) {
        double inputCost = (tokensIn / 1_000_000.0) * provider.getInputPricePer1M();
        double outputCost = (tokensOut / 1_000_000.0) * provider.getOutputPricePer1M();
        return inputCost + outputCost;
    }

    @Override
    public Mono<CostRecord> record(CostRecord record) {
        return costRecordStore.append(record)
                .timeout(PERSIST_TIMEOUT)
                .doOnNext(saved -> log.debug("💰 Cost record {} / {} attempt {}: {} in, {} out, ${} ({})",
                        saved.getProvider(), saved.getModel(), saved.getAttempt(), saved.getTokensIn(),
                        saved.getTokensOut(), String.format("%.6f", saved.getCostUsd()), saved.getOutcome()))
                .onErrorResume(error -> {
                    log.error("❌ Failed to persist cost record for provider {}: {}", record.getProvider(), error.getMessage());
                    return Mono.just(record);
                });
    }

    @Override
    public Mono<CostUsageStats> getUsageStats(LocalDateTime from, LocalDateTime to) {
        log.info("Calculating AI cost usage from {} to {}", from, to);
        return costRecordStore.findBetween(from, to)
                .collectList()
                .map(records -> {
                    CostUsageStats stats = new CostUsageStats();
                    CostUsageStats.Period period = new CostUsageStats.Period();
                    period.setFrom(from.toString());
                    period.setTo(to.toString());
                    stats.setPeriod(period);

                    Map<String, Long> latencySums = new TreeMap<>();
                    Map<String, CostUsageStats.DailyUsage> daily = new TreeMap<>();
                    CostUsageStats.TotalUsage total = stats.getTotalUsage();

                    for (CostRecord record : records) {
                        long tokens = record.getTokensIn() + record.getTokensOut();
                        boolean success = record.getOutcome() == AttemptOutcome.SUCCESS;

                        total.setTotalAttempts(total.getTotalAttempts() + 1);
                        if (!success) {
                            total.setFailedAttempts(total.getFailedAttempts() + 1);
                        }
                        total.setTotalPromptTokens(total.getTotalPromptTokens() + record.getTokensIn());
                        total.setTotalCompletionTokens(total.getTotalCompletionTokens() + record.getTokensOut());
                        total.setTotalTokens(total.getTotalTokens() + tokens);
                        total.setTotalCostUsd(total.getTotalCostUsd() + record.getCostUsd());

                        String modelKey = record.getProvider() + "/" + record.getModel();
                        CostUsageStats.ModelUsage model = stats.getModelBreakdown().computeIfAbsent(modelKey, k -> {
                            CostUsageStats.ModelUsage usage = new CostUsageStats.ModelUsage();
                            usage.setModelName(record.getModel());
                            usage.setProvider(record.getProvider());
                            return usage;
                        });
                        model.setAttempts(model.getAttempts() + 1);
                        model.setPromptTokens(model.getPromptTokens() + record.getTokensIn());
                        model.setCompletionTokens(model.getCompletionTokens() + record.getTokensOut());
                        model.setCostUsd(model.getCostUsd() + record.getCostUsd());
                        latencySums.merge(modelKey, record.getLatencyMs(), Long::sum);

                        CostUsageStats.ProviderUsage provider = stats.getProviderBreakdown().computeIfAbsent(
                                record.getProvider(), k -> {
                                    CostUsageStats.ProviderUsage usage = new CostUsageStats.ProviderUsage();
                                    usage.setProvider(k);
                                    return usage;
                                });
                        provider.setAttempts(provider.getAttempts() + 1);
                        if (success) {
                            provider.setSuccesses(provider.getSuccesses() + 1);
                        } else if (record.getOutcome() == AttemptOutcome.TIMEOUT) {
                            provider.setTimeouts(provider.getTimeouts() + 1);
                        } else {
                            provider.setFailures(provider.getFailures() + 1);
                        }
                        provider.setTotalTokens(provider.getTotalTokens() + tokens);
                        provider.setCostUsd(provider.getCostUsd() + record.getCostUsd());

                        String date = record.getTimestamp().format(DateTimeFormatter.ISO_LOCAL_DATE);
                        CostUsageStats.DailyUsage day = daily.computeIfAbsent(date, d -> {
                            CostUsageStats.DailyUsage usage = new CostUsageStats.DailyUsage();
                            usage.setDate(d);
                            return usage;
                        });
                        day.setAttempts(day.getAttempts() + 1);
                        day.setTotalTokens(day.getTotalTokens() + tokens);
                        day.setCostUsd(day.getCostUsd() + record.getCostUsd());
                    }

                    stats.getModelBreakdown().forEach((key, usage) ->
                            usage.setAverageLatencyMs(usage.getAttempts() == 0 ? 0
                                    : (double) latencySums.getOrDefault(key, 0L) / usage.getAttempts()));
                    stats.getDailyBreakdown().addAll(daily.values());
                    stats.getDailyBreakdown().sort(Comparator.comparing(CostUsageStats.DailyUsage::getDate));

                    log.info("✅ Cost usage: {} attempts, ${} total", total.getTotalAttempts(),
                            String.format("%.4f", total.getTotalCostUsd()));
                    return stats;
                });
    }
}
