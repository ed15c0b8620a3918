package org.lite.ai.service.impl;

import lombok.extern.slf4j.Slf4j;
import org.lite.ai.config.AiGatewayProperties;
import org.lite.ai.dto.CompletionRequest;
import org.lite.ai.dto.CompletionResult;
import org.lite.ai.dto.EmbeddingResult;
import org.lite.ai.dto.ProviderCompletion;
import org.lite.ai.dto.ProviderEmbedding;
import org.lite.ai.dto.ProviderHealthSnapshot;
import org.lite.ai.entity.CostRecord;
import org.lite.ai.enums.AttemptOutcome;
import org.lite.ai.enums.ProviderCapability;
import org.lite.ai.enums.ProviderFailureKind;
import org.lite.ai.enums.ProviderHealthState;
import org.lite.ai.exception.GenerationFailedException;
import org.lite.ai.exception.ProviderException;
import org.lite.ai.provider.ConcurrencyLimiter;
import org.lite.ai.provider.LlmProvider;
import org.lite.ai.provider.LlmProviderFactory;
import org.lite.ai.provider.ProviderHealth;
import org.lite.ai.provider.ProviderHealthTracker;
import org.lite.ai.service.CostAccountingService;
import org.lite.ai.service.ProviderRouterService;
import org.lite.ai.util.TokenEstimator;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

@Service
@Slf4j
public class ProviderRouterServiceImpl implements ProviderRouterService {

    private final List<LlmProvider> providers;
    private final Map<String, ConcurrencyLimiter> limiters = new LinkedHashMap<>();
    private final ProviderHealthTracker healthTracker;
    private final CostAccountingService costAccountingService;
    private final AiGatewayProperties.Router settings;

    @Autowired
    public ProviderRouterServiceImpl(LlmProviderFactory providerFactory,
                                     ProviderHealthTracker healthTracker,
                                     CostAccountingService costAccountingService,
                                     AiGatewayProperties properties) {
        this(providerFactory.createProviders(), healthTracker, costAccountingService, properties);
    }

    public ProviderRouterServiceImpl(List<LlmProvider> providers,
                                     ProviderHealthTracker healthTracker,
                                     CostAccountingService costAccountingService,
                                     AiGatewayProperties properties) {
        this.providers = List.copyOf(providers);
        this.healthTracker = healthTracker;
        this.costAccountingService = costAccountingService;
        this.settings = properties.getRouter();
        for (LlmProvider provider : this.providers) {
            limiters.put(provider.getName(), new ConcurrencyLimiter(provider.getMaxConcurrency()));
        }
    }

    @Override
    public Mono<CompletionResult> complete(CompletionRequest request) {
        if (request.getPrompt() == null || request.getPrompt().isBlank()) {
            return Mono.error(new IllegalArgumentException("prompt is required"));
        }
        long estimatedIn = TokenEstimator.estimate(request.getSystemPrompt()) + TokenEstimator.estimate(request.getPrompt());
        return route(ProviderCapability.COMPLETION, null, estimatedIn,
                provider -> provider.complete(request).map(reply -> completionReply(provider, reply, estimatedIn)))
                .map(routed -> CompletionResult.builder()
                        .text(routed.reply.value.getText())
                        .provider(routed.provider.getName())
                        .model(routed.reply.model)
                        .costRecord(routed.costRecord)
                        .attempts(routed.attempts)
                        .build());
    }

    @Override
    public Mono<EmbeddingResult> embed(List<String> texts, String embeddingModel) {
        if (texts == null || texts.isEmpty()) {
            return Mono.error(new IllegalArgumentException("texts must not be empty"));
        }
        List<String> inputs = List.copyOf(texts);
        long estimatedIn = TokenEstimator.estimate(inputs);
        return route(ProviderCapability.EMBEDDING, embeddingModel, estimatedIn,
                provider -> provider.embed(inputs).map(reply -> embeddingReply(provider, reply, inputs.size(), estimatedIn)))
                .map(routed -> EmbeddingResult.builder()
                        .vectors(routed.reply.value.getVectors())
                        .provider(routed.provider.getName())
                        .model(routed.reply.model)
                        .dim(routed.reply.value.getVectors().get(0).size())
                        .costRecord(routed.costRecord)
                        .attempts(routed.attempts)
                        .build());
    }

    @Override
    public List<ProviderHealthSnapshot> getHealth() {
        List<ProviderHealthSnapshot> snapshots = new ArrayList<>();
        for (LlmProvider provider : providers) {
            ProviderHealth.Snapshot health = healthTracker.get(provider.getName()).snapshot();
            ConcurrencyLimiter limiter = limiters.get(provider.getName());
            snapshots.add(ProviderHealthSnapshot.builder()
                    .name(provider.getName())
                    .state(health.state())
                    .capabilities(provider.getCapabilities())
                    .priority(provider.getPriority())
                    .windowSize(health.windowSize())
                    .failureRate(health.failureRate())
                    .ewmaLatencyMs(health.ewmaLatencyMs())
                    .consecutiveFatal(health.consecutiveFatal())
                    .inFlight(limiter.getInFlight())
                    .maxConcurrency(limiter.getMaxConcurrent())
                    .lastError(health.lastError())
                    .downSince(health.downSince())
                    .build());
        }
        return snapshots;
    }

    /**
     * Sends a minimal request to every DOWN provider whose cooldown has elapsed, so providers can recover
     * without waiting for live traffic to fall through to them.
     */
    @Scheduled(fixedDelayString = "${linqra.ai.router.probe-interval-ms:15000}")
    public void probeDownProviders() {
        for (LlmProvider provider : providers) {
            if (!healthTracker.isProbeDue(provider.getName()) || !healthTracker.tryAdmit(provider.getName())) {
                continue;
            }
            log.info("🔍 Probing provider {} after cooldown", provider.getName());
            probe(provider).subscribe(
                    ok -> log.debug("Probe of {} finished", provider.getName()),
                    error -> log.error("Probe of {} errored: {}", provider.getName(), error.getMessage()));
        }
    }

    Mono<Void> probe(LlmProvider provider) {
        if (provider.supports(ProviderCapability.EMBEDDING)) {
            List<String> ping = List.of("ping");
            return invoke(provider, p -> p.embed(ping).map(reply -> embeddingReply(p, reply, 1, 1)))
                    .flatMap(outcome -> account(provider, ProviderCapability.EMBEDDING, 0, outcome, 1))
                    .then();
        }
        CompletionRequest ping = CompletionRequest.builder().prompt("ping").maxTokens(1).build();
        return invoke(provider, p -> p.complete(ping).map(reply -> completionReply(p, reply, 1)))
                .flatMap(outcome -> account(provider, ProviderCapability.COMPLETION, 0, outcome, 1))
                .then();
    }

    private <T> Mono<Routed<T>> route(ProviderCapability capability, String model, long estimatedIn,
                                      Function<LlmProvider, Mono<Reply<T>>> call) {
        List<LlmProvider> candidates = providers.stream()
                .filter(provider -> provider.supports(capability))
                .filter(provider -> model == null || model.equals(modelOf(provider, capability)))
                .collect(Collectors.toList());
        if (candidates.isEmpty()) {
            return Mono.error(new GenerationFailedException(
                    "No provider configured for " + capability + (model != null ? " with model " + model : ""), 0, null));
        }
        return Mono.defer(() -> attempt(new CallState<>(capability, candidates, estimatedIn, call)));
    }

    private <T> Mono<Routed<T>> attempt(CallState<T> state) {
        if (state.attempts >= Math.max(1, settings.getMaxAttempts())) {
            return Mono.error(exhausted(state));
        }
        LlmProvider provider = select(state);
        if (provider == null) {
            return Mono.error(exhausted(state));
        }
        String name = provider.getName();
        boolean probe = healthTracker.state(name) == ProviderHealthState.DOWN;
        int prior = state.attemptsByProvider.getOrDefault(name, 0);
        Duration delay = prior == 0 ? Duration.ZERO : backoff(prior, state.retryHints.get(name));
        int attemptNumber = ++state.attempts;
        state.attemptsByProvider.merge(name, 1, Integer::sum);

        if (delay.isZero()) {
            log.debug("Attempt {} for {} on provider {}", attemptNumber, state.capability, name);
        } else {
            log.debug("Attempt {} for {} on provider {} after {} ms backoff", attemptNumber, state.capability, name, delay.toMillis());
        }

        Mono<Outcome<T>> execution = invoke(provider, state.call);
        if (!delay.isZero()) {
            execution = Mono.delay(delay).then(execution);
        }
        if (probe) {
            execution = execution.doOnCancel(() -> healthTracker.abandonProbe(name));
        }
        return execution.flatMap(outcome -> account(provider, state.capability, attemptNumber, outcome, state.estimatedIn)
                .flatMap(costRecord -> {
                    if (outcome.error == null) {
                        return Mono.just(new Routed<>(outcome.reply, provider, costRecord, attemptNumber));
                    }
                    onFailure(state, provider, outcome.error);
                    return attempt(state);
                }));
    }

    private <T> Mono<Outcome<T>> invoke(LlmProvider provider, Function<LlmProvider, Mono<Reply<T>>> call) {
        ConcurrencyLimiter limiter = limiters.get(provider.getName());
        return limiter.withPermit(() -> {
            long started = System.nanoTime();
            return Mono.defer(() -> call.apply(provider))
                    .map(reply -> Outcome.success(reply, elapsedMs(started)))
                    .onErrorResume(error -> Mono.just(Outcome.<T>failure(
                            ProviderException.classify(provider.getName(), error), elapsedMs(started))));
        });
    }

    /**
     * Reports the outcome to the health tracker and appends the attempt's cost record.
     */
    private <T> Mono<CostRecord> account(LlmProvider provider, ProviderCapability capability, int attemptNumber,
                                         Outcome<T> outcome, long estimatedIn) {
        CostRecord.CostRecordBuilder record = CostRecord.builder()
                .provider(provider.getName())
                .operation(capability)
                .attempt(attemptNumber)
                .latencyMs(outcome.latencyMs)
                .timestamp(LocalDateTime.now(ZoneOffset.UTC));
        if (outcome.error == null) {
            healthTracker.recordSuccess(provider.getName(), outcome.latencyMs);
            record.model(outcome.reply.model)
                    .tokensIn(outcome.reply.tokensIn)
                    .tokensOut(outcome.reply.tokensOut)
                    .costUsd(costAccountingService.calculateCost(provider, outcome.reply.tokensIn, outcome.reply.tokensOut))
                    .outcome(AttemptOutcome.SUCCESS);
        } else {
            ProviderException error = outcome.error;
            healthTracker.recordFailure(provider.getName(), error.getKind(), error.getMessage(), outcome.latencyMs);
            record.model(modelOf(provider, capability))
                    .tokensIn(estimatedIn)
                    .tokensOut(0)
                    .costUsd(provider.isChargesFailedRequests() ? costAccountingService.calculateCost(provider, estimatedIn, 0) : 0)
                    .outcome(error.getKind() == ProviderFailureKind.TIMEOUT ? AttemptOutcome.TIMEOUT : AttemptOutcome.FAILURE)
                    .errorKind(error.getKind())
                    .errorMessage(error.getMessage());
        }
        return costAccountingService.record(record.build());
    }

    private <T> void onFailure(CallState<T> state, LlmProvider provider, ProviderException error) {
        String name = provider.getName();
        state.lastError = error;
        log.warn("⚠️ Attempt {}/{} for {} on provider {} failed: {}", state.attempts, settings.getMaxAttempts(),
                state.capability, name, error.getMessage());
        switch (error.getKind()) {
            case AUTH_FAILED:
                state.excluded.add(name);
                break;
            case INVALID_RESPONSE:
                if (state.invalidResponses.merge(name, 1, Integer::sum) >= 2) {
                    state.excluded.add(name);
                }
                break;
            case RATE_LIMITED:
                if (error.getRetryAfter() != null) {
                    state.retryHints.put(name, error.getRetryAfter());
                }
                break;
            default:
                break;
        }
    }

    /**
     * Untried healthy/degraded providers first, then already-tried ones (these get backoff), then a DOWN
     * provider whose cooldown allows a probe.
     */
    private <T> LlmProvider select(CallState<T> state) {
        List<LlmProvider> ranked = state.candidates.stream()
                .filter(provider -> !state.excluded.contains(provider.getName()))
                .sorted(Comparator
                        .comparing((LlmProvider provider) -> healthTracker.state(provider.getName()))
                        .thenComparingInt(LlmProvider::getPriority)
                        .thenComparingDouble(provider -> healthTracker.get(provider.getName()).getEwmaLatencyMs())
                        .thenComparing(LlmProvider::getName))
                .collect(Collectors.toList());

        for (LlmProvider provider : ranked) {
            if (!state.attemptsByProvider.containsKey(provider.getName()) && isServing(provider)
                    && healthTracker.tryAdmit(provider.getName())) {
                return provider;
            }
        }
        for (LlmProvider provider : ranked) {
            if (isServing(provider) && healthTracker.tryAdmit(provider.getName())) {
                return provider;
            }
        }
        for (LlmProvider provider : ranked) {
            if (!isServing(provider) && healthTracker.tryAdmit(provider.getName())) {
                log.info("🔍 Routing probe attempt to DOWN provider {}", provider.getName());
                return provider;
            }
        }
        return null;
    }

    private boolean isServing(LlmProvider provider) {
        return healthTracker.state(provider.getName()) != ProviderHealthState.DOWN;
    }

    Duration backoff(int priorAttempts, Duration retryHint) {
        long initial = settings.getInitialBackoff().toMillis();
        long max = settings.getMaxBackoff().toMillis();
        long exponential = initial * (1L << Math.min(20, priorAttempts - 1));
        Duration backoff = Duration.ofMillis(Math.min(exponential, max));
        if (retryHint != null && retryHint.compareTo(backoff) > 0) {
            return retryHint;
        }
        return backoff;
    }

    private <T> GenerationFailedException exhausted(CallState<T> state) {
        ProviderException last = state.lastError;
        String message = last == null
                ? String.format("No eligible %s provider available", state.capability)
                : String.format("All %s attempts failed after %d attempt(s); last error: %s",
                state.capability, state.attempts, last.getMessage());
        log.error("❌ {}", message);
        return new GenerationFailedException(message, state.attempts, last);
    }

    private Reply<ProviderCompletion> completionReply(LlmProvider provider, ProviderCompletion reply, long estimatedIn) {
        if (reply == null || reply.getText() == null || reply.getText().isBlank()) {
            throw ProviderException.invalidResponse(provider.getName(), "Empty completion text");
        }
        return new Reply<>(reply,
                reply.getModel() != null ? reply.getModel() : provider.getCompletionModel(),
                reply.getInputTokens() > 0 ? reply.getInputTokens() : estimatedIn,
                reply.getOutputTokens() > 0 ? reply.getOutputTokens() : TokenEstimator.estimate(reply.getText()));
    }

    private Reply<ProviderEmbedding> embeddingReply(LlmProvider provider, ProviderEmbedding reply, int expected, long estimatedIn) {
        if (reply == null || reply.getVectors() == null || reply.getVectors().size() != expected) {
            throw ProviderException.invalidResponse(provider.getName(), String.format("Expected %d vectors, got %s",
                    expected, reply == null || reply.getVectors() == null ? "none" : reply.getVectors().size()));
        }
        Set<Integer> dims = new HashSet<>();
        for (List<Double> vector : reply.getVectors()) {
            if (vector == null || vector.isEmpty()) {
                throw ProviderException.invalidResponse(provider.getName(), "Missing or empty embedding vector");
            }
            dims.add(vector.size());
        }
        int dim = dims.iterator().next();
        if (dims.size() > 1 || (provider.getEmbeddingDim() > 0 && dim != provider.getEmbeddingDim())) {
            throw ProviderException.invalidResponse(provider.getName(),
                    "Embedding dimension mismatch: got " + dims + ", expected " + provider.getEmbeddingDim());
        }
        return new Reply<>(reply,
                reply.getModel() != null ? reply.getModel() : provider.getEmbeddingModel(),
                reply.getInputTokens() > 0 ? reply.getInputTokens() : estimatedIn,
                0);
    }

    private static String modelOf(LlmProvider provider, ProviderCapability capability) {
        return capability == ProviderCapability.EMBEDDING ? provider.getEmbeddingModel() : provider.getCompletionModel();
    }

    private static long elapsedMs(long startedNanos) {
        return Duration.ofNanos(System.nanoTime() - startedNanos).toMillis();
    }

    private static final class CallState<T> {
        private final ProviderCapability capability;
        private final List<LlmProvider> candidates;
        private final long estimatedIn;
        private final Function<LlmProvider, Mono<Reply<T>>> call;
        private final Map<String, Integer> attemptsByProvider = new HashMap<>();
        private final Map<String, Integer> invalidResponses = new HashMap<>();
        private final Map<String, Duration> retryHints = new HashMap<>();
        private final Set<String> excluded = new HashSet<>();
        private int attempts;
        private ProviderException lastError;

        private CallState(ProviderCapability capability, List<LlmProvider> candidates, long estimatedIn,
                          Function<LlmProvider, Mono<Reply<T>>> call) {
            this.capability = capability;
            this.candidates = candidates;
            this.estimatedIn = estimatedIn;
            this.call = call;
        }
    }

    private static final class Reply<T> {
        private final T value;
        private final String model;
        private final long tokensIn;
        private final long tokensOut;

        private Reply(T value, String model, long tokensIn, long tokensOut) {
            this.value = value;
            this.model = model;
            this.tokensIn = tokensIn;
            this.tokensOut = tokensOut;
        }
    }

    private static final class Outcome<T> {
        private final Reply<T> reply;
        private final ProviderException error;
        private final long latencyMs;

        private Outcome(Reply<T> reply, ProviderException error, long latencyMs) {
            this.reply = reply;
            this.error = error;
            this.latencyMs = latencyMs;
        }

        static <T> Outcome<T> success(Reply<T> reply, long latencyMs) {
            return new Outcome<>(reply, null, latencyMs);
        }

        static <T> Outcome<T> failure(ProviderException error, long latencyMs) {
            return new Outcome<>(null, error, latencyMs);
        }
    }

    private static final class Routed<T> {
        private final Reply<T> reply;
        private final LlmProvider provider;
        private final CostRecord costRecord;
        private final int attempts;

        private Routed(Reply<T> reply, LlmProvider provider, CostRecord costRecord, int attempts) {
            this.reply = reply;
            this.provider = provider;
            this.costRecord = costRecord;
            this.attempts = attempts;
        }
    }
}
