package service;

import org.junit.jupiter.api.Test;
import org.lite.ai.provider.ConcurrencyLimiter;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.concurrent.TimeoutException;

import static org.junit.jupiter.api.Assertions.*;

class ConcurrencyLimiterTest {

    @Test
    void testCallsBeyondTheLimitWaitForAPermit() {
        // Given
        ConcurrencyLimiter limiter = new ConcurrencyLimiter(1);
        Sinks.One<String> first = Sinks.one();
        Disposable running = limiter.withPermit(first::asMono).subscribe();

        // When
        String[] second = new String[1];
        limiter.withPermit(() -> Mono.just("second")).subscribe(value -> second[0] = value);

        // Then
        assertEquals(1, limiter.getInFlight());
        assertEquals(1, limiter.getWaiting());
        assertNull(second[0]);

        first.tryEmitValue("first");
        assertEquals("second", second[0]);
        assertEquals(0, limiter.getInFlight());
        assertEquals(0, limiter.getWaiting());
        running.dispose();
    }

    @Test
    void testCancelledWaiterLeavesTheQueue() {
        // Given
        ConcurrencyLimiter limiter = new ConcurrencyLimiter(1);
        Sinks.One<String> first = Sinks.one();
        limiter.withPermit(first::asMono).subscribe();
        Disposable waiting = limiter.withPermit(() -> Mono.just("never")).subscribe();
        assertEquals(1, limiter.getWaiting());

        // When
        waiting.dispose();
        first.tryEmitValue("done");

        // Then
        assertEquals(0, limiter.getWaiting());
        assertEquals(0, limiter.getInFlight());
    }

    @Test
    void testPermitsAreNotLostWhenWaitersTimeOutDuringHandOver() {
        // Given
        ConcurrencyLimiter limiter = new ConcurrencyLimiter(2);

        // When
        Long timedOut = Flux.range(0, 2000)
                .flatMap(i -> limiter.withPermit(() -> Mono.delay(Duration.ofNanos(20_000L + (i % 5) * 10_000L)).thenReturn(1L))
                        .timeout(Duration.ofNanos(30_000L + (i % 3) * 15_000L))
                        .onErrorResume(TimeoutException.class, e -> Mono.just(0L))
                        .subscribeOn(Schedulers.parallel()), 64)
                .filter(result -> result == 0L)
                .count()
                .block(Duration.ofSeconds(30));

        // Then
        assertTrue(timedOut > 0, "Some callers should have given up while queued");
        Integer inFlight = Flux.interval(Duration.ofMillis(10))
                .map(tick -> limiter.getInFlight())
                .filter(count -> count == 0)
                .next()
                .block(Duration.ofSeconds(5));
        assertEquals(0, inFlight);
        assertEquals(0, limiter.getWaiting());

        String after = limiter.withPermit(() -> Mono.just("still usable")).block(Duration.ofSeconds(1));
        assertEquals("still usable", after);
    }
}
