package service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.lite.ai.config.AiGatewayProperties;
import org.lite.ai.enums.ProviderFailureKind;
import org.lite.ai.enums.ProviderHealthState;
import org.lite.ai.provider.ProviderHealthTracker;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

class ProviderHealthTrackerTest {

    private static final String PROVIDER = "primary";

    private MutableClock clock;
    private ProviderHealthTracker tracker;

    @BeforeEach
    void setUp() {
        AiGatewayProperties properties = new AiGatewayProperties();
        properties.getRouter().setHealthWindowSize(10);
        properties.getRouter().setHealthMinSamples(4);
        properties.getRouter().setDegradedFailureRate(0.5);
        properties.getRouter().setDownAfterConsecutiveFatal(3);
        properties.getRouter().setDownCooldown(Duration.ofSeconds(30));
        clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
        tracker = new ProviderHealthTracker(properties, clock);
    }

    private void fail(ProviderFailureKind kind) {
        tracker.recordFailure(PROVIDER, kind, kind.name().toLowerCase(), 120);
    }

    @Test
    void testFailureRateDegradesOnlyOnceMinSamplesAreReached() {
        // Given
        tracker.recordSuccess(PROVIDER, 80);
        fail(ProviderFailureKind.TIMEOUT);
        fail(ProviderFailureKind.TIMEOUT);
        assertEquals(ProviderHealthState.HEALTHY, tracker.state(PROVIDER), "Three samples are below the minimum");

        // When
        fail(ProviderFailureKind.TIMEOUT);

        // Then
        assertEquals(ProviderHealthState.DEGRADED, tracker.state(PROVIDER));
        assertEquals(0.75, tracker.get(PROVIDER).snapshot().failureRate(), 1e-9);
        assertTrue(tracker.tryAdmit(PROVIDER), "Degraded providers still take traffic");
    }

    @Test
    void testDegradedProviderRecoversWhenFailureRateDrops() {
        // Given
        tracker.recordSuccess(PROVIDER, 80);
        fail(ProviderFailureKind.TIMEOUT);
        fail(ProviderFailureKind.TIMEOUT);
        fail(ProviderFailureKind.TIMEOUT);
        assertEquals(ProviderHealthState.DEGRADED, tracker.state(PROVIDER));

        // When / Then
        tracker.recordSuccess(PROVIDER, 80);
        assertEquals(ProviderHealthState.DEGRADED, tracker.state(PROVIDER), "3 of 5 still failed");
        tracker.recordSuccess(PROVIDER, 80);
        assertEquals(ProviderHealthState.HEALTHY, tracker.state(PROVIDER));
    }

    @Test
    void testConsecutiveFatalErrorsTakeDegradedProviderDown() {
        // Given
        for (int i = 0; i < 4; i++) {
            fail(ProviderFailureKind.TIMEOUT);
        }
        assertEquals(ProviderHealthState.DEGRADED, tracker.state(PROVIDER));

        // When
        fail(ProviderFailureKind.INVALID_RESPONSE);
        fail(ProviderFailureKind.INVALID_RESPONSE);
        assertEquals(ProviderHealthState.DEGRADED, tracker.state(PROVIDER), "Two fatal errors are not enough");
        fail(ProviderFailureKind.INVALID_RESPONSE);

        // Then
        assertEquals(ProviderHealthState.DOWN, tracker.state(PROVIDER));
        assertEquals(clock.instant(), tracker.get(PROVIDER).snapshot().downSince());
        assertFalse(tracker.tryAdmit(PROVIDER));
    }

    @Test
    void testSuccessBreaksTheFatalStreak() {
        // Given
        for (int i = 0; i < 4; i++) {
            fail(ProviderFailureKind.TIMEOUT);
        }
        fail(ProviderFailureKind.INVALID_RESPONSE);
        fail(ProviderFailureKind.INVALID_RESPONSE);

        // When
        tracker.recordSuccess(PROVIDER, 80);
        fail(ProviderFailureKind.INVALID_RESPONSE);

        // Then
        assertEquals(1, tracker.get(PROVIDER).snapshot().consecutiveFatal());
        assertNotEquals(ProviderHealthState.DOWN, tracker.state(PROVIDER));
    }

    @Test
    void testDownProviderAdmitsOneAttemptAfterCooldownAndRecoversOnSuccess() {
        // Given
        fail(ProviderFailureKind.AUTH_FAILED);
        assertEquals(ProviderHealthState.DOWN, tracker.state(PROVIDER));

        // When / Then
        clock.advance(Duration.ofSeconds(29));
        assertFalse(tracker.isProbeDue(PROVIDER));
        assertFalse(tracker.tryAdmit(PROVIDER), "Cooldown has not elapsed");

        clock.advance(Duration.ofSeconds(1));
        assertTrue(tracker.isProbeDue(PROVIDER));
        assertTrue(tracker.tryAdmit(PROVIDER), "First attempt after the cooldown goes through");
        assertFalse(tracker.tryAdmit(PROVIDER), "Only one attempt while it is outstanding");
        assertFalse(tracker.isProbeDue(PROVIDER));

        tracker.recordSuccess(PROVIDER, 90);
        assertEquals(ProviderHealthState.HEALTHY, tracker.state(PROVIDER));
        assertTrue(tracker.tryAdmit(PROVIDER));
        assertTrue(tracker.tryAdmit(PROVIDER));
        assertEquals(0, tracker.get(PROVIDER).snapshot().windowSize());
    }

    @Test
    void testFailedAttemptAfterCooldownRestartsIt() {
        // Given
        fail(ProviderFailureKind.AUTH_FAILED);
        clock.advance(Duration.ofSeconds(30));
        assertTrue(tracker.tryAdmit(PROVIDER));

        // When
        fail(ProviderFailureKind.TIMEOUT);

        // Then
        assertEquals(ProviderHealthState.DOWN, tracker.state(PROVIDER));
        clock.advance(Duration.ofSeconds(15));
        assertFalse(tracker.tryAdmit(PROVIDER));
        clock.advance(Duration.ofSeconds(15));
        assertTrue(tracker.tryAdmit(PROVIDER));
    }

    @Test
    void testAbandonedAttemptFreesTheSlot() {
        fail(ProviderFailureKind.AUTH_FAILED);
        clock.advance(Duration.ofSeconds(30));
        assertTrue(tracker.tryAdmit(PROVIDER));

        tracker.abandonProbe(PROVIDER);

        assertTrue(tracker.tryAdmit(PROVIDER));
        assertEquals(ProviderHealthState.DOWN, tracker.state(PROVIDER));
    }

    private static final class MutableClock extends Clock {
        private Instant now;

        private MutableClock(Instant now) {
            this.now = now;
        }

        void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
