package in.dhanstream.infrastructure.stream.session;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for BackoffPolicy.
 *
 * Tests:
 * - Exponential growth and cap
 * - Jitter bounds
 * - Reset and close classification
 */
class BackoffPolicyTest {

    @Test
    void testDefaults() {
        BackoffPolicy policy = BackoffPolicy.defaults();

        assertEquals(Duration.ofSeconds(2), policy.getBaseDelay());
        assertEquals(Duration.ofSeconds(90), policy.getMaxDelay());
        assertEquals(Duration.ofSeconds(60), policy.getCooloff());
        assertEquals(0.2, policy.getJitterRatio(), 1e-9);
        assertEquals(0, policy.getConsecutiveFailures());
    }

    @Test
    void testConsecutiveFailuresFollowCappedDoubling() {
        BackoffPolicy policy = BackoffPolicy.builder().random(() -> 0.0).build();

        long[] expectedMs = {2_000, 4_000, 8_000, 16_000, 32_000, 64_000, 90_000, 90_000, 90_000};
        for (int n = 1; n <= expectedMs.length; n++) {
            Duration delay = policy.recordAbnormalClose();
            assertEquals(n, policy.getConsecutiveFailures());
            assertEquals(expectedMs[n - 1], delay.toMillis(), "Delay for failure #" + n);
        }
    }

    @Test
    void testJitterStaysWithinTwentyPercent() {
        AtomicReference<Double> next = new AtomicReference<>(0.0);
        BackoffPolicy policy = BackoffPolicy.builder().random(next::get).build();

        for (int n = 1; n <= 10; n++) {
            long capped = policy.cappedDelayMillis(n);
            next.set(0.0);
            assertEquals(capped, policy.delayFor(n).toMillis(), "No jitter at 0.0");
            next.set(0.999999);
            long high = policy.delayFor(n).toMillis();
            assertTrue(high >= capped && high < capped * 1.2 + 1, "Jitter below 20% for #" + n + ": " + high);
        }
    }

    @Test
    void testRealRandomJitterBounds() {
        BackoffPolicy policy = BackoffPolicy.defaults();
        for (int i = 0; i < 500; i++) {
            long delay = policy.delayFor(3).toMillis();
            assertTrue(delay >= 8_000 && delay < 9_600, "8s plus at most 20%: " + delay);
        }
    }

    @Test
    void testResetReturnsToBase() {
        BackoffPolicy policy = BackoffPolicy.builder().random(() -> 0.0).build();
        policy.recordAbnormalClose();
        policy.recordAbnormalClose();
        policy.recordAbnormalClose();

        policy.reset();

        assertEquals(0, policy.getConsecutiveFailures());
        assertEquals(Duration.ofSeconds(2), policy.recordAbnormalClose(), "First delay after reset is base");
    }

    @Test
    void testBuilderValidation() {
        assertThrows(IllegalArgumentException.class, () -> BackoffPolicy.builder().baseDelay(Duration.ZERO));
        assertThrows(IllegalArgumentException.class, () -> BackoffPolicy.builder().multiplier(1.0));
        assertThrows(IllegalArgumentException.class, () -> BackoffPolicy.builder().jitterRatio(1.5));
        assertThrows(IllegalArgumentException.class, () -> BackoffPolicy.builder()
            .baseDelay(Duration.ofSeconds(10)).maxDelay(Duration.ofSeconds(5)).build());
        assertThrows(IllegalArgumentException.class, () -> BackoffPolicy.defaults().cappedDelayMillis(0));
    }

    @Test
    void testCloseClassification() {
        assertEquals(CloseKind.CLEAN, CloseKind.classify(1000, "bye"));
        assertEquals(CloseKind.RATE_LIMITED, CloseKind.classify(1000, "HTTP 429 too many requests"));
        assertEquals(CloseKind.RATE_LIMITED, CloseKind.classify(1008, "429"));
        assertEquals(CloseKind.ABNORMAL, CloseKind.classify(1006, ""));
        assertEquals(CloseKind.ABNORMAL, CloseKind.classify(1011, null));

        assertEquals(CloseKind.RATE_LIMITED, CloseKind.fromHandshakeStatus(429));
        assertEquals(CloseKind.AUTH_REJECTED, CloseKind.fromHandshakeStatus(401));
        assertEquals(CloseKind.AUTH_REJECTED, CloseKind.fromHandshakeStatus(403));
        assertEquals(CloseKind.ABNORMAL, CloseKind.fromHandshakeStatus(502));
    }
}
