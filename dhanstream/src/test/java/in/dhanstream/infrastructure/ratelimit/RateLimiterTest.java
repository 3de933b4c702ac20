package in.dhanstream.infrastructure.ratelimit;

import in.dhanstream.infrastructure.metrics.StreamMetrics;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Unit tests for RateLimiter.
 *
 * Tests:
 * - Every window of a tier is charged
 * - Windows roll over independently
 * - Callers block instead of failing
 * - Tiers do not share quota
 */
class RateLimiterTest {

    private static Map<RateTier, List<RateWindow>> limits(RateTier tier, RateWindow... windows) {
        Map<RateTier, List<RateWindow>> limits = new EnumMap<>(RateTier.class);
        limits.put(tier, List.of(windows));
        return limits;
    }

    @Test
    void testDefaultLimits() {
        Map<RateTier, List<RateWindow>> defaults = RateLimiter.defaultLimits();

        assertEquals(List.of(RateWindow.perSecond(25), RateWindow.perMinute(250), RateWindow.perHour(1000),
            RateWindow.perDay(7000)), defaults.get(RateTier.ORDER_API));
        assertEquals(List.of(RateWindow.perSecond(1)), defaults.get(RateTier.QUOTE_API));
        assertEquals(new RateWindow(Duration.ofSeconds(3), 1), defaults.get(RateTier.OPTION_CHAIN).get(0));
        assertEquals(RateTier.values().length, defaults.size());
    }

    @Test
    void testEveryWindowIsCharged() throws InterruptedException {
        AtomicLong nanos = new AtomicLong(0);
        RateLimiter limiter = new RateLimiter(RateLimiter.defaultLimits(), StreamMetrics.NOOP, nanos::get);

        for (int i = 0; i < 3; i++) {
            limiter.throttle(RateTier.ORDER_API);
        }

        assertEquals(List.of(3, 3, 3, 3), limiter.counts(RateTier.ORDER_API));
        assertEquals(22, limiter.available(RateTier.ORDER_API), "Per-second window is the tightest");
        assertEquals(List.of(0, 0), limiter.counts(RateTier.DATA_API), "Other tiers untouched");
    }

    @Test
    void testWindowsRollOverIndependently() throws InterruptedException {
        AtomicLong nanos = new AtomicLong(0);
        RateLimiter limiter = new RateLimiter(RateLimiter.defaultLimits(), StreamMetrics.NOOP, nanos::get);
        for (int i = 0; i < 3; i++) {
            limiter.throttle(RateTier.ORDER_API);
        }

        nanos.set(TimeUnit.SECONDS.toNanos(1));
        assertEquals(List.of(0, 3, 3, 3), limiter.counts(RateTier.ORDER_API), "Second boundary crossed");

        nanos.set(TimeUnit.SECONDS.toNanos(61));
        assertEquals(List.of(0, 0, 3, 3), limiter.counts(RateTier.ORDER_API), "Minute boundary crossed");

        nanos.set(TimeUnit.HOURS.toNanos(25));
        assertEquals(List.of(0, 0, 0, 0), limiter.counts(RateTier.ORDER_API));
    }

    @Test
    void testMinuteWindowLimitsBurstsAcrossSeconds() throws InterruptedException {
        AtomicLong nanos = new AtomicLong(0);
        RateLimiter limiter = new RateLimiter(
            limits(RateTier.ORDER_API, RateWindow.perSecond(25), RateWindow.perMinute(250)),
            StreamMetrics.NOOP, nanos::get);

        for (int second = 0; second < 10; second++) {
            nanos.set(TimeUnit.SECONDS.toNanos(second));
            for (int i = 0; i < 25; i++) {
                limiter.throttle(RateTier.ORDER_API);
            }
        }

        nanos.set(TimeUnit.SECONDS.toNanos(10));
        assertEquals(0, limiter.available(RateTier.ORDER_API), "Minute quota spent although a new second started");
    }

    @Test
    void testSecondCallerWaitsForNextWindow() throws Exception {
        RateLimiter limiter = new RateLimiter(limits(RateTier.QUOTE_API, RateWindow.perSecond(1)), StreamMetrics.NOOP);
        ExecutorService pool = Executors.newFixedThreadPool(2);
        CountDownLatch go = new CountDownLatch(1);
        long start = System.nanoTime();

        List<Future<Long>> done = new ArrayList<>();
        for (int i = 0; i < 2; i++) {
            done.add(pool.submit(() -> {
                go.await();
                limiter.throttle(RateTier.QUOTE_API);
                return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
            }));
        }
        go.countDown();
        long first = Math.min(done.get(0).get(5, TimeUnit.SECONDS), done.get(1).get(5, TimeUnit.SECONDS));
        long second = Math.max(done.get(0).get(), done.get(1).get());
        pool.shutdownNow();

        assertTrue(first < 500, "First call proceeds at once: " + first + "ms");
        assertTrue(second >= 900, "Second call waits for the next second: " + second + "ms");
    }

    @Test
    void testTiersAreIndependent() throws InterruptedException {
        Map<RateTier, List<RateWindow>> limits = new EnumMap<>(RateTier.class);
        limits.put(RateTier.QUOTE_API, List.of(RateWindow.perMinute(1)));
        limits.put(RateTier.DATA_API, List.of(RateWindow.perSecond(5)));
        RateLimiter limiter = new RateLimiter(limits, StreamMetrics.NOOP);

        limiter.throttle(RateTier.QUOTE_API);
        assertEquals(0, limiter.available(RateTier.QUOTE_API));

        long start = System.nanoTime();
        for (int i = 0; i < 5; i++) {
            limiter.throttle(RateTier.DATA_API);
        }
        assertTrue(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start) < 500,
            "DATA_API not slowed by an exhausted QUOTE_API");
    }

    @Test
    void testConcurrentCallersNeverOverdraw() throws Exception {
        RateLimiter limiter = new RateLimiter(
            limits(RateTier.NON_TRADING_API, new RateWindow(Duration.ofMillis(300), 5)), StreamMetrics.NOOP);
        int threads = 8;
        int callsPerThread = 3;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        List<Future<?>> futures = new ArrayList<>();

        long start = System.nanoTime();
        for (int t = 0; t < threads; t++) {
            futures.add(pool.submit(() -> {
                for (int i = 0; i < callsPerThread; i++) {
                    limiter.throttle(RateTier.NON_TRADING_API);
                }
                return null;
            }));
        }
        for (Future<?> future : futures) {
            future.get(10, TimeUnit.SECONDS);
        }
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
        pool.shutdownNow();

        // 24 calls at 5 per 300ms need at least five windows
        assertTrue(elapsedMs >= 1_100, "Calls spread over windows: " + elapsedMs + "ms");
        assertTrue(limiter.counts(RateTier.NON_TRADING_API).get(0) <= 5);
    }

    @Test
    void testInterruptedWaitConsumesNothing() throws Exception {
        RateLimiter limiter = new RateLimiter(limits(RateTier.QUOTE_API, RateWindow.perMinute(1)), StreamMetrics.NOOP);
        limiter.throttle(RateTier.QUOTE_API);
        AtomicReference<Throwable> failure = new AtomicReference<>();

        Thread waiter = new Thread(() -> {
            try {
                limiter.throttle(RateTier.QUOTE_API);
            } catch (Throwable t) {
                failure.set(t);
            }
        });
        waiter.start();
        Thread.sleep(100);
        waiter.interrupt();
        waiter.join(2_000);

        assertTrue(failure.get() instanceof InterruptedException);
        assertEquals(List.of(1), limiter.counts(RateTier.QUOTE_API));
    }

    @Test
    void testUnconfiguredTierIsUnlimited() throws Exception {
        RateLimiter limiter = new RateLimiter(limits(RateTier.QUOTE_API, RateWindow.perSecond(1)), StreamMetrics.NOOP);

        for (int i = 0; i < 100; i++) {
            limiter.throttle(RateTier.ORDER_API);
        }
        assertEquals(Integer.MAX_VALUE, limiter.available(RateTier.ORDER_API));
        assertTrue(limiter.counts(RateTier.ORDER_API).isEmpty());
        assertEquals("ok", limiter.call(RateTier.ORDER_API, () -> "ok"));
    }

    @Test
    void testWaitIsReportedToMetrics() throws Exception {
        StreamMetrics metrics = mock(StreamMetrics.class);
        RateLimiter limiter = new RateLimiter(
            limits(RateTier.QUOTE_API, new RateWindow(Duration.ofMillis(100), 1)), metrics);

        limiter.throttle(RateTier.QUOTE_API);
        verify(metrics, never()).recordThrottleWait(any(), any());

        limiter.throttle(RateTier.QUOTE_API);
        verify(metrics).recordThrottleWait(eq("QUOTE_API"), any(Duration.class));
    }

    @Test
    void testWindowValidation() {
        assertThrows(IllegalArgumentException.class, () -> new RateWindow(Duration.ZERO, 1));
        assertThrows(IllegalArgumentException.class, () -> RateWindow.perSecond(0));
    }
}
