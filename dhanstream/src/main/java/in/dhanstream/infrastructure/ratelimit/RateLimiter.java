package in.dhanstream.infrastructure.ratelimit;

import in.dhanstream.infrastructure.metrics.StreamMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.LongSupplier;

/**
 * Blocking multi-window quota guard for outbound REST calls.
 *
 * Every tier owns an independent bucket set behind one lock. {@link #throttle} waits until each window of
 * the tier has a token left, then takes one from all of them in the same critical section. Window
 * roll-over happens under that same lock, when the next caller observes a crossed boundary.
 *
 * Usage:
 * <pre>
 * RateLimiter limiter = new RateLimiter();
 * limiter.throttle(RateTier.ORDER_API);
 * httpClient.send(placeOrderRequest, ...);
 * </pre>
 */
public class RateLimiter {
    private static final Logger log = LoggerFactory.getLogger(RateLimiter.class);

    private final Map<RateTier, TierBuckets> tiers = new EnumMap<>(RateTier.class);
    private final LongSupplier nanoClock;
    private final StreamMetrics metrics;

    /**
     * Limiter with the broker's published limits for every tier.
     */
    public RateLimiter() {
        this(defaultLimits(), StreamMetrics.NOOP);
    }

    /**
     * @param limits  windows per tier; tiers absent from the map, or mapped to no windows, are unlimited
     * @param metrics sink for throttle waits
     */
    public RateLimiter(Map<RateTier, List<RateWindow>> limits, StreamMetrics metrics) {
        this(limits, metrics, System::nanoTime);
    }

    RateLimiter(Map<RateTier, List<RateWindow>> limits, StreamMetrics metrics, LongSupplier nanoClock) {
        this.metrics = metrics;
        this.nanoClock = nanoClock;
        long now = nanoClock.getAsLong();
        for (Map.Entry<RateTier, List<RateWindow>> entry : limits.entrySet()) {
            if (!entry.getValue().isEmpty()) {
                tiers.put(entry.getKey(), new TierBuckets(entry.getKey(), entry.getValue(), now));
            }
        }
        log.info("[RATE-LIMIT] Configured tiers: {}", tiers.keySet());
    }

    /**
     * Get the default windows of every tier.
     *
     * @return mutable map of {@link RateTier#defaultWindows()} per tier
     */
    public static Map<RateTier, List<RateWindow>> defaultLimits() {
        Map<RateTier, List<RateWindow>> limits = new EnumMap<>(RateTier.class);
        for (RateTier tier : RateTier.values()) {
            limits.put(tier, tier.defaultWindows());
        }
        return limits;
    }

    /**
     * Block until every window of {@code tier} has a token, then consume one from each.
     * A tier with no configured windows is unlimited.
     *
     * @param tier endpoint group the caller is about to hit
     * @throws InterruptedException if interrupted while waiting; no token is consumed in that case
     */
    public void throttle(RateTier tier) throws InterruptedException {
        TierBuckets buckets = tiers.get(tier);
        if (buckets == null) {
            return;
        }
        long waitedNanos = buckets.acquire();
        if (waitedNanos > 0) {
            log.debug("[RATE-LIMIT] {} waited {}ms", tier, TimeUnit.NANOSECONDS.toMillis(waitedNanos));
            metrics.recordThrottleWait(tier.name(), Duration.ofNanos(waitedNanos));
        }
    }

    /**
     * Throttle, then run the call. Intended for REST executors.
     *
     * @param tier endpoint group the call belongs to
     * @param call the request to run once a token is taken
     * @return the call's result
     * @throws InterruptedException if interrupted while waiting for a token
     * @throws Exception whatever the call throws
     */
    public <T> T call(RateTier tier, Callable<T> call) throws Exception {
        throttle(tier);
        return call.call();
    }

    /**
     * Get the tokens left in the most constrained window of a tier, after rolling expired windows.
     *
     * @param tier tier to inspect
     * @return remaining calls allowed right now, or {@link Integer#MAX_VALUE} for an unlimited tier
     */
    public int available(RateTier tier) {
        TierBuckets buckets = tiers.get(tier);
        return buckets == null ? Integer.MAX_VALUE : buckets.available();
    }

    /**
     * Get the calls counted in each window of a tier, after rolling expired windows.
     *
     * @param tier tier to inspect
     * @return one count per configured window, in configuration order; empty for an unlimited tier
     */
    public List<Integer> counts(RateTier tier) {
        TierBuckets buckets = tiers.get(tier);
        return buckets == null ? Collections.emptyList() : buckets.counts();
    }

    private final class TierBuckets {
        private final RateTier tier;
        private final List<RateBucket> buckets = new ArrayList<>();
        private final ReentrantLock lock = new ReentrantLock(true);
        private final Condition windowOpened = lock.newCondition();

        TierBuckets(RateTier tier, List<RateWindow> windows, long now) {
            this.tier = tier;
            for (RateWindow window : windows) {
                buckets.add(new RateBucket(window, now));
            }
        }

        /**
         * @return nanoseconds spent waiting
         */
        long acquire() throws InterruptedException {
            long start = nanoClock.getAsLong();
            boolean waited = false;
            lock.lockInterruptibly();
            try {
                while (true) {
                    long now = nanoClock.getAsLong();
                    long waitNanos = 0;
                    for (RateBucket bucket : buckets) {
                        bucket.roll(now);
                        if (!bucket.hasToken()) {
                            waitNanos = Math.max(waitNanos, bucket.nanosUntilReset(now));
                        }
                    }
                    if (waitNanos == 0) {
                        for (RateBucket bucket : buckets) {
                            bucket.take();
                        }
                        return waited ? nanoClock.getAsLong() - start : 0;
                    }
                    if (!waited) {
                        log.debug("[RATE-LIMIT] {} exhausted, waiting {}ms", tier,
                            TimeUnit.NANOSECONDS.toMillis(waitNanos));
                    }
                    waited = true;
                    windowOpened.awaitNanos(waitNanos);
                }
            } finally {
                lock.unlock();
            }
        }

        int available() {
            lock.lock();
            try {
                long now = nanoClock.getAsLong();
                int min = Integer.MAX_VALUE;
                for (RateBucket bucket : buckets) {
                    bucket.roll(now);
                    min = Math.min(min, bucket.window().capacity() - bucket.count());
                }
                return min;
            } finally {
                lock.unlock();
            }
        }

        List<Integer> counts() {
            lock.lock();
            try {
                long now = nanoClock.getAsLong();
                List<Integer> out = new ArrayList<>(buckets.size());
                for (RateBucket bucket : buckets) {
                    bucket.roll(now);
                    out.add(bucket.count());
                }
                return out;
            } finally {
                lock.unlock();
            }
        }
    }
}
