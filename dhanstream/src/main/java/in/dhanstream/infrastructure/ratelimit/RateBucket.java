package in.dhanstream.infrastructure.ratelimit;

/**
 * Call counter for one window of one tier. Not thread-safe: every access happens under the owning
 * tier's lock.
 */
final class RateBucket {

    private final RateWindow window;
    private final long windowNanos;
    private long windowStart;
    private int count;

    RateBucket(RateWindow window, long now) {
        this.window = window;
        this.windowNanos = window.duration().toNanos();
        this.windowStart = now;
    }

    /**
     * Move to the window containing {@code now}, clearing the count when a boundary was crossed.
     */
    void roll(long now) {
        long elapsed = now - windowStart;
        if (elapsed >= windowNanos) {
            windowStart += (elapsed / windowNanos) * windowNanos;
            count = 0;
        }
    }

    boolean hasToken() {
        return count < window.capacity();
    }

    void take() {
        if (count >= window.capacity()) {
            throw new IllegalStateException("bucket " + window + " is exhausted");
        }
        count++;
    }

    long nanosUntilReset(long now) {
        return Math.max(1L, windowStart + windowNanos - now);
    }

    int count() {
        return count;
    }

    RateWindow window() {
        return window;
    }
}
