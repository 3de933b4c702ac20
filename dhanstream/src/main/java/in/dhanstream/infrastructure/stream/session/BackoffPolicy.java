package in.dhanstream.infrastructure.stream.session;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Reconnect delay policy: exponential backoff with a cap and proportional jitter, no attempt limit.
 *
 * The delay after the N-th consecutive abnormal close is {@code min(base * multiplier^(N-1), max)} plus a
 * uniform jitter in {@code [0, jitterRatio)} of that value. Rate-limit rejections use a fixed cooloff
 * instead and leave the failure count alone.
 *
 * Usage:
 * <pre>
 * BackoffPolicy policy = BackoffPolicy.builder()
 *     .baseDelay(Duration.ofSeconds(2))
 *     .maxDelay(Duration.ofSeconds(90))
 *     .build();
 *
 * Duration wait = policy.recordAbnormalClose();   // 2s..2.4s
 * policy.reset();                                 // after a clean close
 * </pre>
 */
public class BackoffPolicy {

    private final Duration baseDelay;
    private final Duration maxDelay;
    private final double multiplier;
    private final double jitterRatio;
    private final Duration cooloff;
    private final DoubleSupplier random;

    private int consecutiveFailures = 0;

    private BackoffPolicy(Builder builder) {
        this.baseDelay = builder.baseDelay;
        this.maxDelay = builder.maxDelay;
        this.multiplier = builder.multiplier;
        this.jitterRatio = builder.jitterRatio;
        this.cooloff = builder.cooloff;
        this.random = builder.random;
    }

    /**
     * Count one more abnormal close and return the delay before the next attempt.
     */
    public synchronized Duration recordAbnormalClose() {
        consecutiveFailures++;
        return delayFor(consecutiveFailures);
    }

    /**
     * Back to the base delay. Called only after a clean close.
     */
    public synchronized void reset() {
        consecutiveFailures = 0;
    }

    public synchronized int getConsecutiveFailures() {
        return consecutiveFailures;
    }

    /**
     * Delay for the {@code attempt}-th consecutive failure, jitter included.
     */
    public Duration delayFor(int attempt) {
        long capped = cappedDelayMillis(attempt);
        long jitter = (long) (capped * jitterRatio * random.getAsDouble());
        return Duration.ofMillis(capped + jitter);
    }

    /**
     * Delay for the {@code attempt}-th consecutive failure without jitter.
     */
    public long cappedDelayMillis(int attempt) {
        if (attempt < 1) {
            throw new IllegalArgumentException("attempt starts at 1");
        }
        double raw = baseDelay.toMillis() * Math.pow(multiplier, attempt - 1);
        return (long) Math.min(raw, maxDelay.toMillis());
    }

    public Duration getBaseDelay() {
        return baseDelay;
    }

    public Duration getMaxDelay() {
        return maxDelay;
    }

    public double getJitterRatio() {
        return jitterRatio;
    }

    public Duration getCooloff() {
        return cooloff;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * 2s base, doubling, 90s cap, 20% jitter, 60s rate-limit cooloff.
     */
    public static BackoffPolicy defaults() {
        return builder().build();
    }

    public static class Builder {
        private Duration baseDelay = Duration.ofSeconds(2);
        private Duration maxDelay = Duration.ofSeconds(90);
        private double multiplier = 2.0;
        private double jitterRatio = 0.2;
        private Duration cooloff = Duration.ofSeconds(60);
        private DoubleSupplier random = () -> ThreadLocalRandom.current().nextDouble();

        public Builder baseDelay(Duration baseDelay) {
            if (baseDelay.isNegative() || baseDelay.isZero()) {
                throw new IllegalArgumentException("Base delay must be positive");
            }
            this.baseDelay = baseDelay;
            return this;
        }

        public Builder maxDelay(Duration maxDelay) {
            if (maxDelay.isNegative() || maxDelay.isZero()) {
                throw new IllegalArgumentException("Max delay must be positive");
            }
            this.maxDelay = maxDelay;
            return this;
        }

        public Builder multiplier(double multiplier) {
            if (multiplier <= 1.0) {
                throw new IllegalArgumentException("Multiplier must be greater than 1.0");
            }
            this.multiplier = multiplier;
            return this;
        }

        public Builder jitterRatio(double jitterRatio) {
            if (jitterRatio < 0.0 || jitterRatio > 1.0) {
                throw new IllegalArgumentException("Jitter ratio must be within [0, 1]");
            }
            this.jitterRatio = jitterRatio;
            return this;
        }

        public Builder cooloff(Duration cooloff) {
            if (cooloff.isNegative() || cooloff.isZero()) {
                throw new IllegalArgumentException("Cooloff must be positive");
            }
            this.cooloff = cooloff;
            return this;
        }

        /**
         * Source of uniform values in [0, 1) for jitter.
         */
        public Builder random(DoubleSupplier random) {
            this.random = random;
            return this;
        }

        public BackoffPolicy build() {
            if (baseDelay.compareTo(maxDelay) > 0) {
                throw new IllegalArgumentException("Base delay cannot exceed max delay");
            }
            return new BackoffPolicy(this);
        }
    }
}
