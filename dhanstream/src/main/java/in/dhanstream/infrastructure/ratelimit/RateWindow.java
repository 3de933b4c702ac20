package in.dhanstream.infrastructure.ratelimit;

import java.time.Duration;
import java.util.Objects;

/**
 * A fixed window and the number of calls allowed inside it.
 */
public record RateWindow(Duration duration, int capacity) {

    public RateWindow {
        Objects.requireNonNull(duration, "duration");
        if (duration.isNegative() || duration.isZero()) {
            throw new IllegalArgumentException("Window duration must be positive");
        }
        if (capacity <= 0) {
            throw new IllegalArgumentException("Window capacity must be positive");
        }
    }

    public static RateWindow perSecond(int capacity) {
        return new RateWindow(Duration.ofSeconds(1), capacity);
    }

    public static RateWindow perMinute(int capacity) {
        return new RateWindow(Duration.ofMinutes(1), capacity);
    }

    public static RateWindow perHour(int capacity) {
        return new RateWindow(Duration.ofHours(1), capacity);
    }

    public static RateWindow perDay(int capacity) {
        return new RateWindow(Duration.ofDays(1), capacity);
    }
}
