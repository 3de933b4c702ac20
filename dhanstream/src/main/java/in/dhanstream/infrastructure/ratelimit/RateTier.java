package in.dhanstream.infrastructure.ratelimit;

import java.time.Duration;
import java.util.List;

/**
 * REST endpoint groups that share one set of quota windows, with the broker's published limits.
 */
public enum RateTier {
    ORDER_API(List.of(
        RateWindow.perSecond(25),
        RateWindow.perMinute(250),
        RateWindow.perHour(1000),
        RateWindow.perDay(7000))),

    DATA_API(List.of(
        RateWindow.perSecond(5),
        RateWindow.perDay(100_000))),

    QUOTE_API(List.of(
        RateWindow.perSecond(1))),

    OPTION_CHAIN(List.of(
        new RateWindow(Duration.ofSeconds(3), 1),
        RateWindow.perMinute(20),
        RateWindow.perHour(600),
        RateWindow.perDay(4800))),

    NON_TRADING_API(List.of(
        RateWindow.perSecond(20)));

    private final List<RateWindow> defaultWindows;

    RateTier(List<RateWindow> defaultWindows) {
        this.defaultWindows = defaultWindows;
    }

    public List<RateWindow> defaultWindows() {
        return defaultWindows;
    }
}
