package in.dhanstream.infrastructure.metrics;

import java.time.Duration;

/**
 * Metrics sink for the streaming sessions, order tracker and rate limiter.
 *
 * Key metrics:
 * - Connection lifecycle events and reconnect scheduling per channel
 * - Inbound message counts by event kind
 * - Decode and listener failures
 * - Rate limiter waits per tier
 * - Tracked order count and evictions
 */
public interface StreamMetrics {

    /** Sink that records nothing. */
    StreamMetrics NOOP = new StreamMetrics() {
        @Override public void recordConnectionEvent(String channel, ConnectionEvent event) { }
        @Override public void recordReconnectScheduled(String channel, String reason, Duration delay) { }
        @Override public void recordMessage(String channel, String kind) { }
        @Override public void recordDecodeFailure(String channel) { }
        @Override public void recordListenerFailure(String channel) { }
        @Override public void recordThrottleWait(String tier, Duration waited) { }
        @Override public void recordTrackedOrders(int count) { }
        @Override public void recordOrderEvictions(String reason, int count) { }
    };

    void recordConnectionEvent(String channel, ConnectionEvent event);

    /**
     * @param reason close classification that caused the reconnect
     * @param delay  time until the next connect attempt
     */
    void recordReconnectScheduled(String channel, String reason, Duration delay);

    void recordMessage(String channel, String kind);

    void recordDecodeFailure(String channel);

    void recordListenerFailure(String channel);

    /**
     * Record a throttle call that had to block before a token was available.
     */
    void recordThrottleWait(String tier, Duration waited);

    void recordTrackedOrders(int count);

    void recordOrderEvictions(String reason, int count);

    enum ConnectionEvent {
        CONNECTING,
        CONNECTED,
        DISCONNECTED,
        COOLING_OFF,
        AUTH_REJECTED,
        STOPPED,
        ERROR
    }
}
