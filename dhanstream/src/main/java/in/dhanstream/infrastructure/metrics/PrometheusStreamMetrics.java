package in.dhanstream.infrastructure.metrics;

import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Counter;
import io.prometheus.client.Gauge;
import io.prometheus.client.Histogram;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Prometheus implementation of {@link StreamMetrics}.
 *
 * Key Metrics:
 * - dhan_stream_connection_events_total{channel, event}
 * - dhan_stream_connection_status{channel} - 1 while open
 * - dhan_stream_reconnects_total{channel, reason}
 * - dhan_stream_reconnect_delay_seconds{channel}
 * - dhan_stream_messages_total{channel, kind}
 * - dhan_stream_decode_failures_total{channel}
 * - dhan_stream_listener_failures_total{channel}
 * - dhan_rate_limit_waits_total{tier}, dhan_rate_limit_wait_seconds{tier}
 * - dhan_tracked_orders, dhan_tracked_order_evictions_total{reason}
 */
public class PrometheusStreamMetrics implements StreamMetrics {
    private static final Logger log = LoggerFactory.getLogger(PrometheusStreamMetrics.class);

    private final CollectorRegistry registry;

    private final Counter connectionEventCounter;
    private final Gauge connectionStatus;
    private final Counter reconnectCounter;
    private final Histogram reconnectDelay;
    private final Counter messageCounter;
    private final Counter decodeFailureCounter;
    private final Counter listenerFailureCounter;
    private final Counter throttleWaitCounter;
    private final Histogram throttleWaitSeconds;
    private final Gauge trackedOrders;
    private final Counter evictionCounter;

    public PrometheusStreamMetrics() {
        this(CollectorRegistry.defaultRegistry);
    }

    public PrometheusStreamMetrics(CollectorRegistry registry) {
        this.registry = registry;

        this.connectionEventCounter = Counter.build()
            .name("dhan_stream_connection_events_total")
            .help("Connection lifecycle events per channel")
            .labelNames("channel", "event")
            .register(registry);

        this.connectionStatus = Gauge.build()
            .name("dhan_stream_connection_status")
            .help("Current connection status (1=open, 0=not open)")
            .labelNames("channel")
            .register(registry);

        this.reconnectCounter = Counter.build()
            .name("dhan_stream_reconnects_total")
            .help("Reconnect attempts scheduled, by close classification")
            .labelNames("channel", "reason")
            .register(registry);

        this.reconnectDelay = Histogram.build()
            .name("dhan_stream_reconnect_delay_seconds")
            .help("Delay before the next connect attempt")
            .labelNames("channel")
            .buckets(1, 2, 4, 8, 16, 32, 60, 90, 120)
            .register(registry);

        this.messageCounter = Counter.build()
            .name("dhan_stream_messages_total")
            .help("Decoded inbound messages by event kind")
            .labelNames("channel", "kind")
            .register(registry);

        this.decodeFailureCounter = Counter.build()
            .name("dhan_stream_decode_failures_total")
            .help("Inbound messages dropped because they could not be decoded")
            .labelNames("channel")
            .register(registry);

        this.listenerFailureCounter = Counter.build()
            .name("dhan_stream_listener_failures_total")
            .help("Listener callbacks that threw")
            .labelNames("channel")
            .register(registry);

        this.throttleWaitCounter = Counter.build()
            .name("dhan_rate_limit_waits_total")
            .help("Throttle calls that blocked waiting for a window")
            .labelNames("tier")
            .register(registry);

        this.throttleWaitSeconds = Histogram.build()
            .name("dhan_rate_limit_wait_seconds")
            .help("Time spent blocked in throttle")
            .labelNames("tier")
            .buckets(0.01, 0.05, 0.1, 0.25, 0.5, 1.0, 3.0, 10.0, 60.0)
            .register(registry);

        this.trackedOrders = Gauge.build()
            .name("dhan_tracked_orders")
            .help("Orders currently held by the order state tracker")
            .register(registry);

        this.evictionCounter = Counter.build()
            .name("dhan_tracked_order_evictions_total")
            .help("Orders removed by the tracker sweep")
            .labelNames("reason")
            .register(registry);

        log.info("[PrometheusStreamMetrics] Initialized");
    }

    @Override
    public void recordConnectionEvent(String channel, ConnectionEvent event) {
        connectionEventCounter.labels(channel, event.name()).inc();

        if (event == ConnectionEvent.CONNECTED) {
            connectionStatus.labels(channel).set(1);
        } else if (event != ConnectionEvent.CONNECTING) {
            connectionStatus.labels(channel).set(0);
        }
    }

    @Override
    public void recordReconnectScheduled(String channel, String reason, Duration delay) {
        reconnectCounter.labels(channel, reason).inc();
        reconnectDelay.labels(channel).observe(delay.toMillis() / 1000.0);
    }

    @Override
    public void recordMessage(String channel, String kind) {
        messageCounter.labels(channel, kind).inc();
    }

    @Override
    public void recordDecodeFailure(String channel) {
        decodeFailureCounter.labels(channel).inc();
    }

    @Override
    public void recordListenerFailure(String channel) {
        listenerFailureCounter.labels(channel).inc();
    }

    @Override
    public void recordThrottleWait(String tier, Duration waited) {
        throttleWaitCounter.labels(tier).inc();
        throttleWaitSeconds.labels(tier).observe(waited.toNanos() / 1_000_000_000.0);
    }

    @Override
    public void recordTrackedOrders(int count) {
        trackedOrders.set(count);
    }

    @Override
    public void recordOrderEvictions(String reason, int count) {
        if (count > 0) {
            evictionCounter.labels(reason).inc(count);
        }
    }

    public CollectorRegistry getRegistry() {
        return registry;
    }
}
