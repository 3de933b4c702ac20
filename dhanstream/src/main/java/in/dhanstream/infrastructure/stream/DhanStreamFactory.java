package in.dhanstream.infrastructure.stream;

import com.fasterxml.jackson.databind.ObjectMapper;
import in.dhanstream.config.StreamConfig;
import in.dhanstream.infrastructure.metrics.StreamMetrics;
import in.dhanstream.infrastructure.ratelimit.RateLimiter;
import in.dhanstream.infrastructure.stream.order.OrderStateTracker;
import in.dhanstream.infrastructure.stream.resolve.InstrumentDirectory;
import in.dhanstream.infrastructure.stream.resolve.SubscriptionResolver;
import in.dhanstream.infrastructure.stream.session.ChannelProtocol;
import in.dhanstream.infrastructure.stream.session.FeedMode;
import in.dhanstream.infrastructure.stream.session.FeedTransport;
import in.dhanstream.infrastructure.stream.session.JdkWebSocketTransport;
import in.dhanstream.infrastructure.stream.session.MarketDepthProtocol;
import in.dhanstream.infrastructure.stream.session.MarketFeedProtocol;
import in.dhanstream.infrastructure.stream.session.OrderUpdateProtocol;
import in.dhanstream.infrastructure.stream.session.SessionManager;
import in.dhanstream.infrastructure.stream.session.SessionState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Creates and caches one session per channel, sharing one resolver, transport, metrics sink and rate
 * limiter across them.
 *
 * Usage:
 * <pre>
 * DhanStreamFactory streams = new DhanStreamFactory(StreamConfig.fromEnv(), directory, metrics);
 * SessionManager quotes = streams.marketFeed(FeedMode.QUOTE);
 * quotes.on(EventKind.QUOTE, event -> ...);
 * quotes.subscribe(SymbolRef.of("NSE_EQ:RELIANCE"));
 * quotes.start();
 *
 * OrderStateTracker orders = streams.orderTracker();
 * ...
 * streams.stopAll();
 * </pre>
 */
public class DhanStreamFactory {
    private static final Logger log = LoggerFactory.getLogger(DhanStreamFactory.class);

    private final StreamConfig config;
    private final SubscriptionResolver resolver;
    private final FeedTransport transport;
    private final StreamMetrics metrics;
    private final ObjectMapper mapper = new ObjectMapper();

    private final Map<String, SessionManager> sessions = new ConcurrentHashMap<>();
    private volatile OrderStateTracker orderTracker;
    private SessionManager trackerSession;
    private volatile RateLimiter rateLimiter;

    public DhanStreamFactory(StreamConfig config, InstrumentDirectory directory, StreamMetrics metrics) {
        this(config, new SubscriptionResolver(directory), new JdkWebSocketTransport(), metrics);
    }

    public DhanStreamFactory(StreamConfig config, SubscriptionResolver resolver, FeedTransport transport,
                             StreamMetrics metrics) {
        this.config = config;
        this.resolver = resolver;
        this.transport = transport;
        this.metrics = metrics;
        log.info("[DhanStreamFactory] Initialized with {}", config);
    }

    /**
     * Session for one market feed mode. Not started.
     */
    public SessionManager marketFeed(FeedMode mode) {
        return session(new MarketFeedProtocol(config, mode, mapper));
    }

    /**
     * Session for the configured market depth level. Not started.
     */
    public SessionManager marketDepth() {
        return session(new MarketDepthProtocol(config, mapper));
    }

    /**
     * Session for order updates. Not started.
     */
    public SessionManager orderUpdates() {
        return session(new OrderUpdateProtocol(config, mapper));
    }

    /**
     * Tracker attached to the order update session, with its sweep timer running. The tracker is created
     * once; after {@link #stopAll()} it is attached to the replacement session and its sweep restarted,
     * keeping the orders it already tracks.
     *
     * @return the shared order tracker
     */
    public synchronized OrderStateTracker orderTracker() {
        SessionManager current = orderUpdates();
        if (orderTracker == null) {
            orderTracker = new OrderStateTracker(config, metrics);
        }
        if (trackerSession != current) {
            orderTracker.attachTo(current);
            trackerSession = current;
        }
        orderTracker.start();
        return orderTracker;
    }

    public synchronized RateLimiter rateLimiter() {
        if (rateLimiter == null) {
            rateLimiter = new RateLimiter(RateLimiter.defaultLimits(), metrics);
        }
        return rateLimiter;
    }

    public SubscriptionResolver resolver() {
        return resolver;
    }

    private SessionManager session(ChannelProtocol protocol) {
        Function<String, SessionManager> create = id -> {
            log.info("[DhanStreamFactory] Creating session {}", id);
            return SessionManager.builder()
                .protocol(protocol)
                .transport(transport)
                .resolver(protocol.supportsSubscriptions() ? resolver : null)
                .connectTimeout(config.connectTimeout())
                .maxAuthRejections(config.maxAuthRejections())
                .metrics(metrics)
                .build();
        };
        SessionManager existing = sessions.get(protocol.channelId());
        if (existing != null && existing.state() == SessionState.STOPPED) {
            sessions.remove(protocol.channelId(), existing);
        }
        return sessions.computeIfAbsent(protocol.channelId(), create);
    }

    /**
     * Stop every session created here and the order tracker's sweep.
     */
    public void stopAll() {
        List<SessionManager> all = new ArrayList<>(sessions.values());
        log.info("[DhanStreamFactory] Stopping {} sessions", all.size());
        for (SessionManager session : all) {
            try {
                session.stop();
            } catch (RuntimeException e) {
                log.warn("[DhanStreamFactory] Failed to stop {}: {}", session.channelId(), e.getMessage());
            }
        }
        OrderStateTracker tracker = orderTracker;
        if (tracker != null) {
            tracker.stop();
        }
    }

    public Map<String, SessionManager> sessions() {
        return Map.copyOf(sessions);
    }
}
