package in.dhanstream.infrastructure.stream.session;

import in.dhanstream.domain.feed.DecodedEvent;
import in.dhanstream.domain.feed.DisconnectEvent;
import in.dhanstream.domain.feed.EventKind;
import in.dhanstream.domain.instrument.InstrumentRef;
import in.dhanstream.infrastructure.metrics.StreamMetrics;
import in.dhanstream.infrastructure.metrics.StreamMetrics.ConnectionEvent;
import in.dhanstream.infrastructure.stream.decoder.DecodeResult;
import in.dhanstream.infrastructure.stream.resolve.ResolutionException;
import in.dhanstream.infrastructure.stream.resolve.SubscriptionResolver;
import in.dhanstream.infrastructure.stream.resolve.SymbolRef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Consumer;

/**
 * Owns one streaming channel: connects, logs in, replays subscriptions, decodes and dispatches inbound
 * messages, and reconnects forever until {@link #stop()}.
 *
 * State machine:
 * <pre>
 *   IDLE -> CONNECTING -> OPEN -> IDLE (backoff) -> CONNECTING ...
 *   any  -> COOLING_OFF on a rate-limit close (fixed cooloff, backoff untouched) -> CONNECTING
 *   any  -> STOPPED on stop(), terminal
 * </pre>
 *
 * Connect attempts run on a dedicated scheduler thread and are bounded by the connect timeout. Inbound
 * messages are decoded and dispatched on the transport's delivery thread, one at a time. Every attempt
 * gets a generation number; callbacks from an attempt that already ended are ignored.
 */
public class SessionManager {
    private static final Logger log = LoggerFactory.getLogger(SessionManager.class);

    private final ChannelProtocol protocol;
    private final FeedTransport transport;
    private final SubscriptionResolver resolver;
    private final BackoffPolicy backoff;
    private final Duration connectTimeout;
    private final int maxAuthRejections;
    private final StreamMetrics metrics;
    private final Clock clock;
    private final String channel;

    private final ScheduledExecutorService scheduler;
    private volatile Thread schedulerThread;

    private final Map<EventKind, List<EventListener>> listeners = new EnumMap<>(EventKind.class);
    private final List<EventListener> anyListeners = new CopyOnWriteArrayList<>();
    private final List<Consumer<SessionState>> stateListeners = new CopyOnWriteArrayList<>();
    private final List<Consumer<Throwable>> errorListeners = new CopyOnWriteArrayList<>();

    // Guarded by lock
    private final Object lock = new Object();
    private final Map<String, InstrumentRef> subscriptions = new LinkedHashMap<>();
    // Instrument key -> labels holding it; the wire sees each instrument once
    private final Map<String, Integer> holders = new HashMap<>();
    private final Map<String, InstrumentRef> instruments = new LinkedHashMap<>();
    private SessionState state = SessionState.IDLE;
    private TransportConnection connection;
    private CompletableFuture<TransportConnection> pendingConnect;
    private boolean started;
    private Instant cooloffUntil;
    private int consecutiveAuthRejections;

    private volatile long generation;
    private volatile boolean awaitingFirstMessage;

    private SessionManager(Builder builder) {
        this.protocol = Objects.requireNonNull(builder.protocol, "protocol");
        this.transport = Objects.requireNonNull(builder.transport, "transport");
        this.resolver = builder.resolver;
        this.backoff = builder.backoff;
        this.connectTimeout = builder.connectTimeout;
        this.maxAuthRejections = builder.maxAuthRejections;
        this.metrics = builder.metrics;
        this.clock = builder.clock;
        this.channel = protocol.channelId();

        if (protocol.supportsSubscriptions() && resolver == null) {
            throw new IllegalArgumentException("Channel " + channel + " needs a SubscriptionResolver");
        }
        for (EventKind kind : EventKind.values()) {
            listeners.put(kind, new CopyOnWriteArrayList<>());
        }

        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "dhan-session-" + channel);
            t.setDaemon(true);
            schedulerThread = t;
            return t;
        });
    }

    public static Builder builder() {
        return new Builder();
    }

    // ════════════════════════════════════════════════════════════════════════
    // LIFECYCLE
    // ════════════════════════════════════════════════════════════════════════

    /**
     * Begin connecting. Calling it again while running does nothing.
     *
     * @throws SessionStateException if the session was stopped
     */
    public void start() {
        synchronized (lock) {
            if (state == SessionState.STOPPED) {
                throw new SessionStateException(channel, "session is stopped");
            }
            if (started) {
                return;
            }
            started = true;
        }
        log.info("[DHAN:{}] Starting session -> {}", channel, protocol.describeEndpoint());
        scheduleConnect(Duration.ZERO);
    }

    /**
     * Close the transport and end all background work. Idempotent; no reconnect follows.
     */
    public void stop() {
        TransportConnection current;
        synchronized (lock) {
            if (state == SessionState.STOPPED) {
                return;
            }
            state = SessionState.STOPPED;
            generation++;
            current = connection;
            connection = null;
            cooloffUntil = null;
        }

        if (current != null) {
            try {
                protocol.disconnectMessage().ifPresent(current::send);
                current.close(CloseKind.NORMAL_CLOSURE, "client stop");
            } catch (RuntimeException e) {
                log.warn("[DHAN:{}] Error closing connection: {}", channel, e.getMessage());
                current.abort();
            }
        }

        scheduler.shutdownNow();
        if (Thread.currentThread() != schedulerThread) {
            try {
                if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                    log.warn("[DHAN:{}] Session thread did not terminate in time", channel);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }

        metrics.recordConnectionEvent(channel, ConnectionEvent.STOPPED);
        log.info("[DHAN:{}] Session stopped", channel);
        notifyState(SessionState.STOPPED);
    }

    private void scheduleConnect(Duration delay) {
        try {
            scheduler.schedule(this::connect, delay.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            log.debug("[DHAN:{}] Connect not scheduled, session is stopping", channel);
        }
    }

    private void connect() {
        long attempt;
        synchronized (lock) {
            if (state == SessionState.STOPPED) {
                return;
            }
            attempt = ++generation;
            state = SessionState.CONNECTING;
            cooloffUntil = null;
        }
        metrics.recordConnectionEvent(channel, ConnectionEvent.CONNECTING);
        notifyState(SessionState.CONNECTING);
        log.info("[DHAN:{}] Connecting (attempt generation {})", channel, attempt);

        CompletableFuture<TransportConnection> future;
        try {
            future = transport.connect(protocol.endpoint(), new AttemptListener(attempt));
        } catch (RuntimeException e) {
            handleEnd(attempt, CloseKind.ABNORMAL, "connect failed: " + e.getMessage());
            return;
        }
        synchronized (lock) {
            if (attempt != generation) {
                future.cancel(true);
                return;
            }
            pendingConnect = future;
        }

        try {
            future.get(connectTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            future.thenAccept(TransportConnection::abort);
            handleEnd(attempt, CloseKind.ABNORMAL, "handshake timed out after " + connectTimeout.toMillis() + "ms");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            CloseKind kind = cause instanceof HandshakeRejectedException
                ? CloseKind.fromHandshakeStatus(((HandshakeRejectedException) cause).getStatusCode())
                : CloseKind.ABNORMAL;
            handleEnd(attempt, kind, "connect failed: " + cause.getMessage());
        } catch (CancellationException e) {
            handleEnd(attempt, CloseKind.ABNORMAL, "connect cancelled");
        } catch (InterruptedException e) {
            // stop() interrupts the scheduler thread
            Thread.currentThread().interrupt();
            future.cancel(true);
            future.thenAccept(TransportConnection::abort);
        } finally {
            synchronized (lock) {
                if (pendingConnect == future) {
                    pendingConnect = null;
                }
            }
        }
    }

    /**
     * Close out attempt {@code attempt} and schedule the next one according to {@code kind}.
     */
    private void handleEnd(long attempt, CloseKind kind, String detail) {
        Duration delay;
        SessionState next;
        TransportConnection dropped;
        CompletableFuture<TransportConnection> handshake;
        int rejections = 0;
        boolean giveUp = false;

        synchronized (lock) {
            if (attempt != generation || state == SessionState.STOPPED) {
                return;
            }
            generation++;
            dropped = connection;
            connection = null;
            handshake = pendingConnect;
            pendingConnect = null;

            switch (kind) {
                case RATE_LIMITED -> {
                    next = SessionState.COOLING_OFF;
                    delay = backoff.getCooloff();
                    cooloffUntil = clock.instant().plus(delay);
                }
                case CLEAN -> {
                    backoff.reset();
                    next = SessionState.IDLE;
                    delay = backoff.getBaseDelay();
                }
                case AUTH_REJECTED -> {
                    rejections = ++consecutiveAuthRejections;
                    giveUp = maxAuthRejections > 0 && rejections >= maxAuthRejections;
                    next = SessionState.IDLE;
                    delay = backoff.recordAbnormalClose();
                }
                default -> {
                    next = SessionState.IDLE;
                    delay = backoff.recordAbnormalClose();
                }
            }
            if (!giveUp) {
                state = next;
            }
        }

        if (dropped != null) {
            dropped.abort();
        }
        // Frees the scheduler thread when the attempt failed before its handshake completed
        if (handshake != null) {
            handshake.cancel(true);
        }

        if (giveUp) {
            SessionAuthenticationException error = new SessionAuthenticationException(channel, rejections,
                "login rejected " + rejections + " times in a row, giving up: " + detail);
            log.error("[DHAN:{}] {}", channel, error.getMessage());
            metrics.recordConnectionEvent(channel, ConnectionEvent.AUTH_REJECTED);
            notifyError(error);
            stop();
            return;
        }

        metrics.recordConnectionEvent(channel, switch (kind) {
            case RATE_LIMITED -> ConnectionEvent.COOLING_OFF;
            case AUTH_REJECTED -> ConnectionEvent.AUTH_REJECTED;
            case CLEAN -> ConnectionEvent.DISCONNECTED;
            default -> ConnectionEvent.ERROR;
        });
        metrics.recordReconnectScheduled(channel, kind.name(), delay);

        if (kind == CloseKind.RATE_LIMITED) {
            log.warn("[DHAN:{}] Rate limited ({}), cooling off for {}s", channel, detail, delay.toSeconds());
        } else if (kind == CloseKind.CLEAN) {
            log.info("[DHAN:{}] Connection closed ({}), reconnecting in {}ms", channel, detail, delay.toMillis());
        } else {
            log.warn("[DHAN:{}] Connection lost [{}] ({}), retry #{} in {}ms",
                channel, kind, detail, backoff.getConsecutiveFailures(), delay.toMillis());
        }

        notifyState(next);
        scheduleConnect(delay);
    }

    // ════════════════════════════════════════════════════════════════════════
    // TRANSPORT CALLBACKS
    // ════════════════════════════════════════════════════════════════════════

    private final class AttemptListener implements TransportListener {
        private final long attempt;

        AttemptListener(long attempt) {
            this.attempt = attempt;
        }

        @Override
        public void onOpen(TransportConnection opened) {
            handleOpen(attempt, opened);
        }

        @Override
        public void onText(String text) {
            if (acceptMessage(attempt)) {
                dispatch(protocol.decodeText(text));
            }
        }

        @Override
        public void onBinary(byte[] data) {
            if (acceptMessage(attempt)) {
                dispatch(protocol.decodeBinary(data));
            }
        }

        @Override
        public void onClose(int statusCode, String reason) {
            CloseKind kind = CloseKind.classify(statusCode, reason);
            if (kind == CloseKind.ABNORMAL && awaitingFirstMessage && protocol.loginMessage().isPresent()) {
                kind = CloseKind.AUTH_REJECTED;
            }
            handleEnd(attempt, kind, "close " + statusCode + (reason == null || reason.isEmpty() ? "" : " " + reason));
        }

        @Override
        public void onError(Throwable error) {
            handleEnd(attempt, CloseKind.ABNORMAL, "transport error: " + error.getMessage());
        }
    }

    private void handleOpen(long attempt, TransportConnection opened) {
        int replayed;
        synchronized (lock) {
            if (attempt != generation || state == SessionState.STOPPED) {
                opened.abort();
                return;
            }
            connection = opened;
            state = SessionState.OPEN;

            Optional<String> login = protocol.loginMessage();
            awaitingFirstMessage = login.isPresent();
            login.ifPresent(opened::send);

            // Replay before the transport delivers anything; sending under the lock keeps
            // concurrent subscribe() calls from slipping in between
            List<InstrumentRef> snapshot = new ArrayList<>(instruments.values());
            replayed = snapshot.size();
            if (!snapshot.isEmpty()) {
                protocol.subscribeCommands(snapshot).forEach(opened::send);
            }
        }

        metrics.recordConnectionEvent(channel, ConnectionEvent.CONNECTED);
        log.info("[DHAN:{}] Connected, replayed {} subscriptions", channel, replayed);
        notifyState(SessionState.OPEN);
    }

    private boolean acceptMessage(long attempt) {
        if (attempt != generation) {
            return false;
        }
        if (awaitingFirstMessage) {
            awaitingFirstMessage = false;
            synchronized (lock) {
                consecutiveAuthRejections = 0;
            }
        }
        return true;
    }

    private void dispatch(DecodeResult result) {
        if (!result.isSuccess()) {
            metrics.recordDecodeFailure(channel);
            log.warn("[DHAN:{}] Dropping undecodable message ({} bytes): {}", channel, result.rawLength(), result.error());
            return;
        }

        DecodedEvent event = result.event();
        metrics.recordMessage(channel, event.kind().name());
        if (event.kind() == EventKind.DISCONNECT) {
            log.warn("[DHAN:{}] Server disconnect notice, code {}", channel, ((DisconnectEvent) event).reasonCode());
        }

        for (EventListener listener : listeners.get(event.kind())) {
            deliver(listener, event);
        }
        for (EventListener listener : anyListeners) {
            deliver(listener, event);
        }
    }

    private void deliver(EventListener listener, DecodedEvent event) {
        try {
            listener.onEvent(event);
        } catch (Exception e) {
            metrics.recordListenerFailure(channel);
            log.warn("[DHAN:{}] Listener failed on {}: {}", channel, event.kind(), e.getMessage(), e);
        }
    }

    // ════════════════════════════════════════════════════════════════════════
    // SUBSCRIPTIONS
    // ════════════════════════════════════════════════════════════════════════

    /**
     * Add instruments to the channel. References whose label is already subscribed, or that cannot be
     * resolved, are skipped. An instrument already streaming under another label is recorded for the new
     * label without a second wire command. New instruments are sent now if the connection is open, or on
     * the next open otherwise.
     *
     * @param refs caller references, in any form {@link SubscriptionResolver} accepts
     * @return the instruments whose label was newly added by this call
     * @throws SessionStateException if the session is stopped or the channel takes no subscriptions
     */
    public List<InstrumentRef> subscribe(Collection<SymbolRef> refs) {
        requireSubscriptions();
        synchronized (lock) {
            if (state == SessionState.STOPPED) {
                throw new SessionStateException(channel, "cannot subscribe on a stopped session");
            }
        }

        Map<String, InstrumentRef> candidates = new LinkedHashMap<>();
        for (SymbolRef ref : refs) {
            String label = resolver.labelFor(ref);
            if (candidates.containsKey(label) || isSubscribed(label)) {
                log.debug("[DHAN:{}] {} already subscribed", channel, label);
                continue;
            }
            try {
                candidates.put(label, resolver.resolve(ref));
            } catch (ResolutionException e) {
                log.warn("[DHAN:{}] Skipping subscription: {}", channel, e.getMessage());
            }
        }

        List<InstrumentRef> added = new ArrayList<>();
        List<InstrumentRef> wire = new ArrayList<>();
        synchronized (lock) {
            for (Map.Entry<String, InstrumentRef> entry : candidates.entrySet()) {
                InstrumentRef instrument = entry.getValue();
                if (subscriptions.putIfAbsent(entry.getKey(), instrument) != null) {
                    continue;
                }
                added.add(instrument);
                if (holders.merge(instrument.key(), 1, Integer::sum) == 1) {
                    instruments.put(instrument.key(), instrument);
                    wire.add(instrument);
                } else {
                    log.debug("[DHAN:{}] {} already streaming as {}", channel, entry.getKey(), instrument.key());
                }
            }
            if (!wire.isEmpty() && state == SessionState.OPEN && connection != null) {
                protocol.subscribeCommands(wire).forEach(connection::send);
            }
        }

        if (!added.isEmpty()) {
            log.info("[DHAN:{}] Subscribed {} instruments ({} total)", channel, added.size(), subscriptionCount());
        }
        return added;
    }

    /**
     * Varargs form of {@link #subscribe(Collection)}.
     *
     * @param refs caller references
     * @return the instruments whose label was newly added by this call
     */
    public List<InstrumentRef> subscribe(SymbolRef... refs) {
        return subscribe(List.of(refs));
    }

    /**
     * Remove instruments from the channel. Labels without an active subscription are ignored. The wire
     * unsubscribe is sent only when the last label holding an instrument goes away.
     *
     * @param refs caller references, matched by label
     * @return the instruments whose label was removed by this call
     * @throws SessionStateException if the channel takes no subscriptions
     */
    public List<InstrumentRef> unsubscribe(Collection<SymbolRef> refs) {
        requireSubscriptions();
        List<InstrumentRef> removed = new ArrayList<>();
        List<InstrumentRef> wire = new ArrayList<>();
        synchronized (lock) {
            for (SymbolRef ref : refs) {
                String label = resolver.labelFor(ref);
                InstrumentRef instrument = subscriptions.remove(label);
                if (instrument == null) {
                    log.debug("[DHAN:{}] {} not subscribed, nothing to remove", channel, label);
                    continue;
                }
                removed.add(instrument);
                Integer left = holders.computeIfPresent(instrument.key(), (key, count) -> count > 1 ? count - 1 : null);
                if (left == null) {
                    instruments.remove(instrument.key());
                    wire.add(instrument);
                }
            }
            if (!wire.isEmpty() && state == SessionState.OPEN && connection != null) {
                protocol.unsubscribeCommands(wire).forEach(connection::send);
            }
        }
        if (!removed.isEmpty()) {
            log.info("[DHAN:{}] Unsubscribed {} instruments", channel, removed.size());
        }
        return removed;
    }

    /**
     * Varargs form of {@link #unsubscribe(Collection)}.
     *
     * @param refs caller references
     * @return the instruments whose label was removed by this call
     */
    public List<InstrumentRef> unsubscribe(SymbolRef... refs) {
        return unsubscribe(List.of(refs));
    }

    private void requireSubscriptions() {
        if (!protocol.supportsSubscriptions()) {
            throw new SessionStateException(channel, "channel does not take subscriptions");
        }
    }

    private boolean isSubscribed(String label) {
        synchronized (lock) {
            return subscriptions.containsKey(label);
        }
    }

    // ════════════════════════════════════════════════════════════════════════
    // LISTENERS
    // ════════════════════════════════════════════════════════════════════════

    /**
     * Register a listener for one event kind. Several listeners per kind are allowed; they run on the
     * transport's delivery thread in registration order, and an exception from one does not reach the others.
     *
     * @param kind     event kind to listen to
     * @param listener callback
     */
    public void on(EventKind kind, EventListener listener) {
        listeners.get(kind).add(Objects.requireNonNull(listener, "listener"));
    }

    /**
     * Listen to every decoded event regardless of kind. Runs after the kind-specific listeners.
     *
     * @param listener callback
     */
    public void onAny(EventListener listener) {
        anyListeners.add(Objects.requireNonNull(listener, "listener"));
    }

    /**
     * Register a callback for state transitions.
     *
     * @param listener receives the state just entered
     */
    public void onStateChange(Consumer<SessionState> listener) {
        stateListeners.add(Objects.requireNonNull(listener, "listener"));
    }

    /**
     * Register a callback for failures surfaced to the caller, currently only
     * {@link SessionAuthenticationException} after repeated login rejections.
     *
     * @param listener receives the failure
     */
    public void onError(Consumer<Throwable> listener) {
        errorListeners.add(Objects.requireNonNull(listener, "listener"));
    }

    private void notifyState(SessionState newState) {
        for (Consumer<SessionState> listener : stateListeners) {
            try {
                listener.accept(newState);
            } catch (Exception e) {
                log.warn("[DHAN:{}] State listener failed: {}", channel, e.getMessage());
            }
        }
    }

    private void notifyError(Throwable error) {
        for (Consumer<Throwable> listener : errorListeners) {
            try {
                listener.accept(error);
            } catch (Exception e) {
                log.warn("[DHAN:{}] Error listener failed: {}", channel, e.getMessage());
            }
        }
    }

    // ════════════════════════════════════════════════════════════════════════
    // STATUS
    // ════════════════════════════════════════════════════════════════════════

    /**
     * Get the channel this session serves.
     *
     * @return channel id from the protocol, e.g. {@code feed-quote} or {@code orders}
     */
    public String channelId() {
        return channel;
    }

    /**
     * Get the current state.
     *
     * @return current position in the connection state machine
     */
    public SessionState state() {
        synchronized (lock) {
            return state;
        }
    }

    /**
     * Get the active subscriptions.
     *
     * @return copy of the subscription map, keyed by label, in subscription order
     */
    public Map<String, InstrumentRef> subscriptions() {
        synchronized (lock) {
            return new LinkedHashMap<>(subscriptions);
        }
    }

    /**
     * Get the number of subscribed labels.
     *
     * @return label count; several labels may share one instrument
     */
    public int subscriptionCount() {
        synchronized (lock) {
            return subscriptions.size();
        }
    }

    /**
     * Get the number of distinct instruments on the wire.
     *
     * @return instrument count, at most {@link #subscriptionCount()}
     */
    public int instrumentCount() {
        synchronized (lock) {
            return instruments.size();
        }
    }

    /**
     * Get the end of the current rate-limit cooloff.
     *
     * @return instant the next connect is due, or empty when not cooling off
     */
    public Optional<Instant> cooloffUntil() {
        synchronized (lock) {
            return Optional.ofNullable(cooloffUntil);
        }
    }

    /**
     * Get the reconnect policy.
     *
     * @return backoff policy, whose failure count reflects consecutive abnormal closes
     */
    public BackoffPolicy backoff() {
        return backoff;
    }

    public static class Builder {
        private ChannelProtocol protocol;
        private FeedTransport transport;
        private SubscriptionResolver resolver;
        private BackoffPolicy backoff = BackoffPolicy.defaults();
        private Duration connectTimeout = Duration.ofSeconds(10);
        private int maxAuthRejections = 0;
        private StreamMetrics metrics = StreamMetrics.NOOP;
        private Clock clock = Clock.systemUTC();

        public Builder protocol(ChannelProtocol protocol) {
            this.protocol = protocol;
            return this;
        }

        public Builder transport(FeedTransport transport) {
            this.transport = transport;
            return this;
        }

        public Builder resolver(SubscriptionResolver resolver) {
            this.resolver = resolver;
            return this;
        }

        public Builder backoff(BackoffPolicy backoff) {
            this.backoff = Objects.requireNonNull(backoff, "backoff");
            return this;
        }

        public Builder connectTimeout(Duration connectTimeout) {
            if (connectTimeout.isNegative() || connectTimeout.isZero()) {
                throw new IllegalArgumentException("Connect timeout must be positive");
            }
            this.connectTimeout = connectTimeout;
            return this;
        }

        /**
         * Consecutive login rejections after which the session stops and reports an error.
         * 0 keeps retrying forever.
         */
        public Builder maxAuthRejections(int maxAuthRejections) {
            if (maxAuthRejections < 0) {
                throw new IllegalArgumentException("maxAuthRejections must not be negative");
            }
            this.maxAuthRejections = maxAuthRejections;
            return this;
        }

        public Builder metrics(StreamMetrics metrics) {
            this.metrics = Objects.requireNonNull(metrics, "metrics");
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock");
            return this;
        }

        public SessionManager build() {
            return new SessionManager(this);
        }
    }
}
