package in.dhanstream.infrastructure.stream.order;

import in.dhanstream.config.StreamConfig;
import in.dhanstream.domain.feed.EventKind;
import in.dhanstream.domain.feed.OrderAlertEvent;
import in.dhanstream.domain.order.OrderEvent;
import in.dhanstream.domain.order.OrderEventType;
import in.dhanstream.domain.order.OrderUpdate;
import in.dhanstream.domain.order.TrackedOrder;
import in.dhanstream.infrastructure.metrics.StreamMetrics;
import in.dhanstream.infrastructure.stream.session.SessionManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Bounded "last known state per order" map fed by order alerts.
 *
 * A periodic sweep drops entries not refreshed within {@code maxOrderAge}, then evicts the least
 * recently seen entries until at most {@code maxTrackedOrders} remain. Record and get never wait on the
 * sweep; the sweep works from a snapshot and removes only entries that were not refreshed meanwhile.
 *
 * Each recorded update is compared with the state it replaces and the resulting {@link OrderEvent}s are
 * delivered to listeners, in this order: STATUS_CHANGE, EXECUTION, then ORDER_TRADED / ORDER_REJECTED /
 * ORDER_CANCELLED when the order enters that status.
 *
 * Usage:
 * <pre>
 * OrderStateTracker tracker = new OrderStateTracker();
 * tracker.on(OrderEventType.EXECUTION, e -> log.info("{} filled {}", e.orderId(), e.executedQty()));
 * tracker.attachTo(orderSession);
 * tracker.start();
 * </pre>
 */
public class OrderStateTracker {
    private static final Logger log = LoggerFactory.getLogger(OrderStateTracker.class);

    public static final int MAX_TRACKED_ORDERS = 10_000;
    public static final Duration MAX_ORDER_AGE = Duration.ofHours(24);
    public static final Duration SWEEP_INTERVAL = Duration.ofMinutes(5);

    private static final Comparator<Entry> OLDEST_FIRST = Comparator
        .comparing((Entry e) -> e.order().lastSeenAt())
        .thenComparingLong(Entry::sequence);

    private final int maxTrackedOrders;
    private final Duration maxOrderAge;
    private final Duration sweepInterval;
    private final Clock clock;
    private final StreamMetrics metrics;

    private final Map<String, Entry> orders = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();

    private final Map<OrderEventType, List<OrderEventListener>> listeners = new EnumMap<>(OrderEventType.class);
    private final List<OrderEventListener> anyListeners = new CopyOnWriteArrayList<>();

    private ScheduledExecutorService sweeper;

    private record Entry(TrackedOrder order, long sequence) { }

    public OrderStateTracker() {
        this(MAX_TRACKED_ORDERS, MAX_ORDER_AGE, SWEEP_INTERVAL, Clock.systemUTC(), StreamMetrics.NOOP);
    }

    public OrderStateTracker(StreamConfig config, StreamMetrics metrics) {
        this(config.maxTrackedOrders(), config.maxOrderAge(), config.orderSweepInterval(),
            Clock.systemUTC(), metrics);
    }

    public OrderStateTracker(int maxTrackedOrders, Duration maxOrderAge, Duration sweepInterval,
                             Clock clock, StreamMetrics metrics) {
        if (maxTrackedOrders <= 0) {
            throw new IllegalArgumentException("maxTrackedOrders must be positive");
        }
        if (maxOrderAge.isNegative() || maxOrderAge.isZero()) {
            throw new IllegalArgumentException("maxOrderAge must be positive");
        }
        if (sweepInterval.isNegative() || sweepInterval.isZero()) {
            throw new IllegalArgumentException("sweepInterval must be positive");
        }
        this.maxTrackedOrders = maxTrackedOrders;
        this.maxOrderAge = maxOrderAge;
        this.sweepInterval = sweepInterval;
        this.clock = clock;
        this.metrics = metrics;
        for (OrderEventType type : OrderEventType.values()) {
            listeners.put(type, new CopyOnWriteArrayList<>());
        }
    }

    /**
     * Upsert the state of {@code orderId}, stamped with the current time, and notify listeners of what
     * changed. The previous state is replaced.
     *
     * @param orderId key to track the order under
     * @param update  latest state pushed for the order
     * @return the state now tracked
     */
    public TrackedOrder record(String orderId, OrderUpdate update) {
        TrackedOrder order = TrackedOrder.of(orderId, update, clock.instant());
        Entry replaced = orders.put(orderId, new Entry(order, sequence.incrementAndGet()));
        publish(replaced == null ? null : replaced.order(), update);
        return order;
    }

    /**
     * Record under the update's own order number.
     *
     * @param update latest state pushed for the order
     * @return the state now tracked
     */
    public TrackedOrder record(OrderUpdate update) {
        return record(update.orderNo(), update);
    }

    /**
     * Get the last known state of an order.
     *
     * @param orderId order number
     * @return tracked state, or empty if never seen or already swept
     */
    public Optional<TrackedOrder> get(String orderId) {
        Entry entry = orders.get(orderId);
        return entry == null ? Optional.empty() : Optional.of(entry.order());
    }

    /**
     * @return number of orders currently tracked
     */
    public int size() {
        return orders.size();
    }

    // ════════════════════════════════════════════════════════════════════════
    // EVENTS
    // ════════════════════════════════════════════════════════════════════════

    /**
     * Register a listener for one kind of order event. Listeners run on the recording thread; an exception
     * from one is logged and does not reach the others.
     *
     * @param type     event type to listen to
     * @param listener callback
     */
    public void on(OrderEventType type, OrderEventListener listener) {
        listeners.get(type).add(Objects.requireNonNull(listener, "listener"));
    }

    /**
     * Listen to every order event regardless of type.
     *
     * @param listener callback
     */
    public void onAny(OrderEventListener listener) {
        anyListeners.add(Objects.requireNonNull(listener, "listener"));
    }

    private void publish(TrackedOrder previous, OrderUpdate update) {
        String previousStatus = previous == null ? null : previous.status();
        int previousQty = previous == null ? 0 : previous.tradedQty();
        boolean statusChanged = !Objects.equals(previousStatus, update.status());

        if (previous != null && statusChanged) {
            emit(OrderEventType.STATUS_CHANGE, update, previousStatus, previousQty);
        }
        if (update.tradedQty() > previousQty) {
            emit(OrderEventType.EXECUTION, update, previousStatus, previousQty);
        }
        if (statusChanged && update.isTerminal()) {
            OrderEventType terminal = switch (update.status()) {
                case OrderUpdate.STATUS_TRADED -> OrderEventType.ORDER_TRADED;
                case OrderUpdate.STATUS_REJECTED -> OrderEventType.ORDER_REJECTED;
                case OrderUpdate.STATUS_CANCELLED -> OrderEventType.ORDER_CANCELLED;
                default -> null;
            };
            if (terminal != null) {
                emit(terminal, update, previousStatus, previousQty);
            }
        }
    }

    private void emit(OrderEventType type, OrderUpdate update, String previousStatus, int previousQty) {
        OrderEvent event = new OrderEvent(type, update, previousStatus, update.status(), previousQty,
            update.tradedQty());
        for (OrderEventListener listener : listeners.get(type)) {
            deliver(listener, event);
        }
        for (OrderEventListener listener : anyListeners) {
            deliver(listener, event);
        }
    }

    private void deliver(OrderEventListener listener, OrderEvent event) {
        try {
            listener.onOrderEvent(event);
        } catch (Exception e) {
            log.warn("[ORDER-TRACKER] Listener failed on {} for {}: {}", event.type(), event.orderId(),
                e.getMessage(), e);
        }
    }

    /**
     * Route order alerts from {@code session} into this tracker. Attaching to a replacement session after
     * the previous one stopped keeps the tracked state.
     *
     * @param session order update session
     */
    public void attachTo(SessionManager session) {
        session.on(EventKind.ORDER_ALERT, event -> {
            OrderUpdate update = ((OrderAlertEvent) event).order();
            TrackedOrder order = record(update);
            log.debug("[ORDER-TRACKER] {} {} traded={} ({})",
                order.orderId(), order.status(), order.tradedQty(), order.symbol());
        });
    }

    // ════════════════════════════════════════════════════════════════════════
    // SWEEP
    // ════════════════════════════════════════════════════════════════════════

    /**
     * Run one sweep pass now.
     *
     * @return number of entries removed
     */
    public int sweep() {
        Instant cutoff = clock.instant().minus(maxOrderAge);
        List<Entry> live = new ArrayList<>(orders.size());
        int expired = 0;

        for (Entry entry : orders.values()) {
            if (!entry.order().lastSeenAt().isAfter(cutoff)) {
                if (orders.remove(entry.order().orderId(), entry)) {
                    expired++;
                }
            } else {
                live.add(entry);
            }
        }

        int evicted = 0;
        int excess = orders.size() - maxTrackedOrders;
        if (excess > 0) {
            live.sort(OLDEST_FIRST);
            for (Entry entry : live) {
                if (evicted >= excess) {
                    break;
                }
                if (orders.remove(entry.order().orderId(), entry)) {
                    evicted++;
                }
            }
        }

        metrics.recordOrderEvictions("expired", expired);
        metrics.recordOrderEvictions("capacity", evicted);
        metrics.recordTrackedOrders(orders.size());
        if (expired > 0 || evicted > 0) {
            log.info("[ORDER-TRACKER] Sweep removed {} expired and {} over capacity, {} tracked",
                expired, evicted, orders.size());
        }
        return expired + evicted;
    }

    public synchronized void start() {
        if (sweeper != null) {
            return;
        }
        sweeper = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "dhan-order-sweep");
            t.setDaemon(true);
            return t;
        });
        long periodMs = sweepInterval.toMillis();
        sweeper.scheduleAtFixedRate(() -> {
            try {
                sweep();
            } catch (Exception e) {
                log.error("[ORDER-TRACKER] Sweep failed", e);
            }
        }, periodMs, periodMs, TimeUnit.MILLISECONDS);
        log.info("[ORDER-TRACKER] Started: max={} maxAge={} interval={}",
            maxTrackedOrders, maxOrderAge, sweepInterval);
    }

    /**
     * Stop the sweep timer. Idempotent; tracked entries are kept.
     */
    public synchronized void stop() {
        if (sweeper == null) {
            return;
        }
        sweeper.shutdownNow();
        try {
            if (!sweeper.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("[ORDER-TRACKER] Sweep thread did not terminate in time");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        sweeper = null;
        log.info("[ORDER-TRACKER] Stopped");
    }

    /**
     * @return true while the sweep timer is scheduled
     */
    public synchronized boolean isRunning() {
        return sweeper != null;
    }
}
