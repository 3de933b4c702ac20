package in.dhanstream.infrastructure.stream.order;

import in.dhanstream.domain.feed.EventKind;
import in.dhanstream.domain.feed.OrderAlertEvent;
import in.dhanstream.domain.order.OrderEvent;
import in.dhanstream.domain.order.OrderEventType;
import in.dhanstream.domain.order.OrderUpdate;
import in.dhanstream.domain.order.TrackedOrder;
import in.dhanstream.infrastructure.metrics.StreamMetrics;
import in.dhanstream.infrastructure.stream.session.EventListener;
import in.dhanstream.infrastructure.stream.session.SessionManager;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Unit tests for OrderStateTracker.
 *
 * Tests:
 * - Upsert and lookup
 * - Capacity eviction, oldest first
 * - Age expiry boundary
 * - Sweep timer lifecycle
 * - Order alert wiring
 * - Derived order events
 */
class OrderStateTrackerTest {

    private MutableClock clock;
    private StreamMetrics metrics;
    private OrderStateTracker tracker;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-06-03T03:45:00Z"));
        metrics = mock(StreamMetrics.class);
        tracker = new OrderStateTracker(OrderStateTracker.MAX_TRACKED_ORDERS, OrderStateTracker.MAX_ORDER_AGE,
            OrderStateTracker.SWEEP_INTERVAL, clock, metrics);
    }

    @AfterEach
    void tearDown() {
        tracker.stop();
    }

    private static OrderUpdate update(String orderNo, String status, int tradedQty) {
        return new OrderUpdate(orderNo, "EX-" + orderNo, status, "NSE", "E", "2885", "RELIANCE",
            "Reliance Industries", "B", "LMT", "C", "EQUITY", null, 10, tradedQty, 10 - tradedQty,
            new BigDecimal("2500.00"), BigDecimal.ZERO, new BigDecimal("2499.50"), 1, "0", null, null,
            null, "2024-06-03 09:15:00");
    }

    @Test
    void testRecordReplacesPreviousState() {
        tracker.record(update("101", OrderUpdate.STATUS_PENDING, 0));
        clock.advance(Duration.ofSeconds(5));
        tracker.record(update("101", OrderUpdate.STATUS_TRADED, 10));

        TrackedOrder order = tracker.get("101").orElseThrow();
        assertEquals(OrderUpdate.STATUS_TRADED, order.status());
        assertEquals(10, order.tradedQty());
        assertEquals("RELIANCE", order.symbol());
        assertEquals(clock.instant(), order.lastSeenAt());
        assertEquals(1, tracker.size());
        assertTrue(tracker.get("999").isEmpty());
    }

    @Test
    void testCapacityEvictsOldestOnSweep() {
        int total = OrderStateTracker.MAX_TRACKED_ORDERS + 1;
        for (int i = 0; i < total; i++) {
            tracker.record(String.valueOf(i), update(String.valueOf(i), OrderUpdate.STATUS_PENDING, 0));
            clock.advance(Duration.ofMillis(1));
        }
        assertEquals(total, tracker.size(), "Record never evicts by itself");

        int removed = tracker.sweep();

        assertEquals(1, removed);
        assertEquals(OrderStateTracker.MAX_TRACKED_ORDERS, tracker.size());
        assertTrue(tracker.get("0").isEmpty(), "Oldest entry evicted");
        assertTrue(tracker.get(String.valueOf(total - 1)).isPresent());
        verify(metrics).recordOrderEvictions("capacity", 1);
        verify(metrics).recordTrackedOrders(OrderStateTracker.MAX_TRACKED_ORDERS);
    }

    @Test
    void testSameTimestampEvictsInRecordOrder() {
        OrderStateTracker small = new OrderStateTracker(2, Duration.ofHours(1), Duration.ofMinutes(5), clock, metrics);
        small.record("a", update("a", OrderUpdate.STATUS_PENDING, 0));
        small.record("b", update("b", OrderUpdate.STATUS_PENDING, 0));
        small.record("c", update("c", OrderUpdate.STATUS_PENDING, 0));

        small.sweep();

        assertTrue(small.get("a").isEmpty());
        assertTrue(small.get("b").isPresent());
        assertTrue(small.get("c").isPresent());
    }

    @Test
    void testRefreshedOrderOutlivesOlderOnes() {
        OrderStateTracker small = new OrderStateTracker(2, Duration.ofHours(1), Duration.ofMinutes(5), clock, metrics);
        small.record("a", update("a", OrderUpdate.STATUS_PENDING, 0));
        clock.advance(Duration.ofSeconds(1));
        small.record("b", update("b", OrderUpdate.STATUS_PENDING, 0));
        clock.advance(Duration.ofSeconds(1));
        small.record("a", update("a", OrderUpdate.STATUS_TRADED, 10));
        clock.advance(Duration.ofSeconds(1));
        small.record("c", update("c", OrderUpdate.STATUS_PENDING, 0));

        small.sweep();

        assertTrue(small.get("b").isEmpty(), "b is now the least recently seen");
        assertTrue(small.get("a").isPresent());
    }

    @Test
    void testAgeBoundary() {
        tracker.record(update("old", OrderUpdate.STATUS_PENDING, 0));
        clock.advance(OrderStateTracker.MAX_ORDER_AGE.minusMillis(1));
        tracker.record(update("young", OrderUpdate.STATUS_PENDING, 0));

        assertEquals(0, tracker.sweep(), "One millisecond short of the limit");
        assertTrue(tracker.get("old").isPresent());

        clock.advance(Duration.ofMillis(1));
        assertEquals(1, tracker.sweep(), "Exactly at the limit");
        assertTrue(tracker.get("old").isEmpty());
        assertTrue(tracker.get("young").isPresent());
        verify(metrics).recordOrderEvictions("expired", 1);
    }

    @Test
    void testSweepTimerLifecycle() throws InterruptedException {
        OrderStateTracker timed = new OrderStateTracker(100, Duration.ofMinutes(1), Duration.ofMillis(50),
            clock, StreamMetrics.NOOP);
        assertFalse(timed.isRunning());
        timed.stop();

        timed.record(update("1", OrderUpdate.STATUS_PENDING, 0));
        clock.advance(Duration.ofMinutes(2));
        timed.start();
        timed.start();
        assertTrue(timed.isRunning());

        long deadline = System.currentTimeMillis() + 2_000;
        while (timed.size() > 0 && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        assertEquals(0, timed.size(), "Expired entry removed by the timer");

        timed.stop();
        timed.stop();
        assertFalse(timed.isRunning());
    }

    @Test
    void testAttachRecordsOrderAlerts() throws Exception {
        SessionManager session = mock(SessionManager.class);
        ArgumentCaptor<EventListener> listener = ArgumentCaptor.forClass(EventListener.class);

        tracker.attachTo(session);
        verify(session).on(eq(EventKind.ORDER_ALERT), listener.capture());
        listener.getValue().onEvent(new OrderAlertEvent(update("555", OrderUpdate.STATUS_TRADED, 10)));

        assertEquals(OrderUpdate.STATUS_TRADED, tracker.get("555").orElseThrow().status());
    }

    @Test
    void testStatusChangeCarriesBothStatuses() {
        List<OrderEvent> events = new ArrayList<>();
        tracker.on(OrderEventType.STATUS_CHANGE, events::add);

        tracker.record(update("201", OrderUpdate.STATUS_TRANSIT, 0));
        assertTrue(events.isEmpty(), "First sighting is not a change");

        tracker.record(update("201", OrderUpdate.STATUS_PENDING, 0));

        assertEquals(1, events.size());
        OrderEvent event = events.get(0);
        assertEquals("201", event.orderId());
        assertEquals(OrderUpdate.STATUS_TRANSIT, event.previousStatus());
        assertEquals(OrderUpdate.STATUS_PENDING, event.newStatus());
    }

    @Test
    void testExecutionReportsFilledQuantity() {
        List<OrderEvent> events = new ArrayList<>();
        tracker.on(OrderEventType.EXECUTION, events::add);

        tracker.record(update("202", OrderUpdate.STATUS_PENDING, 0));
        tracker.record(update("202", OrderUpdate.STATUS_PENDING, 4));
        tracker.record(update("202", OrderUpdate.STATUS_PENDING, 4));

        assertEquals(1, events.size(), "Repeated quantity is not a new execution");
        OrderEvent event = events.get(0);
        assertEquals(0, event.previousTradedQty());
        assertEquals(4, event.newTradedQty());
        assertEquals(4, event.executedQty());
        assertEquals(new BigDecimal("40.00"), event.executionPercentage());
    }

    @Test
    void testFillToTradedEmitsInOrder() {
        List<OrderEventType> seen = new ArrayList<>();
        tracker.onAny(event -> seen.add(event.type()));

        tracker.record(update("203", OrderUpdate.STATUS_PENDING, 4));
        seen.clear();
        tracker.record(update("203", OrderUpdate.STATUS_TRADED, 10));

        assertEquals(List.of(OrderEventType.STATUS_CHANGE, OrderEventType.EXECUTION, OrderEventType.ORDER_TRADED),
            seen);
    }

    @Test
    void testOrderTradedFiresOnce() {
        List<OrderEvent> traded = new ArrayList<>();
        tracker.on(OrderEventType.ORDER_TRADED, traded::add);

        tracker.record(update("204", OrderUpdate.STATUS_TRADED, 10));
        tracker.record(update("204", OrderUpdate.STATUS_TRADED, 10));

        assertEquals(1, traded.size(), "Already traded order is not traded again");
        assertNull(traded.get(0).previousStatus());
    }

    @Test
    void testOrderRejected() {
        List<OrderEvent> rejected = new ArrayList<>();
        tracker.on(OrderEventType.ORDER_REJECTED, rejected::add);

        tracker.record(update("205", OrderUpdate.STATUS_TRANSIT, 0));
        tracker.record(update("205", OrderUpdate.STATUS_REJECTED, 0));

        assertEquals(1, rejected.size());
        assertEquals(OrderUpdate.STATUS_TRANSIT, rejected.get(0).previousStatus());
        assertEquals(OrderUpdate.STATUS_REJECTED, rejected.get(0).newStatus());
    }

    @Test
    void testOrderCancelledAfterPartialFill() {
        List<OrderEventType> seen = new ArrayList<>();
        tracker.onAny(event -> seen.add(event.type()));

        tracker.record(update("206", OrderUpdate.STATUS_PENDING, 3));
        seen.clear();
        tracker.record(update("206", OrderUpdate.STATUS_CANCELLED, 3));

        assertEquals(List.of(OrderEventType.STATUS_CHANGE, OrderEventType.ORDER_CANCELLED), seen);
    }

    @Test
    void testExpiredOnlyChangesStatus() {
        List<OrderEventType> seen = new ArrayList<>();
        tracker.onAny(event -> seen.add(event.type()));

        tracker.record(update("207", OrderUpdate.STATUS_PENDING, 0));
        tracker.record(update("207", OrderUpdate.STATUS_EXPIRED, 0));

        assertEquals(List.of(OrderEventType.STATUS_CHANGE), seen);
    }

    @Test
    void testFailingListenerDoesNotStopOthers() {
        List<OrderEvent> events = new ArrayList<>();
        tracker.on(OrderEventType.STATUS_CHANGE, event -> {
            throw new IllegalStateException("boom");
        });
        tracker.on(OrderEventType.STATUS_CHANGE, events::add);

        tracker.record(update("208", OrderUpdate.STATUS_TRANSIT, 0));
        tracker.record(update("208", OrderUpdate.STATUS_PENDING, 0));

        assertEquals(1, events.size());
        assertEquals(OrderUpdate.STATUS_PENDING, tracker.get("208").orElseThrow().status());
    }

    @Test
    void testRejectsInvalidLimits() {
        assertThrows(IllegalArgumentException.class,
            () -> new OrderStateTracker(0, Duration.ofHours(1), Duration.ofMinutes(5), clock, metrics));
        assertThrows(IllegalArgumentException.class,
            () -> new OrderStateTracker(10, Duration.ZERO, Duration.ofMinutes(5), clock, metrics));
    }

    static final class MutableClock extends Clock {
        private volatile Instant now;

        MutableClock(Instant start) {
            this.now = start;
        }

        void advance(Duration step) {
            now = now.plus(step);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
