package in.dhanstream.domain.order;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

class OrderUpdateTest {

    private static OrderUpdate order(String txnType, String status, int quantity, int traded, String avgPrice) {
        return new OrderUpdate("1", "EX1", status, "NSE", "D", "52175", "NIFTY24JUN22000CE", "NIFTY 22000 CE",
            txnType, "LMT", "M", "OPTIDX", "CE", quantity, traded, quantity - traded,
            new BigDecimal("120.50"), null, avgPrice == null ? null : new BigDecimal(avgPrice), 1, "0",
            "Super Order", null, "corr-9", "2024-06-03 10:01:02");
    }

    @Test
    void testPartialFill() {
        OrderUpdate update = order("B", OrderUpdate.STATUS_PENDING, 75, 25, "120.00");

        assertTrue(update.isBuy());
        assertFalse(update.isSell());
        assertTrue(update.isPartiallyFilled());
        assertFalse(update.isFullyExecuted());
        assertFalse(update.isTerminal());
        assertEquals(50, update.pendingQuantity());
        assertEquals(new BigDecimal("33.33"), update.fillPercentage());
        assertEquals(new BigDecimal("3000.00"), update.tradedValue());
    }

    @Test
    void testTerminalStates() {
        assertTrue(order("S", OrderUpdate.STATUS_TRADED, 50, 50, "121").isTerminal());
        assertTrue(order("S", OrderUpdate.STATUS_TRADED, 50, 50, "121").isFullyExecuted());
        assertTrue(order("S", OrderUpdate.STATUS_REJECTED, 50, 0, null).isRejected());
        assertTrue(order("S", OrderUpdate.STATUS_CANCELLED, 50, 0, null).isTerminal());
        assertTrue(order("S", OrderUpdate.STATUS_EXPIRED, 50, 0, null).isTerminal());
        assertFalse(order("S", OrderUpdate.STATUS_TRANSIT, 50, 0, null).isTerminal());
    }

    @Test
    void testFlagsAndEdgeCases() {
        OrderUpdate update = order("S", OrderUpdate.STATUS_PENDING, 0, 0, null);

        assertTrue(update.isSell());
        assertTrue(update.isOption());
        assertTrue(update.isSuperOrder());
        assertFalse(update.isAfterMarketOrder());
        assertEquals(new BigDecimal("0.00"), update.fillPercentage(), "Zero quantity does not divide");
        assertEquals(BigDecimal.ZERO, update.tradedValue());
    }
}
