package in.dhanstream.domain.order;

import java.time.Instant;

/**
 * Last known state of one order, replaced wholesale on every update.
 */
public record TrackedOrder(
        String orderId,
        String status,
        int tradedQty,
        String symbol,
        Instant lastSeenAt
) {

    public static TrackedOrder of(String orderId, OrderUpdate update, Instant seenAt) {
        return new TrackedOrder(orderId, update.status(), update.tradedQty(), update.symbol(), seenAt);
    }
}
