package in.dhanstream.domain.order;

import java.math.BigDecimal;

/**
 * One derived order lifecycle change.
 *
 * @param type              what changed
 * @param update            the update that caused it
 * @param previousStatus    tracked status before the update, null for a first sighting
 * @param newStatus         status carried by the update
 * @param previousTradedQty tracked traded quantity before the update, 0 for a first sighting
 * @param newTradedQty      traded quantity carried by the update
 */
public record OrderEvent(
        OrderEventType type,
        OrderUpdate update,
        String previousStatus,
        String newStatus,
        int previousTradedQty,
        int newTradedQty
) {

    public String orderId() {
        return update.orderNo();
    }

    /**
     * Quantity filled by this update alone.
     */
    public int executedQty() {
        return newTradedQty - previousTradedQty;
    }

    /**
     * Share of the order quantity traded so far, two decimals.
     */
    public BigDecimal executionPercentage() {
        return update.fillPercentage();
    }
}
