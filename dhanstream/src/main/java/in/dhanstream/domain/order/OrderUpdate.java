package in.dhanstream.domain.order;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Order state pushed on the order update channel.
 */
public record OrderUpdate(
        String orderNo,
        String exchOrderNo,
        String status,
        String exchange,
        String segment,
        String securityId,
        String symbol,
        String displayName,
        String txnType,      // B or S
        String orderType,    // LMT, MKT, SL, SLM
        String product,      // C, I, M, F, V, B
        String instrument,
        String optType,
        int quantity,
        int tradedQty,
        int remainingQuantity,
        BigDecimal price,
        BigDecimal triggerPrice,
        BigDecimal avgTradedPrice,
        int legNo,
        String offMktFlag,
        String remarks,
        String reasonDescription,
        String correlationId,
        String lastUpdatedTime
) {

    public static final String STATUS_TRANSIT = "TRANSIT";
    public static final String STATUS_PENDING = "PENDING";
    public static final String STATUS_REJECTED = "REJECTED";
    public static final String STATUS_CANCELLED = "CANCELLED";
    public static final String STATUS_TRADED = "TRADED";
    public static final String STATUS_EXPIRED = "EXPIRED";

    public boolean isBuy() {
        return "B".equals(txnType);
    }

    public boolean isSell() {
        return "S".equals(txnType);
    }

    public boolean isTraded() {
        return STATUS_TRADED.equals(status);
    }

    public boolean isRejected() {
        return STATUS_REJECTED.equals(status);
    }

    /**
     * No further updates are expected for an order in this state.
     */
    public boolean isTerminal() {
        return STATUS_TRADED.equals(status)
            || STATUS_REJECTED.equals(status)
            || STATUS_CANCELLED.equals(status)
            || STATUS_EXPIRED.equals(status);
    }

    public boolean isPartiallyFilled() {
        return tradedQty > 0 && tradedQty < quantity;
    }

    public boolean isFullyExecuted() {
        return quantity > 0 && tradedQty == quantity;
    }

    public boolean isAfterMarketOrder() {
        return "1".equals(offMktFlag);
    }

    public boolean isSuperOrder() {
        return "Super Order".equals(remarks);
    }

    public boolean isOption() {
        return "CE".equals(optType) || "PE".equals(optType);
    }

    public int pendingQuantity() {
        return Math.max(0, quantity - tradedQty);
    }

    /**
     * Percentage of the order quantity traded, two decimals.
     */
    public BigDecimal fillPercentage() {
        if (quantity == 0) {
            return BigDecimal.ZERO.setScale(2);
        }
        return BigDecimal.valueOf(tradedQty)
            .multiply(BigDecimal.valueOf(100))
            .divide(BigDecimal.valueOf(quantity), 2, RoundingMode.HALF_UP);
    }

    public BigDecimal tradedValue() {
        if (avgTradedPrice == null) {
            return BigDecimal.ZERO;
        }
        return avgTradedPrice.multiply(BigDecimal.valueOf(tradedQty));
    }
}
