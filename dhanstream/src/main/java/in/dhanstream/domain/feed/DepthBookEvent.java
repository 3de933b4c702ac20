package in.dhanstream.domain.feed;

import java.util.List;

/**
 * Depth update or snapshot from the market depth channel.
 */
public record DepthBookEvent(
        Type type,
        String symbol,
        String exchangeSegment,
        String securityId,
        String timestamp,
        List<BookLevel> bids,
        List<BookLevel> asks,
        double bestBid,
        double bestAsk,
        long totalBidQty,
        long totalAskQty
) implements DecodedEvent {

    public enum Type { UPDATE, SNAPSHOT }

    public DepthBookEvent {
        bids = List.copyOf(bids);
        asks = List.copyOf(asks);
    }

    /**
     * Best ask minus best bid, or 0.0 when either side is empty.
     */
    public double spread() {
        if (bestBid == 0.0 || bestAsk == 0.0) {
            return 0.0;
        }
        return bestAsk - bestBid;
    }

    @Override
    public EventKind kind() {
        return EventKind.DEPTH_BOOK;
    }
}
