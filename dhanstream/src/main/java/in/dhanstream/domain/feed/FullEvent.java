package in.dhanstream.domain.feed;

import java.util.List;

/**
 * Full packet (response code 8): quote fields, open interest and five depth levels.
 */
public record FullEvent(
        FrameHeader header,
        double lastPrice,
        int lastTradeQty,
        long lastTradeTime,
        double averagePrice,
        long volume,
        int totalSellQty,
        int totalBuyQty,
        int openInterest,
        int highestOpenInterest,
        int lowestOpenInterest,
        double dayOpen,
        double dayClose,
        double dayHigh,
        double dayLow,
        List<DepthLevel> depth
) implements DecodedEvent {

    public FullEvent {
        depth = List.copyOf(depth);
    }

    @Override
    public EventKind kind() {
        return EventKind.FULL;
    }
}
