package in.dhanstream.domain.feed;

/**
 * Quote packet (response code 4).
 */
public record QuoteEvent(
        FrameHeader header,
        double lastPrice,
        int lastTradeQty,
        long lastTradeTime,
        double averagePrice,
        long volume,
        int totalSellQty,
        int totalBuyQty,
        double dayOpen,
        double dayClose,
        double dayHigh,
        double dayLow
) implements DecodedEvent {

    @Override
    public EventKind kind() {
        return EventKind.QUOTE;
    }
}
