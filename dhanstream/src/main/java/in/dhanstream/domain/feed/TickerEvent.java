package in.dhanstream.domain.feed;

/**
 * Last traded price and time (response code 2).
 */
public record TickerEvent(FrameHeader header, double lastPrice, int lastTradeTime) implements DecodedEvent {

    @Override
    public EventKind kind() {
        return EventKind.TICKER;
    }
}
