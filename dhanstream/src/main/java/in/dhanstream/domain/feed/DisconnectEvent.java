package in.dhanstream.domain.feed;

/**
 * Server notice that the feed is about to drop the connection (response code 50).
 */
public record DisconnectEvent(FrameHeader header, int reasonCode) implements DecodedEvent {

    @Override
    public EventKind kind() {
        return EventKind.DISCONNECT;
    }
}
