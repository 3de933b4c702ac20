package in.dhanstream.domain.feed;

public record PrevCloseEvent(FrameHeader header, double prevClose, int prevOpenInterest) implements DecodedEvent {

    @Override
    public EventKind kind() {
        return EventKind.PREV_CLOSE;
    }
}
