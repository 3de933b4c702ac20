package in.dhanstream.domain.feed;

public record OpenInterestEvent(FrameHeader header, int openInterest) implements DecodedEvent {

    @Override
    public EventKind kind() {
        return EventKind.OPEN_INTEREST;
    }
}
