package in.dhanstream.domain.feed;

/**
 * Single depth level pushed on its own (response codes 41 for bid side, 51 for ask side).
 */
public record DepthLevelEvent(FrameHeader header, Side side, DepthLevel level) implements DecodedEvent {

    public enum Side { BID, ASK }

    @Override
    public EventKind kind() {
        return EventKind.DEPTH_LEVEL;
    }
}
