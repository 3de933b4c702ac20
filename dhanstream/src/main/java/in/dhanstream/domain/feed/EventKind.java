package in.dhanstream.domain.feed;

/**
 * Discriminator for {@link DecodedEvent} variants; listeners register per kind.
 */
public enum EventKind {
    TICKER,
    QUOTE,
    FULL,
    DEPTH_LEVEL,
    OPEN_INTEREST,
    PREV_CLOSE,
    DISCONNECT,
    ORDER_ALERT,
    DEPTH_BOOK,
    UNRECOGNIZED
}
