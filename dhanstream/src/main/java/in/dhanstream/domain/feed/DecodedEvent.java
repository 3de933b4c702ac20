package in.dhanstream.domain.feed;

/**
 * One decoded inbound message. Each implementation is an immutable record for a single packet kind.
 */
public interface DecodedEvent {

    EventKind kind();
}
