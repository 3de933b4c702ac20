package in.dhanstream.domain.feed;

import java.util.Arrays;

/**
 * A message the decoder does not know. Binary frames keep their response code; JSON envelopes use -1
 * and carry the UTF-8 text as the raw bytes.
 */
public record UnrecognizedEvent(int responseCode, byte[] rawBytes) implements DecodedEvent {

    public UnrecognizedEvent {
        rawBytes = rawBytes.clone();
    }

    @Override
    public byte[] rawBytes() {
        return rawBytes.clone();
    }

    @Override
    public EventKind kind() {
        return EventKind.UNRECOGNIZED;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof UnrecognizedEvent)) return false;
        UnrecognizedEvent other = (UnrecognizedEvent) o;
        return responseCode == other.responseCode && Arrays.equals(rawBytes, other.rawBytes);
    }

    @Override
    public int hashCode() {
        return 31 * responseCode + Arrays.hashCode(rawBytes);
    }

    @Override
    public String toString() {
        return "UnrecognizedEvent[responseCode=" + responseCode + ", length=" + rawBytes.length + "]";
    }
}
