package in.dhanstream.domain.feed;

import java.util.Optional;

/**
 * The 8-byte header in front of every binary feed frame.
 *
 * @param responseCode   packet kind selector
 * @param declaredLength message length as announced by the server
 * @param segmentCode    raw exchange segment code
 * @param securityId     instrument id
 */
public record FrameHeader(int responseCode, int declaredLength, int segmentCode, int securityId) {

    public static final int SIZE = 8;

    public Optional<ExchangeSegment> segment() {
        return ExchangeSegment.fromCode(segmentCode);
    }
}
