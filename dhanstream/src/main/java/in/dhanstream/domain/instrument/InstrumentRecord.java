package in.dhanstream.domain.instrument;

/**
 * One row of the instrument master for a segment.
 */
public record InstrumentRecord(
        String symbolName,
        String displayName,
        String securityId,
        String exchangeSegment,
        String series
) {
}
