package in.dhanstream.domain.instrument;

import java.util.Objects;

/**
 * A resolved subscription target: what goes into the wire command, plus where it came from.
 *
 * @param exchangeSegment segment name as sent on the wire (e.g. NSE_EQ)
 * @param securityId      instrument id as sent on the wire
 * @param displayLabel    human readable name for logs
 * @param originalInput   the caller reference this was resolved from
 */
public record InstrumentRef(
        String exchangeSegment,
        String securityId,
        String displayLabel,
        String originalInput
) {
    public InstrumentRef {
        Objects.requireNonNull(exchangeSegment, "exchangeSegment");
        Objects.requireNonNull(securityId, "securityId");
    }

    /**
     * Identity of the instrument on the wire, shared by every caller reference that resolves to it.
     *
     * @return {@code SEGMENT:SECURITYID}
     */
    public String key() {
        return exchangeSegment + ":" + securityId;
    }
}
