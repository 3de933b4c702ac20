package in.dhanstream.infrastructure.stream.resolve;

import in.dhanstream.domain.instrument.InstrumentRecord;

import java.util.List;

/**
 * Source of the instrument master, one segment at a time. Implementations may block on network I/O
 * and may throw; the resolver calls each segment at most once per successful load.
 */
@FunctionalInterface
public interface InstrumentDirectory {

    List<InstrumentRecord> bySegment(String exchangeSegment);
}
