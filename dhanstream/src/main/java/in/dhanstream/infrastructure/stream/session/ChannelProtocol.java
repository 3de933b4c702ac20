package in.dhanstream.infrastructure.stream.session;

import in.dhanstream.domain.instrument.InstrumentRef;
import in.dhanstream.infrastructure.stream.decoder.DecodeResult;

import java.net.URI;
import java.util.List;
import java.util.Optional;

/**
 * What differs between Dhan streaming channels: endpoint, login, command codes and payload decoding.
 */
public interface ChannelProtocol {

    /** Short stable name used in logs, metrics and thread names. */
    String channelId();

    URI endpoint();

    /** Endpoint with credentials masked, for logs. */
    String describeEndpoint();

    /** Payload sent right after the connection opens, if the channel authenticates in-band. */
    Optional<String> loginMessage();

    boolean supportsSubscriptions();

    List<String> subscribeCommands(List<InstrumentRef> instruments);

    List<String> unsubscribeCommands(List<InstrumentRef> instruments);

    /** Payload sent before a client-initiated close, if the channel defines one. */
    Optional<String> disconnectMessage();

    DecodeResult decodeBinary(byte[] frame);

    DecodeResult decodeText(String text);
}
