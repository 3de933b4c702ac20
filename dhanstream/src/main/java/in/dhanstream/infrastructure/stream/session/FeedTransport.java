package in.dhanstream.infrastructure.stream.session;

import java.net.URI;
import java.util.concurrent.CompletableFuture;

/**
 * Opens websocket-style connections. A failed handshake completes the future exceptionally, with
 * {@link HandshakeRejectedException} when the server answered with an HTTP status.
 */
public interface FeedTransport {

    CompletableFuture<TransportConnection> connect(URI endpoint, TransportListener listener);
}
