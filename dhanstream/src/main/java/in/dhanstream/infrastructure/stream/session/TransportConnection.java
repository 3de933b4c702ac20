package in.dhanstream.infrastructure.stream.session;

import java.util.concurrent.CompletableFuture;

/**
 * An open transport connection. Sends are queued in call order.
 */
public interface TransportConnection {

    CompletableFuture<Void> send(String text);

    /**
     * Graceful close after pending sends.
     */
    void close(int statusCode, String reason);

    /**
     * Drop the connection immediately.
     */
    void abort();
}
