package in.dhanstream.infrastructure.stream.session;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.WebSocket;
import java.net.http.WebSocketHandshakeException;
import java.nio.ByteBuffer;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;

/**
 * {@link FeedTransport} on top of {@code java.net.http.WebSocket}.
 *
 * Fragmented messages are reassembled before delivery. The next message is requested only after the
 * listener returns, so delivery for one connection is sequential.
 */
public class JdkWebSocketTransport implements FeedTransport {
    private static final Logger log = LoggerFactory.getLogger(JdkWebSocketTransport.class);

    private final HttpClient httpClient;

    public JdkWebSocketTransport() {
        this(HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(10))
            .build());
    }

    public JdkWebSocketTransport(HttpClient httpClient) {
        this.httpClient = httpClient;
    }

    @Override
    public CompletableFuture<TransportConnection> connect(URI endpoint, TransportListener listener) {
        Adapter adapter = new Adapter(listener);
        return httpClient.newWebSocketBuilder()
            .buildAsync(endpoint, adapter)
            .handle((ws, error) -> {
                if (error != null) {
                    throw new CompletionException(translate(error));
                }
                return adapter.connectionFor(ws);
            });
    }

    private static Throwable translate(Throwable error) {
        Throwable cause = error instanceof CompletionException && error.getCause() != null
            ? error.getCause() : error;
        if (cause instanceof WebSocketHandshakeException) {
            int status = ((WebSocketHandshakeException) cause).getResponse().statusCode();
            return new HandshakeRejectedException(status, "websocket upgrade refused");
        }
        return cause;
    }

    private static final class Adapter implements WebSocket.Listener {
        private final TransportListener listener;
        private final StringBuilder text = new StringBuilder();
        private final ByteArrayOutputStream binary = new ByteArrayOutputStream();
        private JdkConnection connection;

        Adapter(TransportListener listener) {
            this.listener = listener;
        }

        synchronized JdkConnection connectionFor(WebSocket webSocket) {
            if (connection == null) {
                connection = new JdkConnection(webSocket);
            }
            return connection;
        }

        @Override
        public void onOpen(WebSocket webSocket) {
            try {
                listener.onOpen(connectionFor(webSocket));
            } finally {
                webSocket.request(1);
            }
        }

        @Override
        public CompletionStage<?> onText(WebSocket webSocket, CharSequence data, boolean last) {
            text.append(data);
            if (last) {
                String message = text.toString();
                text.setLength(0);
                try {
                    listener.onText(message);
                } finally {
                    webSocket.request(1);
                }
            } else {
                webSocket.request(1);
            }
            return null;
        }

        @Override
        public CompletionStage<?> onBinary(WebSocket webSocket, ByteBuffer data, boolean last) {
            byte[] chunk = new byte[data.remaining()];
            data.get(chunk);
            binary.write(chunk, 0, chunk.length);
            if (last) {
                byte[] message = binary.toByteArray();
                binary.reset();
                try {
                    listener.onBinary(message);
                } finally {
                    webSocket.request(1);
                }
            } else {
                webSocket.request(1);
            }
            return null;
        }

        @Override
        public CompletionStage<?> onClose(WebSocket webSocket, int statusCode, String reason) {
            listener.onClose(statusCode, reason);
            return null;
        }

        @Override
        public void onError(WebSocket webSocket, Throwable error) {
            listener.onError(error);
        }
    }

    private static final class JdkConnection implements TransportConnection {
        private final WebSocket webSocket;
        private CompletableFuture<WebSocket> sendChain = CompletableFuture.completedFuture(null);

        JdkConnection(WebSocket webSocket) {
            this.webSocket = webSocket;
        }

        @Override
        public synchronized CompletableFuture<Void> send(String text) {
            // WebSocket allows one outstanding send; chain them
            sendChain = sendChain
                .exceptionally(ignored -> null)
                .thenCompose(ignored -> webSocket.sendText(text, true));
            return sendChain.whenComplete((ws, error) -> {
                if (error != null) {
                    log.warn("[WS] Send failed: {}", error.getMessage());
                }
            }).thenApply(ws -> null);
        }

        @Override
        public synchronized void close(int statusCode, String reason) {
            sendChain = sendChain
                .exceptionally(ignored -> null)
                .thenCompose(ignored -> webSocket.sendClose(statusCode, reason));
            sendChain.whenComplete((ws, error) -> {
                if (error != null) {
                    log.debug("[WS] Close handshake failed, aborting: {}", error.getMessage());
                    webSocket.abort();
                }
            });
        }

        @Override
        public void abort() {
            webSocket.abort();
        }
    }
}
