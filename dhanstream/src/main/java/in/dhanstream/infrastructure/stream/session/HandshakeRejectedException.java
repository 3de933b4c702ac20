package in.dhanstream.infrastructure.stream.session;

/**
 * The server refused the websocket upgrade with an HTTP status.
 */
public class HandshakeRejectedException extends RuntimeException {

    private final int statusCode;

    public HandshakeRejectedException(int statusCode, String message) {
        super(String.format("[HANDSHAKE:%d] %s", statusCode, message));
        this.statusCode = statusCode;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
