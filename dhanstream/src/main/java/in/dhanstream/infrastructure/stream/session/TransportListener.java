package in.dhanstream.infrastructure.stream.session;

/**
 * Inbound side of a transport connection. Callbacks for one connection never run concurrently, and no
 * message is delivered before {@link #onOpen} returns.
 */
public interface TransportListener {

    void onOpen(TransportConnection connection);

    void onText(String text);

    void onBinary(byte[] data);

    void onClose(int statusCode, String reason);

    void onError(Throwable error);
}
