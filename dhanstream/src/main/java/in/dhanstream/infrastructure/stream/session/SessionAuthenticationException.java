package in.dhanstream.infrastructure.stream.session;

/**
 * Delivered to error listeners when a channel gave up after repeated login rejections.
 */
public class SessionAuthenticationException extends RuntimeException {

    private final String channelId;
    private final int rejections;

    public SessionAuthenticationException(String channelId, int rejections, String message) {
        super(String.format("[%s:%d] %s", channelId, rejections, message));
        this.channelId = channelId;
        this.rejections = rejections;
    }

    public String getChannelId() {
        return channelId;
    }

    public int getRejections() {
        return rejections;
    }
}
