package in.dhanstream.infrastructure.stream.session;

/**
 * A command that the session cannot accept in its current state or on its channel.
 */
public class SessionStateException extends RuntimeException {

    private final String channelId;

    public SessionStateException(String channelId, String message) {
        super(String.format("[%s] %s", channelId, message));
        this.channelId = channelId;
    }

    public String getChannelId() {
        return channelId;
    }
}
