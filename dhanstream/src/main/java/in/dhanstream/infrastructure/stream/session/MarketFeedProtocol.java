package in.dhanstream.infrastructure.stream.session;

import com.fasterxml.jackson.databind.ObjectMapper;
import in.dhanstream.config.StreamConfig;
import in.dhanstream.domain.instrument.InstrumentRef;
import in.dhanstream.util.Env;

import java.net.URI;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Binary market feed; one session per {@link FeedMode}.
 */
public class MarketFeedProtocol extends AbstractChannelProtocol {

    public static final String FEED_HOST = "wss://api-feed.dhan.co";
    public static final int DISCONNECT_REQUEST_CODE = 12;

    private final StreamConfig config;
    private final FeedMode mode;

    public MarketFeedProtocol(StreamConfig config, FeedMode mode) {
        this(config, mode, new ObjectMapper());
    }

    public MarketFeedProtocol(StreamConfig config, FeedMode mode, ObjectMapper mapper) {
        super(mapper);
        config.requireFeedCredentials();
        this.config = config;
        this.mode = mode;
    }

    public FeedMode mode() {
        return mode;
    }

    @Override
    public String channelId() {
        return "feed-" + mode.name().toLowerCase(Locale.ROOT);
    }

    @Override
    public URI endpoint() {
        return URI.create(url(config.accessToken()));
    }

    @Override
    public String describeEndpoint() {
        return url(Env.mask(config.accessToken()));
    }

    private String url(String token) {
        return FEED_HOST + "?version=" + config.feedVersion()
            + "&token=" + encode(token)
            + "&clientId=" + encode(config.clientId())
            + "&authType=2";
    }

    @Override
    public List<String> subscribeCommands(List<InstrumentRef> instruments) {
        return instrumentCommands(mode.subscribeCode(), instruments);
    }

    @Override
    public List<String> unsubscribeCommands(List<InstrumentRef> instruments) {
        return instrumentCommands(mode.unsubscribeCode(), instruments);
    }

    @Override
    public Optional<String> disconnectMessage() {
        return Optional.of(requestCodeMessage(DISCONNECT_REQUEST_CODE));
    }
}
