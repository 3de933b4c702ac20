package in.dhanstream.infrastructure.stream.session;

import com.fasterxml.jackson.databind.ObjectMapper;
import in.dhanstream.config.StreamConfig;
import in.dhanstream.domain.instrument.InstrumentRef;
import in.dhanstream.util.Env;

import java.net.URI;
import java.util.List;

/**
 * Market depth channel (20 or 200 levels), delivering JSON depth updates and snapshots.
 */
public class MarketDepthProtocol extends AbstractChannelProtocol {

    public static final String DEPTH_20_URL = "wss://depth-api-feed.dhan.co/twentydepth";
    public static final String DEPTH_200_URL = "wss://full-depth-api.dhan.co/twohundreddepth";
    public static final int SUBSCRIBE_CODE = 23;
    public static final int UNSUBSCRIBE_CODE = 12;

    private final StreamConfig config;

    public MarketDepthProtocol(StreamConfig config) {
        this(config, new ObjectMapper());
    }

    public MarketDepthProtocol(StreamConfig config, ObjectMapper mapper) {
        super(mapper);
        config.requireFeedCredentials();
        this.config = config;
    }

    @Override
    public String channelId() {
        return "depth-" + config.depthLevel();
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
        String base = config.depthLevel() == 200 ? DEPTH_200_URL : DEPTH_20_URL;
        return base + "?token=" + encode(token) + "&clientId=" + encode(config.clientId()) + "&authType=2";
    }

    @Override
    public List<String> subscribeCommands(List<InstrumentRef> instruments) {
        return instrumentCommands(SUBSCRIBE_CODE, instruments);
    }

    @Override
    public List<String> unsubscribeCommands(List<InstrumentRef> instruments) {
        return instrumentCommands(UNSUBSCRIBE_CODE, instruments);
    }
}
