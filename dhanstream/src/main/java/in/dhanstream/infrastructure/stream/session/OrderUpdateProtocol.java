package in.dhanstream.infrastructure.stream.session;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import in.dhanstream.config.StreamConfig;
import in.dhanstream.domain.instrument.InstrumentRef;
import in.dhanstream.infrastructure.stream.decoder.DecodeResult;

import java.net.URI;
import java.util.List;
import java.util.Optional;

/**
 * Order update channel: authenticates with a login message, then pushes {@code order_alert} envelopes.
 */
public class OrderUpdateProtocol extends AbstractChannelProtocol {

    public static final int LOGIN_MSG_CODE = 42;

    private final StreamConfig config;

    public OrderUpdateProtocol(StreamConfig config) {
        this(config, new ObjectMapper());
    }

    public OrderUpdateProtocol(StreamConfig config, ObjectMapper mapper) {
        super(mapper);
        config.requireLoginCredentials();
        this.config = config;
    }

    @Override
    public String channelId() {
        return "orders";
    }

    @Override
    public URI endpoint() {
        return URI.create(config.orderUrl());
    }

    @Override
    public String describeEndpoint() {
        return config.orderUrl();
    }

    /**
     * SELF: {@code {"LoginReq":{"MsgCode":42,"ClientId":..,"Token":..},"UserType":"SELF"}}.
     * PARTNER: {@code {"LoginReq":{"MsgCode":42,"ClientId":<partner id>},"UserType":"PARTNER","Secret":..}}.
     */
    @Override
    public Optional<String> loginMessage() {
        ObjectNode root = mapper.createObjectNode();
        ObjectNode login = root.putObject("LoginReq");
        login.put("MsgCode", LOGIN_MSG_CODE);
        if (config.userType() == StreamConfig.UserType.PARTNER) {
            login.put("ClientId", config.partnerId());
            root.put("UserType", "PARTNER");
            root.put("Secret", config.partnerSecret());
        } else {
            login.put("ClientId", config.clientId());
            login.put("Token", config.accessToken());
            root.put("UserType", "SELF");
        }
        return Optional.of(write(root));
    }

    @Override
    public boolean supportsSubscriptions() {
        return false;
    }

    @Override
    public List<String> subscribeCommands(List<InstrumentRef> instruments) {
        return List.of();
    }

    @Override
    public List<String> unsubscribeCommands(List<InstrumentRef> instruments) {
        return List.of();
    }

    @Override
    public DecodeResult decodeBinary(byte[] frame) {
        return DecodeResult.failure("unexpected binary frame on order channel", frame == null ? 0 : frame.length);
    }
}
