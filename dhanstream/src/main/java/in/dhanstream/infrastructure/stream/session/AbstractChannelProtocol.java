package in.dhanstream.infrastructure.stream.session;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import in.dhanstream.domain.instrument.InstrumentRef;
import in.dhanstream.infrastructure.stream.decoder.DecodeResult;
import in.dhanstream.infrastructure.stream.decoder.FrameDecoder;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Shared command encoding and decoding for the JSON-commanded channels.
 */
public abstract class AbstractChannelProtocol implements ChannelProtocol {

    /** The feed rejects subscribe messages with more instruments than this. */
    public static final int MAX_INSTRUMENTS_PER_MESSAGE = 100;

    protected final ObjectMapper mapper;
    protected final FrameDecoder decoder;

    protected AbstractChannelProtocol(ObjectMapper mapper) {
        this.mapper = mapper;
        this.decoder = new FrameDecoder(mapper);
    }

    @Override
    public boolean supportsSubscriptions() {
        return true;
    }

    @Override
    public Optional<String> loginMessage() {
        return Optional.empty();
    }

    @Override
    public Optional<String> disconnectMessage() {
        return Optional.empty();
    }

    @Override
    public DecodeResult decodeBinary(byte[] frame) {
        return decoder.decode(frame);
    }

    @Override
    public DecodeResult decodeText(String text) {
        return decoder.decodeText(text);
    }

    /**
     * {@code {"RequestCode":..,"InstrumentCount":..,"InstrumentList":[..]}} messages, at most
     * {@link #MAX_INSTRUMENTS_PER_MESSAGE} instruments each.
     */
    protected List<String> instrumentCommands(int requestCode, List<InstrumentRef> instruments) {
        List<String> messages = new ArrayList<>();
        for (int from = 0; from < instruments.size(); from += MAX_INSTRUMENTS_PER_MESSAGE) {
            List<InstrumentRef> chunk =
                instruments.subList(from, Math.min(from + MAX_INSTRUMENTS_PER_MESSAGE, instruments.size()));
            ObjectNode root = mapper.createObjectNode();
            root.put("RequestCode", requestCode);
            root.put("InstrumentCount", chunk.size());
            ArrayNode list = root.putArray("InstrumentList");
            for (InstrumentRef instrument : chunk) {
                ObjectNode node = list.addObject();
                node.put("ExchangeSegment", instrument.exchangeSegment());
                node.put("SecurityId", instrument.securityId());
            }
            messages.add(write(root));
        }
        return messages;
    }

    protected String requestCodeMessage(int requestCode) {
        ObjectNode root = mapper.createObjectNode();
        root.put("RequestCode", requestCode);
        return write(root);
    }

    protected String write(ObjectNode node) {
        try {
            return mapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize " + channelId() + " command", e);
        }
    }

    protected static String encode(String value) {
        return URLEncoder.encode(value == null ? "" : value, StandardCharsets.UTF_8);
    }
}
