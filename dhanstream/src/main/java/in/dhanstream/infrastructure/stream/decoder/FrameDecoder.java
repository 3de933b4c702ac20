package in.dhanstream.infrastructure.stream.decoder;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import in.dhanstream.domain.feed.BookLevel;
import in.dhanstream.domain.feed.DepthBookEvent;
import in.dhanstream.domain.feed.DepthLevel;
import in.dhanstream.domain.feed.DepthLevelEvent;
import in.dhanstream.domain.feed.DisconnectEvent;
import in.dhanstream.domain.feed.FrameHeader;
import in.dhanstream.domain.feed.FullEvent;
import in.dhanstream.domain.feed.OpenInterestEvent;
import in.dhanstream.domain.feed.OrderAlertEvent;
import in.dhanstream.domain.feed.PrevCloseEvent;
import in.dhanstream.domain.feed.QuoteEvent;
import in.dhanstream.domain.feed.TickerEvent;
import in.dhanstream.domain.feed.UnrecognizedEvent;
import in.dhanstream.domain.order.OrderUpdate;

import java.math.BigDecimal;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Stateless decoder for Dhan market feed frames and JSON channel envelopes.
 *
 * Binary frame layout:
 * <pre>
 *   byte 0      response code
 *   bytes 1-2   message length, big-endian
 *   byte 3      exchange segment
 *   bytes 4-7   security id, little-endian int32
 *   bytes 8..   payload, little-endian fields
 * </pre>
 *
 * Decoding never throws: short or malformed input yields {@link DecodeResult#failure}, unknown
 * response codes yield an {@link UnrecognizedEvent}.
 */
public final class FrameDecoder {

    public static final int CODE_TICKER = 2;
    public static final int CODE_QUOTE = 4;
    public static final int CODE_OI = 5;
    public static final int CODE_PREV_CLOSE = 6;
    public static final int CODE_FULL = 8;
    public static final int CODE_DEPTH_BID = 41;
    public static final int CODE_DISCONNECT = 50;
    public static final int CODE_DEPTH_ASK = 51;

    static final int TICKER_SIZE = 8;
    static final int QUOTE_SIZE = 42;
    static final int FULL_SIZE = 54 + 5 * DepthLevel.SIZE;
    static final int OI_SIZE = 4;
    static final int PREV_CLOSE_SIZE = 8;
    static final int DISCONNECT_SIZE = 2;
    static final int DEPTH_LEVELS = 5;

    public static final String TYPE_ORDER_ALERT = "order_alert";
    public static final String TYPE_DEPTH_UPDATE = "depth_update";
    public static final String TYPE_DEPTH_SNAPSHOT = "depth_snapshot";

    private final ObjectMapper mapper;

    public FrameDecoder() {
        this(new ObjectMapper());
    }

    public FrameDecoder(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    // ════════════════════════════════════════════════════════════════════════
    // BINARY FRAMES
    // ════════════════════════════════════════════════════════════════════════

    public DecodeResult decode(byte[] bytes) {
        if (bytes == null) {
            return DecodeResult.failure("null frame", 0);
        }
        return decode(ByteBuffer.wrap(bytes));
    }

    /**
     * Decode the remaining bytes of {@code frame}. The buffer position is not modified.
     */
    public DecodeResult decode(ByteBuffer frame) {
        ByteBuffer buf = frame.slice();
        int length = buf.remaining();
        if (length < FrameHeader.SIZE) {
            return DecodeResult.failure("frame shorter than header: " + length + " bytes", length);
        }

        try {
            FrameHeader header = readHeader(buf);
            ByteBuffer payload = buf.slice().order(ByteOrder.LITTLE_ENDIAN);

            return switch (header.responseCode()) {
                case CODE_TICKER -> decodeTicker(header, payload, length);
                case CODE_QUOTE -> decodeQuote(header, payload, length);
                case CODE_FULL -> decodeFull(header, payload, length);
                case CODE_OI -> decodeOpenInterest(header, payload, length);
                case CODE_PREV_CLOSE -> decodePrevClose(header, payload, length);
                case CODE_DISCONNECT -> decodeDisconnect(header, payload, length);
                case CODE_DEPTH_BID -> decodeDepthLevel(header, DepthLevelEvent.Side.BID, payload, length);
                case CODE_DEPTH_ASK -> decodeDepthLevel(header, DepthLevelEvent.Side.ASK, payload, length);
                default -> DecodeResult.success(new UnrecognizedEvent(header.responseCode(), copy(frame)), length);
            };
        } catch (RuntimeException e) {
            // A layout bug must not take the channel down with it
            return DecodeResult.failure("decode error: " + e, length);
        }
    }

    private static FrameHeader readHeader(ByteBuffer buf) {
        int responseCode = buf.get() & 0xFF;
        buf.order(ByteOrder.BIG_ENDIAN);
        int declaredLength = buf.getShort() & 0xFFFF;
        int segmentCode = buf.get() & 0xFF;
        buf.order(ByteOrder.LITTLE_ENDIAN);
        int securityId = buf.getInt();
        return new FrameHeader(responseCode, declaredLength, segmentCode, securityId);
    }

    private static DecodeResult decodeTicker(FrameHeader header, ByteBuffer p, int length) {
        if (p.remaining() < TICKER_SIZE) {
            return truncated("TICKER", TICKER_SIZE, p, length);
        }
        return DecodeResult.success(new TickerEvent(header, p.getFloat(), p.getInt()), length);
    }

    private static DecodeResult decodeQuote(FrameHeader header, ByteBuffer p, int length) {
        if (p.remaining() < QUOTE_SIZE) {
            return truncated("QUOTE", QUOTE_SIZE, p, length);
        }
        QuoteEvent quote = new QuoteEvent(
            header,
            p.getFloat(),
            p.getShort() & 0xFFFF,
            p.getInt() & 0xFFFFFFFFL,
            p.getFloat(),
            p.getInt() & 0xFFFFFFFFL,
            p.getInt(),
            p.getInt(),
            p.getFloat(),
            p.getFloat(),
            p.getFloat(),
            p.getFloat());
        return DecodeResult.success(quote, length);
    }

    private static DecodeResult decodeFull(FrameHeader header, ByteBuffer p, int length) {
        if (p.remaining() < FULL_SIZE) {
            return truncated("FULL", FULL_SIZE, p, length);
        }
        double ltp = p.getFloat();
        int ltq = p.getShort() & 0xFFFF;
        long ltt = p.getInt() & 0xFFFFFFFFL;
        double atp = p.getFloat();
        long volume = p.getInt() & 0xFFFFFFFFL;
        int totalSell = p.getInt();
        int totalBuy = p.getInt();
        int oi = p.getInt();
        int highestOi = p.getInt();
        int lowestOi = p.getInt();
        double open = p.getFloat();
        double close = p.getFloat();
        double high = p.getFloat();
        double low = p.getFloat();

        List<DepthLevel> depth = new ArrayList<>(DEPTH_LEVELS);
        for (int i = 0; i < DEPTH_LEVELS; i++) {
            depth.add(readDepthLevel(p));
        }
        return DecodeResult.success(new FullEvent(header, ltp, ltq, ltt, atp, volume, totalSell, totalBuy,
            oi, highestOi, lowestOi, open, close, high, low, depth), length);
    }

    private static DecodeResult decodeOpenInterest(FrameHeader header, ByteBuffer p, int length) {
        if (p.remaining() < OI_SIZE) {
            return truncated("OPEN_INTEREST", OI_SIZE, p, length);
        }
        return DecodeResult.success(new OpenInterestEvent(header, p.getInt()), length);
    }

    private static DecodeResult decodePrevClose(FrameHeader header, ByteBuffer p, int length) {
        if (p.remaining() < PREV_CLOSE_SIZE) {
            return truncated("PREV_CLOSE", PREV_CLOSE_SIZE, p, length);
        }
        return DecodeResult.success(new PrevCloseEvent(header, p.getFloat(), p.getInt()), length);
    }

    private static DecodeResult decodeDisconnect(FrameHeader header, ByteBuffer p, int length) {
        if (p.remaining() < DISCONNECT_SIZE) {
            return truncated("DISCONNECT", DISCONNECT_SIZE, p, length);
        }
        int reason = p.order(ByteOrder.BIG_ENDIAN).getShort() & 0xFFFF;
        return DecodeResult.success(new DisconnectEvent(header, reason), length);
    }

    private static DecodeResult decodeDepthLevel(FrameHeader header, DepthLevelEvent.Side side,
                                                 ByteBuffer p, int length) {
        if (p.remaining() < DepthLevel.SIZE) {
            return truncated("DEPTH_LEVEL", DepthLevel.SIZE, p, length);
        }
        return DecodeResult.success(new DepthLevelEvent(header, side, readDepthLevel(p)), length);
    }

    static DepthLevel readDepthLevel(ByteBuffer p) {
        return new DepthLevel(
            p.getInt() & 0xFFFFFFFFL,
            p.getInt() & 0xFFFFFFFFL,
            p.getShort() & 0xFFFF,
            p.getShort() & 0xFFFF,
            p.getFloat(),
            p.getFloat());
    }

    private static DecodeResult truncated(String kind, int needed, ByteBuffer payload, int length) {
        return DecodeResult.failure(
            "truncated " + kind + " payload: need " + needed + " bytes, got " + payload.remaining(), length);
    }

    private static byte[] copy(ByteBuffer frame) {
        ByteBuffer dup = frame.slice();
        byte[] out = new byte[dup.remaining()];
        dup.get(out);
        return out;
    }

    // ════════════════════════════════════════════════════════════════════════
    // JSON ENVELOPES
    // ════════════════════════════════════════════════════════════════════════

    /**
     * Decode a {@code {"Type": ..., "Data": {...}}} envelope.
     */
    public DecodeResult decodeText(String text) {
        int length = text == null ? 0 : text.length();
        if (text == null || text.isBlank()) {
            return DecodeResult.failure("empty text message", length);
        }

        JsonNode root;
        try {
            root = mapper.readTree(text);
        } catch (JsonProcessingException e) {
            return DecodeResult.failure("invalid JSON: " + e.getOriginalMessage(), length);
        }
        if (root == null || !root.isObject()) {
            return DecodeResult.failure("JSON envelope is not an object", length);
        }

        String type = root.path("Type").asText("");
        if (type.isEmpty()) {
            return DecodeResult.failure("JSON envelope without Type", length);
        }

        try {
            return switch (type) {
                case TYPE_ORDER_ALERT -> decodeOrderAlert(root.path("Data"), length);
                case TYPE_DEPTH_UPDATE -> decodeDepthBook(DepthBookEvent.Type.UPDATE, root.path("Data"), length);
                case TYPE_DEPTH_SNAPSHOT -> decodeDepthBook(DepthBookEvent.Type.SNAPSHOT, root.path("Data"), length);
                default -> DecodeResult.success(
                    new UnrecognizedEvent(-1, text.getBytes(StandardCharsets.UTF_8)), length);
            };
        } catch (RuntimeException e) {
            return DecodeResult.failure("malformed " + type + " envelope: " + e.getMessage(), length);
        }
    }

    private static DecodeResult decodeOrderAlert(JsonNode data, int length) {
        if (!data.isObject()) {
            return DecodeResult.failure("order_alert without Data object", length);
        }
        String orderNo = text(data, "OrderNo");
        if (orderNo == null) {
            return DecodeResult.failure("order_alert without OrderNo", length);
        }
        OrderUpdate order = new OrderUpdate(
            orderNo,
            text(data, "ExchOrderNo"),
            text(data, "Status"),
            text(data, "Exchange"),
            text(data, "Segment"),
            text(data, "SecurityId"),
            text(data, "Symbol"),
            text(data, "DisplayName"),
            text(data, "TxnType"),
            text(data, "OrderType"),
            text(data, "Product"),
            text(data, "Instrument"),
            text(data, "OptType"),
            data.path("Quantity").asInt(0),
            data.path("TradedQty").asInt(0),
            data.path("RemainingQuantity").asInt(0),
            decimal(data, "Price"),
            decimal(data, "TriggerPrice"),
            decimal(data, "AvgTradedPrice"),
            data.path("LegNo").asInt(0),
            text(data, "OffMktFlag"),
            text(data, "Remarks"),
            text(data, "ReasonDescription"),
            text(data, "CorrelationId"),
            text(data, "LastUpdatedTime"));
        return DecodeResult.success(new OrderAlertEvent(order), length);
    }

    private static DecodeResult decodeDepthBook(DepthBookEvent.Type type, JsonNode data, int length) {
        if (!data.isObject()) {
            return DecodeResult.failure("depth envelope without Data object", length);
        }
        List<BookLevel> bids = levels(data.path("Bids"));
        List<BookLevel> asks = levels(data.path("Asks"));

        double bestBid = data.hasNonNull("BestBid")
            ? data.get("BestBid").asDouble() : (bids.isEmpty() ? 0.0 : bids.get(0).price());
        double bestAsk = data.hasNonNull("BestAsk")
            ? data.get("BestAsk").asDouble() : (asks.isEmpty() ? 0.0 : asks.get(0).price());
        long totalBid = data.hasNonNull("TotalBidQty")
            ? data.get("TotalBidQty").asLong() : bids.stream().mapToLong(BookLevel::quantity).sum();
        long totalAsk = data.hasNonNull("TotalAskQty")
            ? data.get("TotalAskQty").asLong() : asks.stream().mapToLong(BookLevel::quantity).sum();

        DepthBookEvent event = new DepthBookEvent(
            type,
            text(data, "Symbol"),
            text(data, "ExchangeSegment"),
            text(data, "SecurityId"),
            text(data, "Timestamp"),
            bids,
            asks,
            bestBid,
            bestAsk,
            totalBid,
            totalAsk);
        return DecodeResult.success(event, length);
    }

    private static List<BookLevel> levels(JsonNode array) {
        List<BookLevel> out = new ArrayList<>();
        if (!array.isArray()) {
            return out;
        }
        for (JsonNode level : array) {
            out.add(new BookLevel(
                level.path("Price").asDouble(0.0),
                level.path("Quantity").asLong(0),
                level.path("Orders").asInt(1)));
        }
        return out;
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        return value.asText();
    }

    private static BigDecimal decimal(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (value.isNumber()) {
            return value.decimalValue();
        }
        String raw = value.asText().trim();
        if (raw.isEmpty()) {
            return null;
        }
        return new BigDecimal(raw);
    }
}
