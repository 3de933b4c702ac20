package in.dhanstream.domain.feed;

import java.util.Locale;
import java.util.Optional;

/**
 * Exchange segments with the numeric code used in binary feed headers.
 */
public enum ExchangeSegment {
    IDX_I(0),
    NSE_EQ(1),
    NSE_FNO(2),
    NSE_CURRENCY(3),
    BSE_EQ(4),
    MCX_COMM(5),
    BSE_CURRENCY(7),
    BSE_FNO(8);

    private final int code;

    ExchangeSegment(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    public static Optional<ExchangeSegment> fromCode(int code) {
        for (ExchangeSegment segment : values()) {
            if (segment.code == code) {
                return Optional.of(segment);
            }
        }
        return Optional.empty();
    }

    /**
     * Lenient lookup: accepts the enum name in any case or the numeric code as a string.
     */
    public static Optional<ExchangeSegment> parse(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        for (ExchangeSegment segment : values()) {
            if (segment.name().equals(normalized)) {
                return Optional.of(segment);
            }
        }
        try {
            return fromCode(Integer.parseInt(normalized));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    /**
     * Map the exchange / segment letter pair carried by order alerts (e.g. NSE + E) to a feed segment.
     * Unknown pairs fall back to NSE_EQ.
     */
    public static ExchangeSegment fromExchangeAndSegment(String exchange, String segment) {
        String ex = exchange == null ? "" : exchange.trim().toUpperCase(Locale.ROOT);
        String seg = segment == null ? "" : segment.trim().toUpperCase(Locale.ROOT);
        return switch (ex + "/" + seg) {
            case "BSE/E" -> BSE_EQ;
            case "NSE/D" -> NSE_FNO;
            case "BSE/D" -> BSE_FNO;
            case "NSE/C" -> NSE_CURRENCY;
            case "BSE/C" -> BSE_CURRENCY;
            case "MCX/M" -> MCX_COMM;
            case "NSE/I", "BSE/I" -> IDX_I;
            default -> NSE_EQ;
        };
    }
}
