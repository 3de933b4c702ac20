package in.dhanstream.infrastructure.stream.resolve;

import java.util.Locale;
import java.util.Objects;

/**
 * A caller's reference to an instrument, before resolution.
 *
 * Either free text ({@code "RELIANCE"}, {@code "NSE_EQ:RELIANCE"}, {@code "1333"}) or a structured
 * descriptor carrying a segment with a security id or a symbol.
 */
public record SymbolRef(String text, String segment, String securityId, String symbol) {

    public static SymbolRef of(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Symbol reference must not be blank");
        }
        return new SymbolRef(text.trim(), null, null, null);
    }

    /**
     * Descriptor that needs no lookup.
     */
    public static SymbolRef descriptor(String segment, String securityId) {
        Objects.requireNonNull(securityId, "securityId");
        return new SymbolRef(null, upper(segment), securityId.trim(), null);
    }

    public static SymbolRef symbol(String segment, String symbol) {
        Objects.requireNonNull(symbol, "symbol");
        return new SymbolRef(null, upper(segment), null, symbol.trim());
    }

    public boolean isText() {
        return text != null;
    }

    /**
     * True when the reference already carries everything a wire command needs.
     */
    public boolean isResolved() {
        return segment != null && securityId != null;
    }

    @Override
    public String toString() {
        if (text != null) {
            return text;
        }
        String code = securityId != null ? securityId : symbol;
        return segment != null ? segment + ":" + code : code;
    }

    private static String upper(String value) {
        return value == null || value.isBlank() ? null : value.trim().toUpperCase(Locale.ROOT);
    }
}
