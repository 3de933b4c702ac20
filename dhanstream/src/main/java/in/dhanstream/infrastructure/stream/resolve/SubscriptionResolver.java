package in.dhanstream.infrastructure.stream.resolve;

import in.dhanstream.domain.feed.ExchangeSegment;
import in.dhanstream.domain.instrument.InstrumentRecord;
import in.dhanstream.domain.instrument.InstrumentRef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Maps caller symbol references to the (segment, security id) pairs used in subscribe commands.
 *
 * Segment indexes are loaded lazily from an {@link InstrumentDirectory}. Concurrent first lookups of
 * the same segment wait on a single load; a failed load is logged, treated as an empty segment for
 * that lookup, and retried on the next one.
 */
public class SubscriptionResolver {
    private static final Logger log = LoggerFactory.getLogger(SubscriptionResolver.class);

    /** Probe order when a reference carries no segment hint. */
    public static final List<ExchangeSegment> SEGMENT_PRIORITY = List.of(
        ExchangeSegment.NSE_EQ,
        ExchangeSegment.BSE_EQ,
        ExchangeSegment.NSE_FNO,
        ExchangeSegment.BSE_FNO,
        ExchangeSegment.IDX_I,
        ExchangeSegment.NSE_CURRENCY,
        ExchangeSegment.BSE_CURRENCY,
        ExchangeSegment.MCX_COMM);

    private final InstrumentDirectory directory;
    private final Map<String, CompletableFuture<Map<String, InstrumentRecord>>> indexes = new ConcurrentHashMap<>();
    private final Map<String, InstrumentRef> resolved = new ConcurrentHashMap<>();

    public SubscriptionResolver(InstrumentDirectory directory) {
        this.directory = Objects.requireNonNull(directory, "directory");
    }

    /**
     * Idempotency key for a reference: uppercase, whitespace-trimmed.
     */
    public String labelFor(SymbolRef ref) {
        return ref.toString().trim().toUpperCase(Locale.ROOT);
    }

    /**
     * Resolve a reference.
     *
     * @throws ResolutionException when no candidate segment knows the reference
     */
    public InstrumentRef resolve(SymbolRef ref) {
        String label = labelFor(ref);
        InstrumentRef cached = resolved.get(label);
        if (cached != null) {
            return cached;
        }

        InstrumentRef instrument = ref.isResolved()
            ? new InstrumentRef(ref.segment(), ref.securityId(), label, ref.toString())
            : lookup(ref, label);
        InstrumentRef winner = resolved.putIfAbsent(label, instrument);
        return winner != null ? winner : instrument;
    }

    public InstrumentRef resolve(String ref) {
        return resolve(SymbolRef.of(ref));
    }

    private InstrumentRef lookup(SymbolRef ref, String label) {
        Optional<ExchangeSegment> hint;
        String code;

        if (ref.isText()) {
            String text = ref.text().toUpperCase(Locale.ROOT);
            int colon = text.indexOf(':');
            hint = colon > 0 ? ExchangeSegment.parse(text.substring(0, colon)) : Optional.empty();
            code = hint.isPresent() ? text.substring(colon + 1).trim() : text;
        } else {
            hint = ExchangeSegment.parse(ref.segment());
            if (ref.segment() != null && hint.isEmpty()) {
                throw new ResolutionException(label, "unknown exchange segment " + ref.segment());
            }
            code = (ref.securityId() != null ? ref.securityId() : ref.symbol()).toUpperCase(Locale.ROOT);
        }

        if (code.isEmpty()) {
            throw new ResolutionException(label, "empty instrument code");
        }

        List<ExchangeSegment> candidates = hint.map(List::of).orElse(SEGMENT_PRIORITY);
        for (ExchangeSegment segment : candidates) {
            InstrumentRecord match = find(indexFor(segment.name()), code);
            if (match != null) {
                String matchSegment = match.exchangeSegment() != null && !match.exchangeSegment().isBlank()
                    ? match.exchangeSegment().toUpperCase(Locale.ROOT)
                    : segment.name();
                String display = match.displayName() != null ? match.displayName() : match.symbolName();
                log.debug("[RESOLVER] {} -> {}:{} ({})", label, matchSegment, match.securityId(), display);
                return new InstrumentRef(matchSegment, match.securityId(), display, ref.toString());
            }
        }
        throw new ResolutionException(label, "no instrument found in " + candidates);
    }

    private static InstrumentRecord find(Map<String, InstrumentRecord> index, String code) {
        InstrumentRecord match = index.get(code);
        if (match == null) {
            String collapsed = collapse(code);
            if (!collapsed.equals(code)) {
                match = index.get(collapsed);
            }
        }
        return match;
    }

    /**
     * Index for one segment, loading it on first use.
     */
    Map<String, InstrumentRecord> indexFor(String segment) {
        CompletableFuture<Map<String, InstrumentRecord>> mine = new CompletableFuture<>();
        CompletableFuture<Map<String, InstrumentRecord>> existing = indexes.putIfAbsent(segment, mine);

        if (existing == null) {
            existing = mine;
            try {
                mine.complete(buildIndex(segment, directory.bySegment(segment)));
            } catch (RuntimeException e) {
                indexes.remove(segment, mine);
                mine.completeExceptionally(e);
            }
        }

        try {
            return existing.join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.error("[RESOLVER] Failed to load instruments for {}: {}", segment, cause.getMessage());
            return Collections.emptyMap();
        }
    }

    private static Map<String, InstrumentRecord> buildIndex(String segment, List<InstrumentRecord> records) {
        Map<String, InstrumentRecord> index = new HashMap<>();
        if (records == null) {
            return index;
        }
        for (InstrumentRecord record : records) {
            for (String key : keysFor(record)) {
                index.putIfAbsent(key, record);
            }
        }
        log.info("[RESOLVER] Indexed {} instruments for {} ({} keys)", records.size(), segment, index.size());
        return Collections.unmodifiableMap(index);
    }

    private static List<String> keysFor(InstrumentRecord record) {
        List<String> keys = new ArrayList<>(5);
        String symbol = normalize(record.symbolName());
        String display = normalize(record.displayName());
        String securityId = normalize(record.securityId());
        String series = normalize(record.series());

        if (symbol != null) {
            keys.add(symbol);
            String collapsed = collapse(symbol);
            if (!collapsed.equals(symbol)) {
                keys.add(collapsed);
            }
        }
        if (display != null && !display.equals(symbol)) {
            keys.add(display);
        }
        if (securityId != null) {
            keys.add(securityId);
        }
        if (symbol != null && series != null) {
            keys.add(symbol + ":" + series);
        }
        return keys;
    }

    private static String normalize(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return value.trim().toUpperCase(Locale.ROOT);
    }

    private static String collapse(String value) {
        return value.replaceAll("\\s+", "");
    }

    /**
     * Segments whose index loaded successfully or is still loading.
     */
    public int loadedSegmentCount() {
        return indexes.size();
    }
}
