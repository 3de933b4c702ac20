package in.dhanstream.infrastructure.stream.session;

/**
 * How a connection ended, which decides what the reconnect loop does next.
 */
public enum CloseKind {
    /** Normal close code, not caused by a rate-limit rejection. Resets backoff. */
    CLEAN,
    /** Server rejected us for sending too many requests. Fixed cooloff, backoff untouched. */
    RATE_LIMITED,
    /** Credentials refused during handshake or login. Counts as abnormal. */
    AUTH_REJECTED,
    /** Everything else: network errors, crashes, unexpected close codes. */
    ABNORMAL;

    public static final int NORMAL_CLOSURE = 1000;
    public static final String RATE_LIMIT_MARKER = "429";

    public static CloseKind classify(int statusCode, String reason) {
        if (reason != null && reason.contains(RATE_LIMIT_MARKER)) {
            return RATE_LIMITED;
        }
        return statusCode == NORMAL_CLOSURE ? CLEAN : ABNORMAL;
    }

    /**
     * Classify a failed websocket handshake by its HTTP status.
     */
    public static CloseKind fromHandshakeStatus(int httpStatus) {
        return switch (httpStatus) {
            case 429 -> RATE_LIMITED;
            case 401, 403 -> AUTH_REJECTED;
            default -> ABNORMAL;
        };
    }
}
