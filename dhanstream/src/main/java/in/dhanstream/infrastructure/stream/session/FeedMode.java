package in.dhanstream.infrastructure.stream.session;

/**
 * Market feed subscription modes and their request codes.
 */
public enum FeedMode {
    TICKER(15, 16),
    QUOTE(17, 18),
    FULL(21, 22);

    private final int subscribeCode;
    private final int unsubscribeCode;

    FeedMode(int subscribeCode, int unsubscribeCode) {
        this.subscribeCode = subscribeCode;
        this.unsubscribeCode = unsubscribeCode;
    }

    public int subscribeCode() {
        return subscribeCode;
    }

    public int unsubscribeCode() {
        return unsubscribeCode;
    }
}
