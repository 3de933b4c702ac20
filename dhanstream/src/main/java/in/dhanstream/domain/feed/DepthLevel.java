package in.dhanstream.domain.feed;

/**
 * One 20-byte market depth level: both sides of the book at the same rank.
 */
public record DepthLevel(
        long bidQty,
        long askQty,
        int bidOrders,
        int askOrders,
        double bidPrice,
        double askPrice
) {
    public static final int SIZE = 20;
}
