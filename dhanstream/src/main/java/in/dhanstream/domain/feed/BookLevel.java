package in.dhanstream.domain.feed;

/**
 * One price level of a JSON depth book.
 */
public record BookLevel(double price, long quantity, int orders) {
}
