package in.dhanstream.domain.order;

/**
 * Order lifecycle changes derived by comparing an order update with the previously tracked state.
 */
public enum OrderEventType {
    /** Status differs from the previously tracked status. */
    STATUS_CHANGE,
    /** Traded quantity grew. */
    EXECUTION,
    /** Order entered TRADED. */
    ORDER_TRADED,
    ORDER_REJECTED,
    ORDER_CANCELLED
}
