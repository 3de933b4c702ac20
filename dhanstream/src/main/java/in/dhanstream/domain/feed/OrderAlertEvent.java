package in.dhanstream.domain.feed;

import in.dhanstream.domain.order.OrderUpdate;

/**
 * {@code order_alert} envelope from the order update channel.
 */
public record OrderAlertEvent(OrderUpdate order) implements DecodedEvent {

    @Override
    public EventKind kind() {
        return EventKind.ORDER_ALERT;
    }
}
