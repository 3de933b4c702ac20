package in.dhanstream.infrastructure.stream.order;

import in.dhanstream.domain.order.OrderEvent;

/**
 * Callback for order lifecycle events, invoked on the thread that recorded the update.
 */
@FunctionalInterface
public interface OrderEventListener {
    void onOrderEvent(OrderEvent event);
}
