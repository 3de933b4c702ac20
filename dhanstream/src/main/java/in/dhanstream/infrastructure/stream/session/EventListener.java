package in.dhanstream.infrastructure.stream.session;

import in.dhanstream.domain.feed.DecodedEvent;

/**
 * Callback for decoded events. Runs on the channel's delivery thread; hand long work off elsewhere.
 */
@FunctionalInterface
public interface EventListener {

    void onEvent(DecodedEvent event);
}
