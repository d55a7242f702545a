package com.p14n.pubsub.broker;

import java.util.List;

/**
 * Outcome of one fan-out pass.
 *
 * @param topic     The topic published to
 * @param delivered Number of subscribers the message was written to
 * @param broken    Subscribers whose write failed; they have been evicted
 */
public record FanOutResult(String topic, int delivered, List<SubscriptionKey> broken) {

    public static FanOutResult empty(String topic) {
        return new FanOutResult(topic, 0, List.of());
    }

    /**
     * @return true if no delivery failed, including when there were no subscribers
     */
    public boolean succeeded() {
        return broken.isEmpty();
    }
}
