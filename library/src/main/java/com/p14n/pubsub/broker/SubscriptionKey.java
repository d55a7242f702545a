package com.p14n.pubsub.broker;

/**
 * Identifies one subscription: a subscriber id registered on a topic.
 */
public record SubscriptionKey(String topic, String subscriberId) {
}
