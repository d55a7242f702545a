package com.p14n.pubsub.data;

/**
 * Record representing a message delivered to the subscribers of a topic.
 * The payload is opaque to the broker.
 */
public record Message(String topic, byte[] payload) {

    /**
     * Creates a new Message instance with validation of required fields.
     *
     * @throws IllegalArgumentException if the topic or payload is null
     */
    public static Message create(String topic, byte[] payload) {
        if (topic == null) {
            throw new IllegalArgumentException("topic cannot be null");
        }
        if (payload == null) {
            throw new IllegalArgumentException("payload cannot be null");
        }
        return new Message(topic, payload);
    }
}
