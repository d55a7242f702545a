package com.p14n.pubsub.broker;

/**
 * Thread-safe topic broker: registers subscriber streams and fans published
 * payloads out to them.
 */
public interface MessageBroker extends AutoCloseable {

    /**
     * Registers a subscriber stream on a topic. A later subscribe with the same
     * topic and subscriber id replaces this one.
     *
     * @param topic        The topic to subscribe to
     * @param subscriberId The id chosen by the subscribing client
     * @param stream       The stream messages are written to
     * @return The session, which ends when the subscription is over
     */
    SubscriberSession subscribe(String topic, String subscriberId, SubscriberStream stream);

    /**
     * Removes a subscriber from a topic.
     *
     * @param topic        The topic to unsubscribe from
     * @param subscriberId The subscriber id
     * @return true if the subscriber was removed, false if it wasn't registered
     */
    boolean unsubscribe(String topic, String subscriberId);

    /**
     * Publishes a payload to all subscribers of the specified topic.
     * Publishing to a topic without subscribers succeeds.
     *
     * @param topic   The topic to publish to
     * @param payload The opaque payload
     * @return false if delivery to any subscriber failed. The other
     *         subscribers still received the message.
     */
    boolean publish(String topic, byte[] payload);

    /**
     * @param topic The topic
     * @return the number of subscribers currently registered on the topic
     */
    int subscriberCount(String topic);

    /**
     * Closes the broker, ending every session.
     * After closing, no more messages can be published or subscribers added.
     */
    @Override
    void close();
}
