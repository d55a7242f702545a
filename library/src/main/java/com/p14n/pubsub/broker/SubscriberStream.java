package com.p14n.pubsub.broker;

import com.p14n.pubsub.data.Message;

/**
 * Outbound side of a subscriber's connection, as seen by the broker.
 * Implementations adapt a transport stream; writes are serialized by the
 * caller.
 */
public interface SubscriberStream {

    /**
     * Writes one message to the subscriber.
     *
     * @param message The message to write
     * @throws RuntimeException if the stream is closed or the write fails
     */
    void send(Message message);

    /**
     * Returns whether the underlying connection is still open.
     *
     * @return true while messages can still be written
     */
    boolean isActive();

    /**
     * Registers a callback run once when the underlying connection ends.
     * Runs immediately if the connection has already ended.
     *
     * @param callback The callback to run
     */
    void onDisconnect(Runnable callback);

    /**
     * Ends the stream normally if it is still open. Never throws.
     */
    void complete();
}
