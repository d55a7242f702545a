package com.p14n.pubsub.broker;

import java.util.concurrent.locks.ReentrantLock;

/**
 * A registry entry: one session plus the lock that serializes writes to its
 * stream. The lock is created and dropped with the entry.
 */
public final class Subscription {
    private final SubscriberSession session;
    private final ReentrantLock deliveryLock = new ReentrantLock();

    Subscription(SubscriberSession session) {
        this.session = session;
    }

    public SubscriptionKey key() {
        return session.key();
    }

    public SubscriberSession session() {
        return session;
    }

    ReentrantLock deliveryLock() {
        return deliveryLock;
    }

    /**
     * Takes the delivery lock, waiting for any in-flight write to finish, and
     * ends the session while holding it.
     */
    void drain(SubscriberSession.EndReason reason) {
        deliveryLock.lock();
        try {
            session.end(reason);
        } finally {
            deliveryLock.unlock();
        }
    }
}
