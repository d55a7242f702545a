package com.p14n.pubsub.broker;

import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.p14n.pubsub.broker.SubscriberSession.EndReason;
import com.p14n.pubsub.telemetry.BrokerMetrics;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maps topic to subscriber id to {@link Subscription}.
 *
 * <p>
 * Every structural change and every read happens under one coarse lock. A
 * fan-out pass holds the same lock for its whole duration (see
 * {@link FanOutEngine}), so the lock is reentrant and the per-entry delivery
 * locks are only ever taken inside it. Lock order is always coarse, then
 * entry.
 * </p>
 *
 * <p>
 * Whenever an entry leaves the registry its session is ended with the matching
 * {@link EndReason}, after draining the entry's delivery lock. A delivery lock
 * is therefore never dropped while held.
 * </p>
 */
public class SubscriptionRegistry {
    private static final Logger logger = LoggerFactory.getLogger(SubscriptionRegistry.class);

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, Map<String, Subscription>> topics = new HashMap<>();
    private final BrokerMetrics metrics;
    private boolean closed;

    public SubscriptionRegistry(BrokerMetrics metrics) {
        this.metrics = metrics;
    }

    ReentrantLock coarseLock() {
        return lock;
    }

    /**
     * Registers a session under its topic and subscriber id. An existing entry
     * for the same key is drained and its session ended as
     * {@link EndReason#REPLACED} before the new entry takes its place.
     *
     * @param session The session to register
     * @return The new registry entry
     * @throws IllegalStateException if the registry has been closed
     */
    public Subscription register(SubscriberSession session) {
        SubscriptionKey key = session.key();
        lock.lock();
        try {
            if (closed) {
                throw new IllegalStateException("Registry is closed");
            }
            Map<String, Subscription> subscribers = topics.computeIfAbsent(key.topic(), k -> new LinkedHashMap<>());
            Subscription previous = subscribers.get(key.subscriberId());
            if (previous != null) {
                previous.drain(EndReason.REPLACED);
                logger.atInfo()
                        .addArgument(key.topic())
                        .addArgument(key.subscriberId())
                        .log("Replaced existing subscription for topic {} subscriber {}");
            }
            Subscription subscription = new Subscription(session);
            subscribers.put(key.subscriberId(), subscription);
            if (previous == null) {
                metrics.recordSubscriberAdded(key.topic());
            }
            return subscription;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes the entry for the given topic and subscriber id, ending its
     * session as {@link EndReason#UNSUBSCRIBED}.
     *
     * @return true if an entry was removed, false if none was registered
     */
    public boolean deregister(String topic, String subscriberId) {
        lock.lock();
        try {
            Subscription removed = remove(topic, subscriberId);
            if (removed == null) {
                return false;
            }
            removed.drain(EndReason.UNSUBSCRIBED);
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns a point-in-time copy of the entries registered on a topic, in the
     * registry's iteration order.
     *
     * @return The entries, empty if the topic is unknown
     */
    public List<Subscription> snapshot(String topic) {
        lock.lock();
        try {
            Map<String, Subscription> subscribers = topics.get(topic);
            if (subscribers == null) {
                return ImmutableList.of();
            }
            return ImmutableList.copyOf(subscribers.values());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes each listed entry that is still present and ends its session as
     * {@link EndReason#EVICTED}. Keys that are already gone are skipped.
     *
     * @return The number of entries removed
     */
    public int evictBroken(Collection<SubscriptionKey> keys) {
        lock.lock();
        try {
            int evicted = 0;
            for (SubscriptionKey key : keys) {
                Subscription removed = remove(key.topic(), key.subscriberId());
                if (removed != null) {
                    removed.drain(EndReason.EVICTED);
                    evicted++;
                    logger.atInfo()
                            .addArgument(key.topic())
                            .addArgument(key.subscriberId())
                            .log("Evicted broken subscriber for topic {} subscriber {}");
                }
            }
            return evicted;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes every entry, ending each session as
     * {@link EndReason#BROKER_CLOSED}, and rejects further registrations.
     *
     * @return The number of entries removed
     */
    public int close() {
        lock.lock();
        try {
            closed = true;
            int removed = 0;
            for (Map.Entry<String, Map<String, Subscription>> topic : topics.entrySet()) {
                for (Subscription subscription : topic.getValue().values()) {
                    subscription.drain(EndReason.BROKER_CLOSED);
                    metrics.recordSubscriberRemoved(topic.getKey());
                    removed++;
                }
            }
            topics.clear();
            return removed;
        } finally {
            lock.unlock();
        }
    }

    public boolean contains(String topic, String subscriberId) {
        lock.lock();
        try {
            Map<String, Subscription> subscribers = topics.get(topic);
            return subscribers != null && subscribers.containsKey(subscriberId);
        } finally {
            lock.unlock();
        }
    }

    public int size(String topic) {
        lock.lock();
        try {
            Map<String, Subscription> subscribers = topics.get(topic);
            return subscribers == null ? 0 : subscribers.size();
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return topics.values().stream().mapToInt(Map::size).sum();
        } finally {
            lock.unlock();
        }
    }

    public Set<SubscriptionKey> keys() {
        lock.lock();
        try {
            ImmutableSet.Builder<SubscriptionKey> keys = ImmutableSet.builder();
            for (Map<String, Subscription> subscribers : topics.values()) {
                for (Subscription subscription : subscribers.values()) {
                    keys.add(subscription.key());
                }
            }
            return keys.build();
        } finally {
            lock.unlock();
        }
    }

    // caller holds the lock
    private Subscription remove(String topic, String subscriberId) {
        Map<String, Subscription> subscribers = topics.get(topic);
        if (subscribers == null) {
            return null;
        }
        Subscription removed = subscribers.remove(subscriberId);
        if (subscribers.isEmpty()) {
            topics.remove(topic);
        }
        if (removed != null) {
            metrics.recordSubscriberRemoved(topic);
        }
        return removed;
    }
}
