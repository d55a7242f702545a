package com.p14n.pubsub.broker;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

import com.p14n.pubsub.data.Message;
import com.p14n.pubsub.telemetry.BrokerMetrics;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Delivers one published message to every subscriber of its topic.
 *
 * <p>
 * The registry's coarse lock is held for the whole pass: snapshot, every
 * write and the eviction of broken subscribers. Publishes are therefore
 * serialized, and a slow write holds up every other publish until it returns.
 * Each write happens under the entry's delivery lock. A failed write marks the
 * subscriber broken and the pass moves on to the next one.
 * </p>
 */
public class FanOutEngine {
    private static final Logger logger = LoggerFactory.getLogger(FanOutEngine.class);

    private final SubscriptionRegistry registry;
    private final BrokerMetrics metrics;

    public FanOutEngine(SubscriptionRegistry registry, BrokerMetrics metrics) {
        this.registry = registry;
        this.metrics = metrics;
    }

    /**
     * Publishes a payload to every subscriber currently registered on the topic.
     *
     * @param topic   The topic to publish to
     * @param payload The opaque message payload
     * @return The outcome of the pass
     */
    public FanOutResult publish(String topic, byte[] payload) {
        Message message = Message.create(topic, payload);
        ReentrantLock coarse = registry.coarseLock();
        coarse.lock();
        try {
            List<Subscription> subscriptions = registry.snapshot(topic);
            if (subscriptions.isEmpty()) {
                logger.atDebug().log("No subscribers for topic: {}", topic);
                return FanOutResult.empty(topic);
            }

            int delivered = 0;
            List<SubscriptionKey> broken = new ArrayList<>();
            for (Subscription subscription : subscriptions) {
                if (deliver(subscription, message)) {
                    delivered++;
                } else {
                    broken.add(subscription.key());
                }
            }

            if (!broken.isEmpty()) {
                registry.evictBroken(broken);
            }
            return new FanOutResult(topic, delivered, List.copyOf(broken));
        } finally {
            coarse.unlock();
        }
    }

    private boolean deliver(Subscription subscription, Message message) {
        SubscriptionKey key = subscription.key();
        ReentrantLock deliveryLock = subscription.deliveryLock();
        deliveryLock.lock();
        try {
            SubscriberStream stream = subscription.session().stream();
            if (!stream.isActive()) {
                logger.atWarn()
                        .addArgument(key.subscriberId())
                        .addArgument(key.topic())
                        .log("Subscriber {} on topic {} is no longer connected");
                metrics.recordDeliveryFailure(key.topic());
                return false;
            }
            stream.send(message);
            metrics.recordDelivered(key.topic());
            return true;
        } catch (Exception e) {
            logger.atWarn()
                    .addArgument(key.subscriberId())
                    .addArgument(key.topic())
                    .setCause(e)
                    .log("Error sending message to subscriber {} on topic {}");
            metrics.recordDeliveryFailure(key.topic());
            return false;
        } finally {
            deliveryLock.unlock();
        }
    }
}
