package com.p14n.pubsub.broker;

import java.util.concurrent.atomic.AtomicBoolean;

import com.p14n.pubsub.broker.SubscriberSession.EndReason;
import com.p14n.pubsub.telemetry.BrokerMetrics;

import static com.p14n.pubsub.telemetry.OpenTelemetryFunctions.processWithTelemetry;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Tracer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Default {@link MessageBroker}. Each instance owns its own
 * {@link SubscriptionRegistry} and {@link FanOutEngine}; nothing is shared
 * between broker instances.
 */
public class PubSubBroker implements MessageBroker {
    private static final Logger logger = LoggerFactory.getLogger(PubSubBroker.class);

    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final SubscriptionRegistry registry;
    private final FanOutEngine fanOut;
    protected final BrokerMetrics metrics;
    protected final Tracer tracer;

    public PubSubBroker(OpenTelemetry ot, String scopeName) {
        this.metrics = new BrokerMetrics(ot.getMeter(scopeName));
        this.tracer = ot.getTracer(scopeName);
        this.registry = new SubscriptionRegistry(metrics);
        this.fanOut = new FanOutEngine(registry, metrics);
    }

    private void checkTopic(String topic) {
        if (topic == null) {
            throw new IllegalArgumentException("Topic cannot be null");
        }
    }

    private void checkSubscriberId(String subscriberId) {
        if (subscriberId == null) {
            throw new IllegalArgumentException("Subscriber id cannot be null");
        }
    }

    @Override
    public SubscriberSession subscribe(String topic, String subscriberId, SubscriberStream stream) {
        if (closed.get()) {
            throw new IllegalStateException("Broker is closed");
        }
        checkTopic(topic);
        checkSubscriberId(subscriberId);
        if (stream == null) {
            throw new IllegalArgumentException("Stream cannot be null");
        }

        SubscriberSession session = new SubscriberSession(new SubscriptionKey(topic, subscriberId), stream);
        registry.register(session);
        logger.atInfo()
                .addArgument(subscriberId)
                .addArgument(topic)
                .log("Subscriber {} subscribed to topic {}");
        return session;
    }

    @Override
    public boolean unsubscribe(String topic, String subscriberId) {
        checkTopic(topic);
        checkSubscriberId(subscriberId);
        if (closed.get()) {
            return false;
        }

        boolean removed = registry.deregister(topic, subscriberId);
        if (removed) {
            logger.atInfo()
                    .addArgument(subscriberId)
                    .addArgument(topic)
                    .log("Subscriber {} unsubscribed from topic {}");
        } else {
            logger.atDebug()
                    .addArgument(subscriberId)
                    .addArgument(topic)
                    .log("Subscriber {} was not subscribed to topic {}");
        }
        return removed;
    }

    @Override
    public boolean publish(String topic, byte[] payload) {
        if (closed.get()) {
            throw new IllegalStateException("Broker is closed");
        }
        checkTopic(topic);
        if (payload == null) {
            throw new IllegalArgumentException("Payload cannot be null");
        }

        metrics.recordPublished(topic);
        FanOutResult result = processWithTelemetry(tracer, "publish_message", topic,
                () -> fanOut.publish(topic, payload));

        if (!result.succeeded()) {
            logger.atWarn()
                    .addArgument(topic)
                    .addArgument(result.delivered())
                    .addArgument(result.broken().size())
                    .log("Published to topic {} with {} deliveries and {} failures");
        } else {
            logger.atDebug()
                    .addArgument(topic)
                    .addArgument(result.delivered())
                    .log("Published to topic {} with {} deliveries");
        }
        return result.succeeded();
    }

    @Override
    public int subscriberCount(String topic) {
        return registry.size(topic);
    }

    /**
     * Ends every session with {@link EndReason#BROKER_CLOSED} and rejects any
     * further subscribe or publish. Safe to call more than once.
     */
    @Override
    public void close() {
        if (closed.getAndSet(true)) {
            return;
        }
        int ended = registry.close();
        logger.atInfo().log("Broker closed, ended {} sessions", ended);
    }
}
