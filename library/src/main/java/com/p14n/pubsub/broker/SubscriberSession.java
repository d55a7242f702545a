package com.p14n.pubsub.broker;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Broker-side handle for one subscriber's open stream.
 *
 * <p>
 * A session is registered when a subscribe call arrives and the call then
 * parks in {@link #awaitEnd()} until the session ends. A session ends exactly
 * once; the first {@link EndReason} wins.
 * </p>
 */
public class SubscriberSession {
    private static final Logger logger = LoggerFactory.getLogger(SubscriberSession.class);

    /**
     * Why a session stopped.
     */
    public enum EndReason {
        /** The subscriber's connection ended. The registry entry is removed lazily. */
        DISCONNECTED,
        /** An explicit unsubscribe removed the entry. */
        UNSUBSCRIBED,
        /** A later subscribe with the same topic and id took over the entry. */
        REPLACED,
        /** A failed delivery removed the entry. */
        EVICTED,
        /** The broker was closed. */
        BROKER_CLOSED
    }

    private final SubscriptionKey key;
    private final SubscriberStream stream;
    private final CountDownLatch ended = new CountDownLatch(1);
    private final AtomicReference<EndReason> endReason = new AtomicReference<>();

    public SubscriberSession(SubscriptionKey key, SubscriberStream stream) {
        this.key = key;
        this.stream = stream;
    }

    public SubscriptionKey key() {
        return key;
    }

    public SubscriberStream stream() {
        return stream;
    }

    /**
     * Ends the session, releasing any thread parked in {@link #awaitEnd()}.
     *
     * @param reason Why the session ended
     * @return true if this call ended the session, false if it had already ended
     */
    public boolean end(EndReason reason) {
        if (endReason.compareAndSet(null, reason)) {
            logger.atDebug()
                    .addArgument(key.topic())
                    .addArgument(key.subscriberId())
                    .addArgument(reason)
                    .log("Session for topic {} subscriber {} ended: {}");
            ended.countDown();
            return true;
        }
        return false;
    }

    public boolean isEnded() {
        return endReason.get() != null;
    }

    /**
     * @return the reason the session ended, or null while it is still open
     */
    public EndReason endReason() {
        return endReason.get();
    }

    /**
     * Blocks until the session ends.
     *
     * @return The reason the session ended
     * @throws InterruptedException If the wait is interrupted
     */
    public EndReason awaitEnd() throws InterruptedException {
        ended.await();
        return endReason.get();
    }

    /**
     * Blocks until the session ends or the timeout elapses.
     *
     * @return true if the session ended within the timeout
     * @throws InterruptedException If the wait is interrupted
     */
    public boolean awaitEnd(long timeout, TimeUnit unit) throws InterruptedException {
        return ended.await(timeout, unit);
    }
}
