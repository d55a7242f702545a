package com.p14n.pubsub.broker;

import com.p14n.pubsub.TestUtil;
import com.p14n.pubsub.TestUtil.RecordingStream;
import com.p14n.pubsub.broker.SubscriberSession.EndReason;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

@Timeout(value = 10, unit = TimeUnit.SECONDS)
class SubscriptionRegistryTest {

    private SubscriptionRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new SubscriptionRegistry(TestUtil.noopMetrics());
    }

    private SubscriberSession session(String topic, String id) {
        return new SubscriberSession(new SubscriptionKey(topic, id), new RecordingStream());
    }

    @Test
    void shouldRegisterAndSnapshotSubscribers() {
        registry.register(session("news", "1"));
        registry.register(session("news", "2"));
        registry.register(session("sport", "1"));

        assertEquals(2, registry.snapshot("news").size());
        assertEquals(1, registry.snapshot("sport").size());
        assertEquals(3, registry.size());
        assertTrue(registry.contains("news", "2"));
        assertEquals(Set.of(new SubscriptionKey("news", "1"), new SubscriptionKey("news", "2"),
                new SubscriptionKey("sport", "1")), registry.keys());
    }

    @Test
    void shouldReturnEmptySnapshotForUnknownTopic() {
        assertTrue(registry.snapshot("unknown").isEmpty());
        assertEquals(0, registry.size("unknown"));
    }

    @Test
    void shouldNotIncludeLaterRegistrationsInEarlierSnapshot() {
        registry.register(session("t", "1"));
        List<Subscription> snapshot = registry.snapshot("t");

        registry.register(session("t", "2"));

        assertEquals(1, snapshot.size());
        assertEquals(2, registry.size("t"));
    }

    @Test
    void shouldDeregisterOnceThenReportNotFound() {
        SubscriberSession s = session("t", "1");
        registry.register(s);

        assertTrue(registry.deregister("t", "1"));
        assertFalse(registry.deregister("t", "1"));
        assertEquals(EndReason.UNSUBSCRIBED, s.endReason());
        assertEquals(0, registry.size());
    }

    @Test
    void shouldReportNotFoundForNeverRegisteredSubscriber() {
        registry.register(session("t", "1"));

        assertFalse(registry.deregister("t", "99"));
        assertFalse(registry.deregister("other", "1"));
        assertEquals(1, registry.size());
    }

    @Test
    void shouldReplaceExistingEntryAndEndOldSession() {
        SubscriberSession first = session("t", "1");
        SubscriberSession second = session("t", "1");
        Subscription firstEntry = registry.register(first);
        Subscription secondEntry = registry.register(second);

        assertEquals(1, registry.size("t"));
        assertSame(second, registry.snapshot("t").get(0).session());
        assertNotSame(firstEntry.deliveryLock(), secondEntry.deliveryLock());
        assertEquals(EndReason.REPLACED, first.endReason());
        assertFalse(second.isEnded());
    }

    @Test
    void shouldWaitForInFlightDeliveryBeforeReplacing() throws Exception {
        SubscriberSession first = session("t", "1");
        Subscription entry = registry.register(first);

        CountDownLatch locked = new CountDownLatch(1);
        AtomicBoolean released = new AtomicBoolean(false);
        Thread holder = new Thread(() -> {
            entry.deliveryLock().lock();
            try {
                locked.countDown();
                Thread.sleep(200);
                released.set(true);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } finally {
                entry.deliveryLock().unlock();
            }
        });
        holder.start();
        assertTrue(locked.await(1, TimeUnit.SECONDS));

        registry.register(session("t", "1"));

        assertTrue(released.get(), "Replacement must wait for the held delivery lock");
        assertEquals(EndReason.REPLACED, first.endReason());
        holder.join();
    }

    @Test
    void shouldEvictListedKeysAndIgnoreMissingOnes() {
        SubscriberSession broken = session("t", "1");
        registry.register(broken);
        registry.register(session("t", "2"));

        int evicted = registry.evictBroken(List.of(
                new SubscriptionKey("t", "1"),
                new SubscriptionKey("t", "gone"),
                new SubscriptionKey("other", "1")));

        assertEquals(1, evicted);
        assertFalse(registry.contains("t", "1"));
        assertTrue(registry.contains("t", "2"));
        assertEquals(EndReason.EVICTED, broken.endReason());
    }

    @Test
    void shouldEndAllSessionsAndRejectRegistrationsAfterClose() {
        SubscriberSession a = session("t", "1");
        SubscriberSession b = session("u", "2");
        registry.register(a);
        registry.register(b);

        assertEquals(2, registry.close());

        assertEquals(0, registry.size());
        assertEquals(EndReason.BROKER_CLOSED, a.endReason());
        assertEquals(EndReason.BROKER_CLOSED, b.endReason());
        assertThrows(IllegalStateException.class, () -> registry.register(session("t", "3")));
    }

    @Test
    void shouldKeepEntriesAndLocksConsistentUnderConcurrentChanges() throws Exception {
        FanOutEngine fanOut = new FanOutEngine(registry, TestUtil.noopMetrics());
        int threads = 6;
        CountDownLatch start = new CountDownLatch(1);
        AtomicReference<Throwable> failure = new AtomicReference<>();
        List<Thread> workers = new ArrayList<>();

        for (int t = 0; t < threads; t++) {
            long seed = t;
            Thread worker = new Thread(() -> {
                Random random = new Random(seed);
                try {
                    start.await();
                    for (int i = 0; i < 500; i++) {
                        String topic = "t" + random.nextInt(3);
                        String id = String.valueOf(random.nextInt(5));
                        switch (random.nextInt(4)) {
                            case 0 -> registry.register(session(topic, id));
                            case 1 -> registry.deregister(topic, id);
                            case 2 -> registry.evictBroken(List.of(new SubscriptionKey(topic, id)));
                            default -> fanOut.publish(topic, TestUtil.bytes("m" + i));
                        }
                    }
                } catch (Throwable e) {
                    failure.compareAndSet(null, e);
                }
            });
            workers.add(worker);
            worker.start();
        }
        start.countDown();
        for (Thread worker : workers) {
            worker.join();
        }

        assertNull(failure.get());
        int entries = 0;
        for (String topic : List.of("t0", "t1", "t2")) {
            for (Subscription subscription : registry.snapshot(topic)) {
                assertNotNull(subscription.deliveryLock());
                assertFalse(subscription.deliveryLock().isLocked());
                assertFalse(subscription.session().isEnded());
                entries++;
            }
        }
        assertEquals(registry.keys().size(), entries);
        assertEquals(registry.size(), entries);
    }
}
