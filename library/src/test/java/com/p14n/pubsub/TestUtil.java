package com.p14n.pubsub;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.BooleanSupplier;

import com.p14n.pubsub.broker.SubscriberStream;
import com.p14n.pubsub.data.Message;
import com.p14n.pubsub.telemetry.BrokerMetrics;

import io.opentelemetry.api.OpenTelemetry;

public class TestUtil {

    public static BrokerMetrics noopMetrics() {
        return new BrokerMetrics(OpenTelemetry.noop().getMeter("test"));
    }

    public static byte[] bytes(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    public static String text(Message m) {
        return new String(m.payload(), StandardCharsets.UTF_8);
    }

    public static void awaitCondition(BooleanSupplier condition, long timeoutMillis, String description)
            throws InterruptedException {
        long deadline = System.currentTimeMillis() + timeoutMillis;
        while (!condition.getAsBoolean()) {
            if (System.currentTimeMillis() > deadline) {
                throw new AssertionError("Timed out waiting for: " + description);
            }
            Thread.sleep(20);
        }
    }

    /**
     * In-memory stream that records what it is sent. Disconnecting it makes
     * further sends fail the way a dead transport call does.
     */
    public static class RecordingStream implements SubscriberStream {
        public final List<Message> received = new CopyOnWriteArrayList<>();
        private final List<Runnable> disconnectCallbacks = new CopyOnWriteArrayList<>();
        private volatile boolean active = true;
        private volatile boolean completed;

        @Override
        public void send(Message message) {
            if (!active) {
                throw new IllegalStateException("stream closed");
            }
            received.add(message);
        }

        @Override
        public boolean isActive() {
            return active;
        }

        @Override
        public void onDisconnect(Runnable callback) {
            disconnectCallbacks.add(callback);
            if (!active) {
                callback.run();
            }
        }

        @Override
        public void complete() {
            completed = true;
        }

        public void disconnect() {
            active = false;
            disconnectCallbacks.forEach(Runnable::run);
        }

        public boolean isCompleted() {
            return completed;
        }
    }
}
