package com.p14n.pubsub.client;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.TimeUnit;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.p14n.pubsub.broker.grpc.PubSubServiceGrpc;
import com.p14n.pubsub.broker.grpc.SubscribeRequest;
import com.p14n.pubsub.broker.grpc.TopicMessage;
import com.p14n.pubsub.broker.grpc.UnsubscribeRequest;
import com.p14n.pubsub.data.Message;

import io.grpc.ManagedChannel;
import io.grpc.ManagedChannelBuilder;
import io.grpc.Status;
import io.grpc.StatusRuntimeException;
import io.grpc.stub.ClientCallStreamObserver;
import io.grpc.stub.ClientResponseObserver;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Client that subscribes to broker topics and buffers every message it
 * receives, in arrival order.
 *
 * <p>
 * Each subscribed topic has its own server-streaming call. Messages arriving on
 * it are appended to the local buffer and handed to the optional
 * {@link MessageSubscriber}. When a call fails or completes the topic is
 * dropped locally; there is no reconnection.
 * </p>
 */
public class PubSubConsumer implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(PubSubConsumer.class);

    private final String subscriberId;
    private final ManagedChannel channel;
    private final PubSubServiceGrpc.PubSubServiceStub asyncStub;
    private final PubSubServiceGrpc.PubSubServiceBlockingStub blockingStub;
    private final MessageSubscriber<Message> subscriber;

    private final Object lock = new Object();
    private final Map<String, TopicReceiver> subscriptions = new HashMap<>();
    private final List<Message> messages = new ArrayList<>();

    public PubSubConsumer(String host, int port) {
        this(host, port, UUID.randomUUID().toString(), null);
    }

    public PubSubConsumer(String host, int port, String subscriberId, MessageSubscriber<Message> subscriber) {
        this(ManagedChannelBuilder.forAddress(host, port)
                .keepAliveTime(1, TimeUnit.HOURS)
                .keepAliveTimeout(30, TimeUnit.SECONDS)
                .usePlaintext()
                .build(), subscriberId, subscriber);
    }

    public PubSubConsumer(ManagedChannel channel, String subscriberId, MessageSubscriber<Message> subscriber) {
        if (subscriberId == null) {
            throw new IllegalArgumentException("Subscriber id cannot be null");
        }
        this.channel = channel;
        this.subscriberId = subscriberId;
        this.subscriber = subscriber;
        this.asyncStub = PubSubServiceGrpc.newStub(channel);
        this.blockingStub = PubSubServiceGrpc.newBlockingStub(channel);
    }

    public String subscriberId() {
        return subscriberId;
    }

    /**
     * Subscribes to a topic. Does nothing if this consumer is already
     * subscribed to it.
     *
     * @param topic The topic to subscribe to
     */
    public void subscribe(String topic) {
        synchronized (lock) {
            if (subscriptions.containsKey(topic)) {
                return;
            }
            TopicReceiver receiver = new TopicReceiver(topic);
            asyncStub.subscribe(SubscribeRequest.newBuilder()
                    .setTopic(topic)
                    .setSubscriberId(subscriberId)
                    .build(), receiver);
            subscriptions.put(topic, receiver);
        }
        logger.atInfo().log("Subscribed to topic: {}", topic);
    }

    /**
     * Cancels the stream for a topic and removes the subscription on the broker.
     *
     * @param topic The topic to unsubscribe from
     * @return the broker's answer, or false if this consumer was not subscribed
     */
    public boolean unsubscribe(String topic) {
        TopicReceiver receiver;
        synchronized (lock) {
            receiver = subscriptions.remove(topic);
        }
        if (receiver == null) {
            return false;
        }
        receiver.cancel();

        UnsubscribeRequest request = UnsubscribeRequest.newBuilder()
                .setTopic(topic)
                .setSubscriberId(subscriberId)
                .build();
        try {
            boolean success = blockingStub.unsubscribe(request).getSuccess();
            logger.atInfo()
                    .addArgument(topic)
                    .addArgument(success)
                    .log("Unsubscribed from topic {}: {}");
            return success;
        } catch (StatusRuntimeException e) {
            logger.atWarn().setCause(e).log("RPC failed: {}", e.getStatus());
            throw new RuntimeException("Failed to unsubscribe via gRPC", e);
        }
    }

    /**
     * @return the messages received so far, oldest first
     */
    public List<Message> messages() {
        synchronized (lock) {
            return ImmutableList.copyOf(messages);
        }
    }

    /**
     * @return the topics with an open stream
     */
    public Set<String> subscriptions() {
        synchronized (lock) {
            return ImmutableSet.copyOf(subscriptions.keySet());
        }
    }

    /**
     * Unsubscribes from every topic and shuts the channel down.
     */
    @Override
    public void close() {
        logger.atInfo().log("Closing consumer {}", subscriberId);

        for (String topic : subscriptions()) {
            try {
                unsubscribe(topic);
            } catch (RuntimeException e) {
                logger.atWarn()
                        .setCause(e)
                        .addArgument(topic)
                        .log("Error unsubscribing from {}");
            }
        }
        try {
            channel.shutdown().awaitTermination(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.error("Interrupted while closing channel", e);
        }
    }

    private void received(Message message) {
        synchronized (lock) {
            messages.add(message);
        }
        if (subscriber != null) {
            try {
                subscriber.onMessage(message);
            } catch (Exception e) {
                logger.atError().setCause(e).log("Error processing message");
            }
        }
    }

    private void ended(String topic, TopicReceiver receiver) {
        synchronized (lock) {
            subscriptions.remove(topic, receiver);
        }
    }

    private class TopicReceiver implements ClientResponseObserver<SubscribeRequest, TopicMessage> {
        private final String topic;
        private volatile ClientCallStreamObserver<SubscribeRequest> call;
        private volatile boolean cancelled;

        TopicReceiver(String topic) {
            this.topic = topic;
        }

        @Override
        public void beforeStart(ClientCallStreamObserver<SubscribeRequest> requestStream) {
            this.call = requestStream;
        }

        void cancel() {
            cancelled = true;
            ClientCallStreamObserver<SubscribeRequest> c = call;
            if (c != null) {
                c.cancel("Unsubscribed", null);
            }
        }

        @Override
        public void onNext(TopicMessage value) {
            logger.atDebug().log("Received message on topic: {}", topic);
            received(Message.create(value.getTopic(), value.getPayload().toByteArray()));
        }

        @Override
        public void onError(Throwable t) {
            ended(topic, this);
            if (cancelled && Status.fromThrowable(t).getCode() == Status.Code.CANCELLED) {
                logger.atDebug().log("Stream for topic {} cancelled", topic);
                return;
            }
            logger.atError().setCause(t).log("Error in stream for topic: {}", topic);
            if (subscriber != null) {
                try {
                    subscriber.onError(t);
                } catch (Exception e) {
                    logger.atError().setCause(e).log("Error notifying subscriber of stream failure");
                }
            }
        }

        @Override
        public void onCompleted() {
            logger.atInfo().log("Stream completed for topic: {}", topic);
            ended(topic, this);
        }
    }
}
