package com.p14n.pubsub.client;

import java.nio.charset.StandardCharsets;
import java.util.concurrent.TimeUnit;

import com.google.protobuf.ByteString;
import com.p14n.pubsub.broker.grpc.PubSubServiceGrpc;
import com.p14n.pubsub.broker.grpc.PublishRequest;

import io.grpc.ManagedChannel;
import io.grpc.ManagedChannelBuilder;
import io.grpc.StatusRuntimeException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Client that publishes messages to the broker, one blocking call per message.
 */
public class PubSubPublisher implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(PubSubPublisher.class);

    private final ManagedChannel channel;
    private final PubSubServiceGrpc.PubSubServiceBlockingStub blockingStub;

    public PubSubPublisher(String host, int port) {
        this(ManagedChannelBuilder.forAddress(host, port)
                .usePlaintext()
                .build());
    }

    public PubSubPublisher(ManagedChannel channel) {
        this.channel = channel;
        this.blockingStub = PubSubServiceGrpc.newBlockingStub(channel);
    }

    /**
     * Publishes a payload to a topic.
     *
     * @param topic   The topic to publish to
     * @param payload The opaque payload
     * @return true if every subscriber received the message. false only says
     *         that at least one delivery failed.
     */
    public boolean publish(String topic, byte[] payload) {
        logger.atDebug()
                .addArgument(payload.length)
                .addArgument(topic)
                .log("Publishing {} bytes to topic {}");

        PublishRequest request = PublishRequest.newBuilder()
                .setTopic(topic)
                .setPayload(ByteString.copyFrom(payload))
                .build();
        try {
            return blockingStub.publish(request).getSuccess();
        } catch (StatusRuntimeException e) {
            logger.atWarn().setCause(e).log("RPC failed: {}", e.getStatus());
            throw new RuntimeException("Failed to publish via gRPC", e);
        }
    }

    public boolean publish(String topic, String payload) {
        return publish(topic, payload.getBytes(StandardCharsets.UTF_8));
    }

    @Override
    public void close() {
        try {
            channel.shutdown().awaitTermination(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.error("Failed to close", e);
        }
    }
}
