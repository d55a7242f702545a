package com.p14n.pubsub.broker.grpc;

import com.p14n.pubsub.broker.MessageBroker;
import com.p14n.pubsub.broker.SubscriberSession;
import com.p14n.pubsub.broker.SubscriberSession.EndReason;

import io.grpc.Context;
import io.grpc.Status;
import io.grpc.stub.ServerCallStreamObserver;
import io.grpc.stub.StreamObserver;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * gRPC service exposing a {@link MessageBroker}.
 *
 * <p>
 * A subscribe call keeps its handler thread until the session ends, so the
 * server needs an executor that can grow with the number of subscribers.
 * </p>
 */
public class PubSubGrpcServer extends PubSubServiceGrpc.PubSubServiceImplBase {
    private static final Logger logger = LoggerFactory.getLogger(PubSubGrpcServer.class);
    private final MessageBroker messageBroker;

    public PubSubGrpcServer(MessageBroker messageBroker) {
        this.messageBroker = messageBroker;
    }

    private void errorResponse(StreamObserver<?> responseObserver, Status status, String msg,
            Throwable error) {
        responseObserver.onError(status
                .withDescription(msg)
                .withCause(error)
                .asRuntimeException());
    }

    private Status statusFor(RuntimeException e) {
        if (e instanceof IllegalArgumentException) {
            return Status.INVALID_ARGUMENT;
        }
        if (e instanceof IllegalStateException) {
            return Status.UNAVAILABLE;
        }
        return Status.INTERNAL;
    }

    @Override
    public void subscribe(SubscribeRequest request, StreamObserver<TopicMessage> responseObserver) {
        String topic = request.getTopic();
        String subscriberId = request.getSubscriberId();
        logger.atInfo()
                .addArgument(subscriberId)
                .addArgument(topic)
                .log("Subscription request received from {} for topic {}");

        GrpcSubscriberStream stream = new GrpcSubscriberStream(
                (ServerCallStreamObserver<TopicMessage>) responseObserver, Context.current());
        SubscriberSession session;
        try {
            session = messageBroker.subscribe(topic, subscriberId, stream);
        } catch (RuntimeException e) {
            logger.atError().setCause(e).log("Error setting up subscription to topic: {}", topic);
            errorResponse(responseObserver, statusFor(e), "Failed to subscribe to topic: " + topic, e);
            return;
        }
        stream.onDisconnect(() -> session.end(EndReason.DISCONNECTED));

        try {
            EndReason reason = session.awaitEnd();
            logger.atInfo()
                    .addArgument(subscriberId)
                    .addArgument(topic)
                    .addArgument(reason)
                    .log("Subscription of {} to topic {} ended: {}");
            if (reason != EndReason.DISCONNECTED) {
                stream.complete();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.atWarn().log("Interrupted while serving subscription to topic: {}", topic);
            session.end(EndReason.DISCONNECTED);
            if (stream.isActive()) {
                errorResponse(responseObserver, Status.CANCELLED, "Subscription interrupted", e);
            }
        }
    }

    @Override
    public void unsubscribe(UnsubscribeRequest request, StreamObserver<UnsubscribeResponse> responseObserver) {
        try {
            boolean success = messageBroker.unsubscribe(request.getTopic(), request.getSubscriberId());
            responseObserver.onNext(UnsubscribeResponse.newBuilder()
                    .setSuccess(success)
                    .build());
            responseObserver.onCompleted();
        } catch (RuntimeException e) {
            logger.error("Error unsubscribing", e);
            errorResponse(responseObserver, statusFor(e), "Failed to unsubscribe from topic: " + request.getTopic(), e);
        }
    }

    @Override
    public void publish(PublishRequest request, StreamObserver<PublishResponse> responseObserver) {
        try {
            boolean success = messageBroker.publish(request.getTopic(), request.getPayload().toByteArray());
            responseObserver.onNext(PublishResponse.newBuilder()
                    .setSuccess(success)
                    .build());
            responseObserver.onCompleted();
        } catch (RuntimeException e) {
            logger.error("Error publishing", e);
            errorResponse(responseObserver, statusFor(e), "Failed to publish to topic: " + request.getTopic(), e);
        }
    }
}
