package com.p14n.pubsub.broker.grpc;

import com.google.common.util.concurrent.MoreExecutors;
import com.google.protobuf.ByteString;
import com.p14n.pubsub.broker.SubscriberStream;
import com.p14n.pubsub.data.Message;

import io.grpc.Context;
import io.grpc.stub.ServerCallStreamObserver;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link SubscriberStream} over the response side of a server-streaming
 * subscribe call. Disconnects are observed through the call's {@link Context}
 * being cancelled: the context is cancelled as soon as the transport sees the
 * call end, while the observer's own cancelled flag is only updated once the
 * subscribe handler has returned.
 */
public class GrpcSubscriberStream implements SubscriberStream {
    private static final Logger logger = LoggerFactory.getLogger(GrpcSubscriberStream.class);

    private final ServerCallStreamObserver<TopicMessage> responseObserver;
    private final Context context;

    public GrpcSubscriberStream(ServerCallStreamObserver<TopicMessage> responseObserver, Context context) {
        this.responseObserver = responseObserver;
        this.context = context;
    }

    @Override
    public void send(Message message) {
        if (!isActive()) {
            throw new IllegalStateException("Subscriber call already cancelled");
        }
        responseObserver.onNext(TopicMessage.newBuilder()
                .setTopic(message.topic())
                .setPayload(ByteString.copyFrom(message.payload()))
                .build());
    }

    @Override
    public boolean isActive() {
        return !context.isCancelled() && !responseObserver.isCancelled();
    }

    @Override
    public void onDisconnect(Runnable callback) {
        context.addListener(ctx -> callback.run(), MoreExecutors.directExecutor());
    }

    @Override
    public void complete() {
        if (!isActive()) {
            return;
        }
        try {
            responseObserver.onCompleted();
        } catch (RuntimeException e) {
            logger.atDebug().setCause(e).log("Subscriber call closed before it could be completed");
        }
    }
}
