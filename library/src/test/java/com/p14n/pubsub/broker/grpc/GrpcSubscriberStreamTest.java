package com.p14n.pubsub.broker.grpc;

import com.p14n.pubsub.data.Message;

import io.grpc.Context;
import io.grpc.stub.ServerCallStreamObserver;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.concurrent.atomic.AtomicInteger;

import static com.p14n.pubsub.TestUtil.bytes;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class GrpcSubscriberStreamTest {

    private ServerCallStreamObserver<TopicMessage> observer;
    private Context.CancellableContext context;
    private GrpcSubscriberStream stream;

    @SuppressWarnings("unchecked")
    @BeforeEach
    void setUp() {
        observer = mock(ServerCallStreamObserver.class);
        context = Context.current().withCancellation();
        stream = new GrpcSubscriberStream(observer, context);
    }

    @AfterEach
    void tearDown() {
        context.cancel(null);
    }

    @Test
    void shouldWriteMessageToCall() {
        stream.send(Message.create("news", bytes("hi")));

        ArgumentCaptor<TopicMessage> sent = ArgumentCaptor.forClass(TopicMessage.class);
        verify(observer).onNext(sent.capture());
        assertEquals("news", sent.getValue().getTopic());
        assertEquals("hi", sent.getValue().getPayload().toStringUtf8());
    }

    @Test
    void shouldFailWritesOnceContextIsCancelled() {
        assertTrue(stream.isActive());

        context.cancel(null);

        assertFalse(stream.isActive());
        assertThrows(IllegalStateException.class, () -> stream.send(Message.create("t", bytes("x"))));
        verify(observer, never()).onNext(any());
    }

    @Test
    void shouldFailWritesOnceCallIsCancelled() {
        when(observer.isCancelled()).thenReturn(true);

        assertFalse(stream.isActive());
        assertThrows(IllegalStateException.class, () -> stream.send(Message.create("t", bytes("x"))));
    }

    @Test
    void shouldRunDisconnectCallbackOnCancellation() {
        AtomicInteger calls = new AtomicInteger();
        stream.onDisconnect(calls::incrementAndGet);
        assertEquals(0, calls.get());

        context.cancel(null);

        assertEquals(1, calls.get());
    }

    @Test
    void shouldRunDisconnectCallbackImmediatelyWhenAlreadyCancelled() {
        context.cancel(null);
        AtomicInteger calls = new AtomicInteger();

        stream.onDisconnect(calls::incrementAndGet);

        assertEquals(1, calls.get());
    }

    @Test
    void shouldCompleteOnlyOpenCalls() {
        stream.complete();
        verify(observer).onCompleted();

        context.cancel(null);
        stream.complete();
        verify(observer, times(1)).onCompleted();
    }

    @Test
    void shouldNotThrowWhenCompletingFails() {
        doThrow(new IllegalStateException("call already closed")).when(observer).onCompleted();

        assertDoesNotThrow(() -> stream.complete());
    }
}
