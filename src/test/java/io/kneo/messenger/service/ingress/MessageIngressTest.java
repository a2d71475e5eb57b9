package io.kneo.messenger.service.ingress;

import io.kneo.messenger.config.TestMessengerConfig;
import io.kneo.messenger.model.ChatMessage;
import io.kneo.messenger.service.delivery.CloseReason;
import io.kneo.messenger.service.delivery.Connection;
import io.kneo.messenger.service.delivery.ConnectionRegistry;
import io.kneo.messenger.service.delivery.Fanout;
import io.kneo.messenger.service.delivery.OutboundQueue;
import io.kneo.messenger.service.delivery.RecordingTransport;
import io.kneo.messenger.service.exceptions.ChatDeliveryException;
import io.kneo.messenger.service.external.InMemoryMessageStore;
import io.kneo.messenger.service.sequence.SequenceAllocator;
import io.smallrye.mutiny.helpers.test.UniAssertSubscriber;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static io.kneo.messenger.service.exceptions.ChatDeliveryException.ErrorType.MALFORMED_FRAME;
import static io.kneo.messenger.service.exceptions.ChatDeliveryException.ErrorType.PERSISTENCE_FAILURE;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MessageIngressTest {
    private static final long CHAT = 5L;

    private InMemoryMessageStore store;
    private ConnectionRegistry registry;
    private MessageIngress ingress;
    private RecordingTransport senderTransport;
    private RecordingTransport peerTransport;
    private Connection sender;

    @BeforeEach
    void setUp() {
        store = new InMemoryMessageStore();
        registry = new ConnectionRegistry();
        ingress = new MessageIngress(new SequenceAllocator(store), store, new Fanout(registry),
                new TestMessengerConfig().maxMessageLength(10));
        senderTransport = new RecordingTransport();
        peerTransport = new RecordingTransport();
        sender = new Connection(CHAT, 1L, senderTransport, new OutboundQueue(16, 1000));
        registry.register(sender);
        registry.register(new Connection(CHAT, 2L, peerTransport, new OutboundQueue(16, 1000)));
    }

    @Test
    void persistedMessageGetsNextSequenceAndReachesEveryConnection() {
        ChatMessage first = accept("hi").awaitItem().getItem();
        ChatMessage second = accept("there").awaitItem().getItem();

        assertEquals(1L, first.getSeq());
        assertEquals(2L, second.getSeq());
        assertEquals(1L, first.getSenderId());
        assertEquals(List.of(1L, 2L), peerTransport.messageSeqs());
        assertEquals(List.of(1L, 2L), senderTransport.messageSeqs());
        assertEquals("hi", peerTransport.frames("message").get(0).getString("text"));
        assertEquals(2, store.all(CHAT).size());
    }

    @Test
    void blankOrOversizedTextIsRejectedWithoutTouchingTheStore() {
        assertFailure(accept("   "), MALFORMED_FRAME);
        assertFailure(accept(null), MALFORMED_FRAME);
        assertFailure(accept("12345678901"), MALFORMED_FRAME);

        assertEquals(0, store.getAppendAttempts());
        assertTrue(peerTransport.frames().isEmpty());
    }

    @Test
    void transientStoreFailuresAreRetried() {
        store.failNextAppends(2);

        ChatMessage message = accept("hi").awaitItem().getItem();

        assertEquals(1L, message.getSeq());
        assertEquals(3, store.getAppendAttempts());
        assertEquals(List.of(1L), peerTransport.messageSeqs());
    }

    @Test
    void exhaustedRetriesReportFailureAndLeaveNoGap() {
        store.failNextAppends(3);

        assertFailure(accept("lost"), PERSISTENCE_FAILURE);
        assertEquals(3, store.getAppendAttempts());
        assertTrue(peerTransport.frames().isEmpty());
        assertTrue(store.all(CHAT).isEmpty());

        ChatMessage next = accept("kept").awaitItem().getItem();
        assertEquals(1L, next.getSeq());
        assertEquals(List.of(1L), peerTransport.messageSeqs());
    }

    @Test
    void retriedWriteThatAlreadyLandedIsDeliveredOnce() {
        store.failNextAppendsAfterCommit(1);

        ChatMessage first = accept("first").awaitItem().getItem();
        ChatMessage second = accept("second").awaitItem().getItem();

        assertEquals(1L, first.getSeq());
        assertEquals(2L, second.getSeq());
        assertEquals(2, store.all(CHAT).size());
        assertEquals(List.of(1L, 2L), peerTransport.messageSeqs());
        assertTrue(senderTransport.frames("error").isEmpty());
    }

    @Test
    void lastAttemptThatCommittedIsConfirmedByLookup() {
        ingress = new MessageIngress(new SequenceAllocator(store), store, new Fanout(registry),
                new TestMessengerConfig().persistenceMaxAttempts(1));
        store.failNextAppendsAfterCommit(1);

        ChatMessage message = accept("first").awaitItem().getItem();

        assertEquals(1L, message.getSeq());
        assertEquals(1, store.getAppendAttempts());
        assertEquals(List.of(1L), peerTransport.messageSeqs());
    }

    @Test
    void hiddenCommitWithFailedLookupForcesPeersToResync() {
        ingress = new MessageIngress(new SequenceAllocator(store), store, new Fanout(registry),
                new TestMessengerConfig().persistenceMaxAttempts(1));
        store.failNextAppendsAfterCommit(1);
        store.failNextLookups(1);

        assertFailure(accept("first"), PERSISTENCE_FAILURE);
        ChatMessage second = accept("second").awaitItem().getItem();

        assertEquals(2L, second.getSeq());
        assertTrue(peerTransport.messageSeqs().isEmpty());
        assertEquals(CloseReason.INTERNAL_ERROR, peerTransport.getCloseReason());
        assertEquals(0, registry.count(CHAT));
    }

    private UniAssertSubscriber<ChatMessage> accept(String body) {
        return ingress.accept(sender, body).subscribe().withSubscriber(UniAssertSubscriber.create());
    }

    private static void assertFailure(UniAssertSubscriber<ChatMessage> subscriber, ChatDeliveryException.ErrorType type) {
        Throwable failure = subscriber.awaitFailure().getFailure();
        assertTrue(ChatDeliveryException.is(failure, type), "unexpected failure " + failure);
    }
}
