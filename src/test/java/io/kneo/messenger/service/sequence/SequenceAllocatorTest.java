package io.kneo.messenger.service.sequence;

import io.kneo.messenger.model.ChatMessage;
import io.kneo.messenger.service.external.InMemoryMessageStore;
import io.smallrye.mutiny.Uni;
import io.smallrye.mutiny.helpers.test.UniAssertSubscriber;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import java.util.stream.LongStream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SequenceAllocatorTest {

    private InMemoryMessageStore store;
    private SequenceAllocator allocator;

    @BeforeEach
    void setUp() {
        store = new InMemoryMessageStore();
        allocator = new SequenceAllocator(store);
    }

    @Test
    void concurrentSendersGetDenseIncreasingSequencesPerChat() throws InterruptedException {
        ExecutorService pool = Executors.newFixedThreadPool(8);
        int perChat = 200;
        CountDownLatch done = new CountDownLatch(perChat * 2);
        List<Long> committedOrder = new CopyOnWriteArrayList<>();

        for (int i = 0; i < perChat; i++) {
            for (long chatId : new long[]{1L, 2L}) {
                pool.submit(() -> allocator.next(chatId, seq -> store.append(message(chatId, seq)),
                                m -> {
                                    if (m.getChatId() == 1L) {
                                        committedOrder.add(m.getSeq());
                                    }
                                })
                        .subscribe().with(m -> done.countDown(), f -> done.countDown()));
            }
        }

        assertTrue(done.await(10, TimeUnit.SECONDS));
        pool.shutdownNow();

        List<Long> expected = LongStream.rangeClosed(1, perChat).boxed().collect(Collectors.toList());
        assertEquals(expected, seqs(1L));
        assertEquals(expected, seqs(2L));
        assertEquals(expected, committedOrder);
    }

    @Test
    void failedWriteDoesNotConsumeASequenceNumber() {
        allocator.next(3L, seq -> store.append(message(3L, seq)), m -> {
        }).subscribe().withSubscriber(UniAssertSubscriber.create()).assertCompleted();

        List<Long> committed = new ArrayList<>();
        allocator.next(3L, seq -> Uni.createFrom().<ChatMessage>failure(new IllegalStateException("down")), m -> committed.add(m.getSeq()))
                .subscribe().withSubscriber(UniAssertSubscriber.create())
                .assertFailedWith(IllegalStateException.class, "down");

        ChatMessage next = allocator.next(3L, seq -> store.append(message(3L, seq)), m -> committed.add(m.getSeq()))
                .subscribe().withSubscriber(UniAssertSubscriber.create())
                .assertCompleted().getItem();

        assertEquals(2L, next.getSeq());
        assertEquals(List.of(2L), committed);
        assertEquals(List.of(1L, 2L), seqs(3L));
    }

    @Test
    void restartedAllocatorContinuesFromPersistedHighWaterMark() {
        store.seed(message(9L, 1));
        store.seed(message(9L, 2));
        store.seed(message(9L, 3));

        SequenceAllocator restarted = new SequenceAllocator(store);

        assertEquals(3L, restarted.head(9L).await().indefinitely());
        ChatMessage next = restarted.next(9L, seq -> store.append(message(9L, seq)), m -> {
        }).await().indefinitely();
        assertEquals(4L, next.getSeq());
        assertEquals(4L, restarted.head(9L).await().indefinitely());
    }

    @Test
    void failingPostCommitStepDoesNotUndoTheCommit() {
        allocator.next(4L, seq -> store.append(message(4L, seq)), m -> {
            throw new IllegalStateException("fan-out bug");
        }).subscribe().withSubscriber(UniAssertSubscriber.create()).assertCompleted();

        assertEquals(1L, allocator.head(4L).await().indefinitely());
    }

    private List<Long> seqs(long chatId) {
        return store.all(chatId).stream().map(ChatMessage::getSeq).collect(Collectors.toList());
    }

    private static ChatMessage message(long chatId, long seq) {
        return ChatMessage.builder()
                .id(UUID.randomUUID())
                .chatId(chatId)
                .senderId(1L)
                .seq(seq)
                .body("m" + seq)
                .createdAt(Instant.now())
                .build();
    }
}
