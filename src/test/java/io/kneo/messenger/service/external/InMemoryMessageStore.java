package io.kneo.messenger.service.external;

import io.kneo.messenger.model.ChatMessage;
import io.smallrye.mutiny.Uni;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.TreeMap;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;
import java.util.stream.Collectors;

public class InMemoryMessageStore implements MessageStore {
    private final TreeMap<String, ChatMessage> messages = new TreeMap<>();
    private final AtomicInteger failuresToInject = new AtomicInteger();
    private final AtomicInteger failuresAfterCommit = new AtomicInteger();
    private final AtomicInteger lookupFailures = new AtomicInteger();
    private final AtomicInteger appendAttempts = new AtomicInteger();
    private final AtomicInteger rangeReads = new AtomicInteger();
    private volatile Consumer<Integer> onRangeRead = n -> {
    };

    public void failNextAppends(int count) {
        failuresToInject.set(count);
    }

    /**
     * The next {@code count} appends store the message and then report an error, like a connection
     * that dropped after the commit.
     */
    public void failNextAppendsAfterCommit(int count) {
        failuresAfterCommit.set(count);
    }

    public void failNextLookups(int count) {
        lookupFailures.set(count);
    }

    public int getAppendAttempts() {
        return appendAttempts.get();
    }

    public int getRangeReads() {
        return rangeReads.get();
    }

    /**
     * Hook run after each range read with the running read count, used to simulate writes landing
     * while a reader is paging.
     */
    public void onRangeRead(Consumer<Integer> hook) {
        this.onRangeRead = hook;
    }

    public synchronized void seed(ChatMessage message) {
        messages.put(key(message.getChatId(), message.getSeq()), message);
    }

    public synchronized List<ChatMessage> all(long chatId) {
        return messages.values().stream()
                .filter(m -> m.getChatId() == chatId)
                .sorted((a, b) -> Long.compare(a.getSeq(), b.getSeq()))
                .collect(Collectors.toList());
    }

    @Override
    public Uni<ChatMessage> append(ChatMessage message) {
        return Uni.createFrom().item(() -> {
            appendAttempts.incrementAndGet();
            if (failuresToInject.getAndUpdate(n -> Math.max(0, n - 1)) > 0) {
                throw new IllegalStateException("store unavailable");
            }
            synchronized (this) {
                String key = key(message.getChatId(), message.getSeq());
                ChatMessage existing = messages.get(key);
                if (existing != null && !existing.getId().equals(message.getId())) {
                    throw new IllegalStateException("duplicate seq " + message.getSeq());
                }
                messages.put(key, message);
            }
            if (failuresAfterCommit.getAndUpdate(n -> Math.max(0, n - 1)) > 0) {
                throw new IllegalStateException("connection reset after commit");
            }
            return message;
        });
    }

    @Override
    public Uni<List<ChatMessage>> readRange(long chatId, long afterSeq, int limit) {
        return Uni.createFrom().item(() -> {
            List<ChatMessage> page;
            synchronized (this) {
                page = all(chatId).stream()
                        .filter(m -> m.getSeq() > afterSeq)
                        .limit(limit)
                        .collect(Collectors.toCollection(ArrayList::new));
            }
            onRangeRead.accept(rangeReads.incrementAndGet());
            return page;
        });
    }

    @Override
    public Uni<Optional<ChatMessage>> findById(UUID messageId) {
        return Uni.createFrom().item(() -> {
            if (lookupFailures.getAndUpdate(n -> Math.max(0, n - 1)) > 0) {
                throw new IllegalStateException("store unavailable");
            }
            synchronized (this) {
                return messages.values().stream().filter(m -> m.getId().equals(messageId)).findFirst();
            }
        });
    }

    @Override
    public Uni<Long> maxSequence(long chatId) {
        return Uni.createFrom().item(() -> {
            synchronized (this) {
                return all(chatId).stream().mapToLong(ChatMessage::getSeq).max().orElse(0L);
            }
        });
    }

    private static String key(long chatId, long seq) {
        return String.format("%019d:%019d", chatId, seq);
    }
}
