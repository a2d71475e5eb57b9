package io.kneo.messenger.service.sequence;

import io.kneo.messenger.service.external.MessageStore;
import io.smallrye.mutiny.Uni;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * The head only moves after the write carrying head + 1 succeeded. Heads live only in the message
 * table: after a restart the first use of a chat reloads it as the highest persisted sequence number.
 */
@ApplicationScoped
public class SequenceAllocator {
    private static final Logger LOGGER = LoggerFactory.getLogger(SequenceAllocator.class);

    private final MessageStore messageStore;
    private final ChatLanes lanes = new ChatLanes("sequence");
    private final ConcurrentHashMap<Long, Long> heads = new ConcurrentHashMap<>();

    @Inject
    public SequenceAllocator(MessageStore messageStore) {
        this.messageStore = messageStore;
    }

    /**
     * Hands the next sequence number of the chat to {@code write}. When the write succeeds the head is
     * committed and {@code onCommitted} runs, still inside the chat's lane, so side effects that must follow
     * sequence order (fan-out) observe the same total order as the store.
     */
    public <T> Uni<T> next(long chatId, SequencedWrite<T> write, Consumer<T> onCommitted) {
        return lanes.submit(chatId, () -> head(chatId)
                .onItem().transformToUni(head -> {
                    long candidate = head + 1;
                    return write.write(candidate)
                            .onItem().invoke(result -> {
                                heads.merge(chatId, candidate, Math::max);
                                try {
                                    onCommitted.accept(result);
                                } catch (RuntimeException e) {
                                    LOGGER.error("Post-commit step failed for chat {} seq {}", chatId, candidate, e);
                                }
                            })
                            .onFailure().invoke(failure -> {
                                // reload from the store on next use; a live connection that then sees a gap resyncs
                                heads.remove(chatId);
                                LOGGER.warn("Write for chat {} seq {} failed, head stays at {}", chatId, candidate, head);
                            });
                }));
    }

    /**
     * Runs {@code action} inside the chat's lane, where no sequence number can be minted concurrently.
     */
    public <T> Uni<T> exclusive(long chatId, Function<Long, Uni<T>> action) {
        return lanes.submit(chatId, () -> head(chatId).onItem().transformToUni(action::apply));
    }

    public Uni<Long> head(long chatId) {
        Long cached = heads.get(chatId);
        if (cached != null) {
            return Uni.createFrom().item(cached);
        }
        return messageStore.maxSequence(chatId)
                .onItem().transform(persisted -> {
                    LOGGER.debug("Loaded sequence head {} for chat {}", persisted, chatId);
                    return heads.merge(chatId, persisted, Math::max);
                });
    }
}
