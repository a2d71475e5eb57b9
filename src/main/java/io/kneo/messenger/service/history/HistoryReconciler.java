package io.kneo.messenger.service.history;

import io.kneo.messenger.config.MessengerConfig;
import io.kneo.messenger.model.ChatMessage;
import io.kneo.messenger.service.delivery.Connection;
import io.kneo.messenger.service.delivery.ConnectionRegistry;
import io.kneo.messenger.service.delivery.Fanout;
import io.kneo.messenger.service.exceptions.ChatDeliveryException;
import io.kneo.messenger.service.external.MessageStore;
import io.kneo.messenger.service.sequence.SequenceAllocator;
import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CancellationException;

import static io.kneo.messenger.service.exceptions.ChatDeliveryException.ErrorType.INVALID_RECONNECT_STATE;
import static io.kneo.messenger.service.exceptions.ChatDeliveryException.ErrorType.MALFORMED_FRAME;

/**
 * Brings a new connection up to date before it joins live fan-out.
 * <p>
 * The bulk of the backlog is paged from the store and written directly to the transport. The final step
 * runs inside the chat's sequence lane: whatever was persisted meanwhile is queued and the connection is
 * registered in the same critical section, so every message is either in the backlog or in the live
 * stream, never both and never neither.
 */
@ApplicationScoped
public class HistoryReconciler {
    private static final Logger LOGGER = LoggerFactory.getLogger(HistoryReconciler.class);

    private final MessageStore messageStore;
    private final SequenceAllocator sequenceAllocator;
    private final ConnectionRegistry registry;
    private final Fanout fanout;
    private final MessengerConfig config;

    @Inject
    public HistoryReconciler(MessageStore messageStore, SequenceAllocator sequenceAllocator,
                             ConnectionRegistry registry, Fanout fanout, MessengerConfig config) {
        this.messageStore = messageStore;
        this.sequenceAllocator = sequenceAllocator;
        this.registry = registry;
        this.fanout = fanout;
        this.config = config;
    }

    public Uni<Void> reconcile(Connection connection, long lastSeen) {
        long chatId = connection.getChatId();
        if (lastSeen < 0) {
            return Uni.createFrom().failure(new ChatDeliveryException(MALFORMED_FRAME, "last_seen must not be negative"));
        }
        return sequenceAllocator.head(chatId)
                .onItem().transformToUni(head -> {
                    if (lastSeen > head) {
                        LOGGER.warn("User {} claims seq {} in chat {} whose head is {}", connection.getUserId(), lastSeen, chatId, head);
                        return Uni.createFrom().<Void>failure(new ChatDeliveryException(INVALID_RECONNECT_STATE,
                                "last_seen " + lastSeen + " is ahead of chat head " + head));
                    }
                    connection.resumeFrom(lastSeen);
                    LOGGER.debug("Reconciling user {} in chat {} from {} to {}", connection.getUserId(), chatId, lastSeen, head);
                    return streamBacklog(connection, head);
                })
                .chain(() -> sequenceAllocator.exclusive(chatId, head -> catchUpAndRegister(connection)));
    }

    private Uni<Void> streamBacklog(Connection connection, long head) {
        if (connection.getCursor() >= head) {
            return Uni.createFrom().voidItem();
        }
        return nextPage(connection)
                .onItem().transformToUni(page -> pushPage(connection, page)
                        .chain(() -> page.size() < config.getHistoryPageSize()
                                ? Uni.createFrom().voidItem()
                                : streamBacklog(connection, head)));
    }

    private Uni<Void> catchUpAndRegister(Connection connection) {
        return nextPage(connection)
                .onItem().transformToUni(page -> {
                    page.forEach(message -> fanout.deliver(connection, message));
                    if (page.size() < config.getHistoryPageSize()) {
                        if (!registry.register(connection)) {
                            return Uni.createFrom().<Void>failure(new CancellationException("Connection closed during reconciliation"));
                        }
                        LOGGER.info("User {} is live in chat {} from seq {}", connection.getUserId(), connection.getChatId(), connection.getCursor());
                        return Uni.createFrom().voidItem();
                    }
                    return catchUpAndRegister(connection);
                });
    }

    private Uni<List<ChatMessage>> nextPage(Connection connection) {
        if (connection.isClosed()) {
            return Uni.createFrom().failure(new CancellationException("Connection closed during reconciliation"));
        }
        return messageStore.readRange(connection.getChatId(), connection.getEnqueuedSeq(), config.getHistoryPageSize());
    }

    private Uni<Void> pushPage(Connection connection, List<ChatMessage> page) {
        return Multi.createFrom().iterable(page)
                .onItem().transformToUniAndConcatenate(connection::push)
                .onItem().ignoreAsUni();
    }
}
