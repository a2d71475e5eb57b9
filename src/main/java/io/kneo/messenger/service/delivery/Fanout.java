package io.kneo.messenger.service.delivery;

import io.kneo.messenger.dto.OutboundFrameDTO;
import io.kneo.messenger.model.ChatMessage;
import io.smallrye.mutiny.Uni;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.function.LongSupplier;

@ApplicationScoped
public class Fanout {
    private static final Logger LOGGER = LoggerFactory.getLogger(Fanout.class);

    private final ConnectionRegistry registry;
    private final LongSupplier clock;

    @Inject
    public Fanout(ConnectionRegistry registry) {
        this(registry, System::currentTimeMillis);
    }

    Fanout(ConnectionRegistry registry, LongSupplier clock) {
        this.registry = registry;
        this.clock = clock;
    }

    /**
     * Delivers a persisted message to every connection registered for its chat. Callers invoke this in
     * sequence order per chat.
     *
     * @return number of connections the message was queued for
     */
    public int publish(ChatMessage message) {
        List<Connection> connections = registry.list(message.getChatId());
        int queued = 0;
        for (Connection connection : connections) {
            if (deliver(connection, message)) {
                queued++;
            }
        }
        LOGGER.debug("Message seq {} of chat {} queued for {}/{} connections",
                message.getSeq(), message.getChatId(), queued, connections.size());
        return queued;
    }

    public boolean deliver(Connection connection, ChatMessage message) {
        return handle(connection, connection.enqueue(message, clock.getAsLong()));
    }

    public int broadcast(long chatId, OutboundFrameDTO frame, String excludeConnectionId) {
        int queued = 0;
        for (Connection connection : registry.list(chatId)) {
            if (connection.getId().equals(excludeConnectionId)) {
                continue;
            }
            if (send(connection, frame)) {
                queued++;
            }
        }
        return queued;
    }

    public boolean send(Connection connection, OutboundFrameDTO frame) {
        return handle(connection, connection.offer(frame, clock.getAsLong()));
    }

    private boolean handle(Connection connection, OutboundQueue.Offer offer) {
        switch (offer) {
            case ACCEPTED, OVER_CAPACITY -> {
                return true;
            }
            case SATURATED -> {
                LOGGER.warn("Outbound queue of connection {} (user {}, chat {}) is saturated",
                        connection.getId(), connection.getUserId(), connection.getChatId());
                scheduleGraceCheck(connection);
                return true;
            }
            case EXPIRED -> {
                evict(connection);
                return false;
            }
            case OUT_OF_ORDER -> {
                LOGGER.error("Connection {} (user {}, chat {}) missed messages after seq {}, closing it to force a resync",
                        connection.getId(), connection.getUserId(), connection.getChatId(), connection.getEnqueuedSeq());
                connection.close(CloseReason.INTERNAL_ERROR);
                return false;
            }
            default -> {
                return false;
            }
        }
    }

    private void scheduleGraceCheck(Connection connection) {
        long grace = Math.max(1, connection.getOutbound().getGraceMillis());
        Uni.createFrom().voidItem()
                .onItem().delayIt().by(Duration.ofMillis(grace))
                .subscribe().with(
                        v -> {
                            if (!connection.isClosed() && connection.getOutbound().isExpired(clock.getAsLong())) {
                                evict(connection);
                            }
                        },
                        failure -> LOGGER.error("Grace check for connection {} failed", connection.getId(), failure)
                );
    }

    private void evict(Connection connection) {
        LOGGER.warn("Dropping slow consumer {} (user {}, chat {}), {} frames pending, cursor {}",
                connection.getId(), connection.getUserId(), connection.getChatId(),
                connection.getOutbound().size(), connection.getCursor());
        connection.close(CloseReason.SLOW_CONSUMER);
    }
}
