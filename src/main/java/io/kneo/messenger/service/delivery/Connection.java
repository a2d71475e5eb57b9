package io.kneo.messenger.service.delivery;

import io.kneo.messenger.dto.OutboundFrameDTO;
import io.kneo.messenger.model.ChatMessage;
import io.smallrye.mutiny.Uni;
import io.smallrye.mutiny.subscription.Cancellable;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

public class Connection {
    private static final Logger LOGGER = LoggerFactory.getLogger(Connection.class);

    @Getter
    private final String id = UUID.randomUUID().toString();
    @Getter
    private final long chatId;
    @Getter
    private final long userId;
    @Getter
    private final ChatTransport transport;
    @Getter
    private final OutboundQueue outbound;
    private final AtomicLong deliveryCursor = new AtomicLong();
    private final AtomicLong enqueuedSeq = new AtomicLong();
    private final AtomicBoolean draining = new AtomicBoolean();
    private final AtomicBoolean closed = new AtomicBoolean();
    private final AtomicReference<Cancellable> reconciliation = new AtomicReference<>();
    private final AtomicReference<Consumer<Connection>> closeListener = new AtomicReference<>();

    public Connection(long chatId, long userId, ChatTransport transport, OutboundQueue outbound) {
        this.chatId = chatId;
        this.userId = userId;
        this.transport = transport;
        this.outbound = outbound;
    }

    public long getCursor() {
        return deliveryCursor.get();
    }

    public long getEnqueuedSeq() {
        return enqueuedSeq.get();
    }

    public boolean isClosed() {
        return closed.get();
    }

    public void resumeFrom(long lastSeen) {
        deliveryCursor.set(lastSeen);
        enqueuedSeq.set(lastSeen);
    }

    /**
     * Queues a message frame unless this connection already received or queued that sequence number.
     * A frame that does not directly follow the last queued one is refused with {@code OUT_OF_ORDER}.
     */
    public OutboundQueue.Offer enqueue(ChatMessage message, long nowMillis) {
        long seq = message.getSeq();
        long last = enqueuedSeq.get();
        if (last >= seq) {
            return OutboundQueue.Offer.ACCEPTED;
        }
        if (seq != last + 1) {
            return OutboundQueue.Offer.OUT_OF_ORDER;
        }
        OutboundQueue.Offer offer = offer(OutboundFrameDTO.message(message), nowMillis);
        if (offer != OutboundQueue.Offer.EXPIRED && offer != OutboundQueue.Offer.CLOSED) {
            enqueuedSeq.set(seq);
        }
        return offer;
    }

    public OutboundQueue.Offer offer(OutboundFrameDTO frame, long nowMillis) {
        OutboundQueue.Offer offer = outbound.offer(frame, nowMillis);
        if (offer != OutboundQueue.Offer.EXPIRED && offer != OutboundQueue.Offer.CLOSED) {
            startDraining();
        }
        return offer;
    }

    /**
     * Writes a message straight to the transport, bypassing the queue. Only valid while the connection
     * is not yet registered for fan-out, so nothing else writes concurrently.
     */
    public Uni<Void> push(ChatMessage message) {
        if (isClosed()) {
            return Uni.createFrom().voidItem();
        }
        return transport.send(OutboundFrameDTO.message(message).toJson())
                .onItem().invoke(() -> {
                    enqueuedSeq.accumulateAndGet(message.getSeq(), Math::max);
                    deliveryCursor.accumulateAndGet(message.getSeq(), Math::max);
                });
    }

    public void trackReconciliation(Cancellable cancellable) {
        reconciliation.set(cancellable);
        if (isClosed()) {
            cancellable.cancel();
        }
    }

    public void onClose(Consumer<Connection> listener) {
        closeListener.set(listener);
        if (isClosed()) {
            Consumer<Connection> late = closeListener.getAndSet(null);
            if (late != null) {
                late.accept(this);
            }
        }
    }

    public void close(CloseReason reason) {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        Cancellable pending = reconciliation.getAndSet(null);
        if (pending != null) {
            pending.cancel();
        }
        int dropped = outbound.close();
        LOGGER.debug("Closing connection {} of user {} in chat {}: {} ({} queued frames dropped, cursor {})",
                id, userId, chatId, reason, dropped, deliveryCursor.get());
        transport.close(reason).subscribe().with(
                v -> {
                },
                failure -> LOGGER.warn("Transport close failed for connection {}: {}", id, failure.getMessage())
        );
        Consumer<Connection> listener = closeListener.getAndSet(null);
        if (listener != null) {
            listener.accept(this);
        }
    }

    private void startDraining() {
        if (draining.compareAndSet(false, true)) {
            drainNext();
        }
    }

    private void drainNext() {
        OutboundFrameDTO frame = outbound.poll();
        if (frame == null) {
            draining.set(false);
            if (!outbound.isEmpty()) {
                startDraining();
            }
            return;
        }
        transport.send(frame.toJson()).subscribe().with(
                v -> {
                    if (frame.isMessage()) {
                        deliveryCursor.accumulateAndGet(frame.getSeq(), Math::max);
                    }
                    drainNext();
                },
                failure -> {
                    LOGGER.warn("Write to connection {} failed: {}", id, failure.getMessage());
                    draining.set(false);
                    close(CloseReason.INTERNAL_ERROR);
                }
        );
    }
}
