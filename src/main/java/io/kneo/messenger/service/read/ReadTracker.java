package io.kneo.messenger.service.read;

import io.kneo.messenger.dto.OutboundFrameDTO;
import io.kneo.messenger.model.ChatMessage;
import io.kneo.messenger.service.delivery.Connection;
import io.kneo.messenger.service.delivery.Fanout;
import io.kneo.messenger.service.exceptions.ChatDeliveryException;
import io.kneo.messenger.service.external.MessageStore;
import io.kneo.messenger.service.external.WatermarkStore;
import io.kneo.messenger.service.sequence.ChatLanes;
import io.smallrye.mutiny.Uni;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.UUID;

import static io.kneo.messenger.service.exceptions.ChatDeliveryException.ErrorType.MALFORMED_FRAME;

@ApplicationScoped
public class ReadTracker {
    private static final Logger LOGGER = LoggerFactory.getLogger(ReadTracker.class);

    private final MessageStore messageStore;
    private final WatermarkStore watermarkStore;
    private final Fanout fanout;
    private final ChatLanes lanes = new ChatLanes("receipt");

    @Inject
    public ReadTracker(MessageStore messageStore, WatermarkStore watermarkStore, Fanout fanout) {
        this.messageStore = messageStore;
        this.watermarkStore = watermarkStore;
        this.fanout = fanout;
    }

    public Uni<ReadOutcome> acknowledge(Connection reader, UUID messageId) {
        long chatId = reader.getChatId();
        return messageStore.findById(messageId)
                .onItem().transform(found -> found
                        .filter(message -> message.getChatId() == chatId)
                        .orElseThrow(() -> new ChatDeliveryException(MALFORMED_FRAME,
                                "Message " + messageId + " does not exist in chat " + chatId)))
                .onItem().transformToUni(message -> lanes.submit(chatId, () -> apply(reader, message)));
    }

    private Uni<ReadOutcome> apply(Connection reader, ChatMessage message) {
        long chatId = reader.getChatId();
        long userId = reader.getUserId();
        long seq = message.getSeq();
        return watermarkStore.getWatermark(chatId, userId)
                .onItem().transformToUni(current -> {
                    if (seq <= current) {
                        return Uni.createFrom().item(ReadOutcome.UNCHANGED);
                    }
                    return watermarkStore.advanceWatermark(chatId, userId, seq)
                            .onItem().transform(advanced -> {
                                if (!advanced) {
                                    return ReadOutcome.UNCHANGED;
                                }
                                int notified = fanout.broadcast(chatId, OutboundFrameDTO.read(chatId, userId, seq), reader.getId());
                                LOGGER.debug("User {} read chat {} up to {}, {} connections notified", userId, chatId, seq, notified);
                                return ReadOutcome.ADVANCED;
                            });
                });
    }
}
