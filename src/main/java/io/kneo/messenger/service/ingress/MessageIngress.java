package io.kneo.messenger.service.ingress;

import io.kneo.messenger.config.MessengerConfig;
import io.kneo.messenger.model.ChatMessage;
import io.kneo.messenger.service.delivery.Connection;
import io.kneo.messenger.service.delivery.Fanout;
import io.kneo.messenger.service.exceptions.ChatDeliveryException;
import io.kneo.messenger.service.external.MessageStore;
import io.kneo.messenger.service.sequence.SequenceAllocator;
import io.smallrye.mutiny.Uni;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

import static io.kneo.messenger.service.exceptions.ChatDeliveryException.ErrorType.MALFORMED_FRAME;
import static io.kneo.messenger.service.exceptions.ChatDeliveryException.ErrorType.PERSISTENCE_FAILURE;

@ApplicationScoped
public class MessageIngress {
    private static final Logger LOGGER = LoggerFactory.getLogger(MessageIngress.class);

    private final SequenceAllocator sequenceAllocator;
    private final MessageStore messageStore;
    private final Fanout fanout;
    private final MessengerConfig config;

    @Inject
    public MessageIngress(SequenceAllocator sequenceAllocator, MessageStore messageStore, Fanout fanout, MessengerConfig config) {
        this.sequenceAllocator = sequenceAllocator;
        this.messageStore = messageStore;
        this.fanout = fanout;
        this.config = config;
    }

    public Uni<ChatMessage> accept(Connection sender, String body) {
        try {
            validate(body);
        } catch (ChatDeliveryException e) {
            return Uni.createFrom().failure(e);
        }
        long chatId = sender.getChatId();
        UUID messageId = UUID.randomUUID();
        Instant createdAt = Instant.now();

        return sequenceAllocator.next(chatId,
                seq -> persist(ChatMessage.builder()
                        .id(messageId)
                        .chatId(chatId)
                        .senderId(sender.getUserId())
                        .seq(seq)
                        .body(body)
                        .createdAt(createdAt)
                        .build()),
                fanout::publish);
    }

    private void validate(String body) {
        if (body == null || body.trim().isEmpty()) {
            throw new ChatDeliveryException(MALFORMED_FRAME, "Message text cannot be empty");
        }
        if (body.length() > config.getMaxMessageLength()) {
            throw new ChatDeliveryException(MALFORMED_FRAME,
                    "Message text exceeds " + config.getMaxMessageLength() + " characters");
        }
    }

    private Uni<ChatMessage> persist(ChatMessage message) {
        Uni<ChatMessage> write = messageStore.append(message);
        int retries = config.getPersistenceMaxAttempts() - 1;
        if (retries > 0) {
            write = write
                    .onFailure().invoke(failure -> LOGGER.warn("Persisting message {} of chat {} failed: {}",
                            message.getId(), message.getChatId(), failure.getMessage()))
                    .onFailure().retry()
                    .withBackOff(Duration.ofMillis(config.getPersistenceInitialBackoffMillis()),
                            Duration.ofMillis(config.getPersistenceMaxBackoffMillis()))
                    .atMost(retries);
        }
        return write
                .onFailure().recoverWithUni(failure -> landedDespite(message, failure))
                .onFailure().transform(failure -> {
                    LOGGER.error("Giving up on message {} of chat {} after {} attempts",
                            message.getId(), message.getChatId(), config.getPersistenceMaxAttempts(), failure);
                    return new ChatDeliveryException(PERSISTENCE_FAILURE, failure);
                });
    }

    // the last reported failure may have hidden a commit
    private Uni<ChatMessage> landedDespite(ChatMessage message, Throwable failure) {
        return messageStore.findById(message.getId())
                .onFailure().recoverWithItem(Optional.<ChatMessage>empty())
                .onItem().transformToUni(stored -> stored.filter(found -> found.getSeq() == message.getSeq()).isPresent()
                        ? Uni.createFrom().item(message)
                        : Uni.createFrom().<ChatMessage>failure(failure));
    }
}
