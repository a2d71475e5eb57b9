package io.kneo.messenger.service.external;

import io.kneo.messenger.model.ChatMessage;
import io.smallrye.mutiny.Uni;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface MessageStore {

    /**
     * Writes a message whose sequence number has already been chosen. Idempotent on the message id:
     * repeating a write that already landed returns the message. Fails when the (chat, seq) pair is
     * taken by another message.
     */
    Uni<ChatMessage> append(ChatMessage message);

    Uni<List<ChatMessage>> readRange(long chatId, long afterSeq, int limit);

    Uni<Optional<ChatMessage>> findById(UUID messageId);

    Uni<Long> maxSequence(long chatId);
}
