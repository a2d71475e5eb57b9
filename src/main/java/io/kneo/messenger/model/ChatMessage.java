package io.kneo.messenger.model;

import lombok.Builder;
import lombok.Getter;

import java.time.Instant;
import java.util.UUID;

@Getter
@Builder
public class ChatMessage {
    private final UUID id;
    private final long chatId;
    private final long senderId;
    private final long seq;
    private final String body;
    private final Instant createdAt;
}
