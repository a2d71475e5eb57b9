package io.kneo.messenger.dto;

import io.kneo.messenger.dto.cnst.FrameType;
import io.kneo.messenger.model.ChatMessage;
import io.vertx.core.json.JsonObject;
import lombok.Builder;
import lombok.Getter;

import java.time.format.DateTimeFormatter;

@Getter
@Builder
public class OutboundFrameDTO {
    private final FrameType type;
    private final String id;
    private final Long chat;
    private final Long sender;
    private final Long user;
    private final Long seq;
    private final String text;
    private final String createdAt;
    private final String reason;

    public static OutboundFrameDTO message(ChatMessage message) {
        return OutboundFrameDTO.builder()
                .type(FrameType.MESSAGE)
                .id(message.getId().toString())
                .chat(message.getChatId())
                .sender(message.getSenderId())
                .seq(message.getSeq())
                .text(message.getBody())
                .createdAt(DateTimeFormatter.ISO_INSTANT.format(message.getCreatedAt()))
                .build();
    }

    public static OutboundFrameDTO read(long chatId, long userId, long seq) {
        return OutboundFrameDTO.builder()
                .type(FrameType.READ)
                .chat(chatId)
                .user(userId)
                .seq(seq)
                .build();
    }

    public static OutboundFrameDTO error(String reason) {
        return OutboundFrameDTO.builder()
                .type(FrameType.ERROR)
                .reason(reason)
                .build();
    }

    public boolean isMessage() {
        return type == FrameType.MESSAGE;
    }

    public JsonObject toJsonObject() {
        JsonObject json = new JsonObject().put("type", type.getWireName());
        switch (type) {
            case MESSAGE -> json
                    .put("id", id)
                    .put("chat", chat)
                    .put("sender", sender)
                    .put("seq", seq)
                    .put("text", text)
                    .put("created_at", createdAt);
            case READ -> json
                    .put("chat", chat)
                    .put("user", user)
                    .put("seq", seq);
            case ERROR -> json.put("reason", reason);
        }
        return json;
    }

    public String toJson() {
        return toJsonObject().encode();
    }
}
