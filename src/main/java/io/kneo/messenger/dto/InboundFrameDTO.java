package io.kneo.messenger.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.kneo.messenger.dto.cnst.FrameType;
import io.kneo.messenger.service.exceptions.ChatDeliveryException;
import io.vertx.core.json.DecodeException;
import io.vertx.core.json.JsonObject;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.UUID;

import static io.kneo.messenger.service.exceptions.ChatDeliveryException.ErrorType.MALFORMED_FRAME;

@Getter
@Setter
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class InboundFrameDTO {
    private String type;
    private String text;
    @JsonProperty("message_id")
    private String messageId;

    /**
     * Decodes and validates a client frame. Anything that does not describe exactly one known
     * operation fails with {@code MALFORMED_FRAME}.
     */
    public static InboundFrameDTO parse(String raw) {
        InboundFrameDTO frame;
        try {
            frame = new JsonObject(raw).mapTo(InboundFrameDTO.class);
        } catch (DecodeException | IllegalArgumentException | ClassCastException e) {
            throw new ChatDeliveryException(MALFORMED_FRAME, "Frame is not a JSON object");
        }
        FrameType frameType = frame.getFrameType();
        if (frameType == FrameType.MESSAGE && frame.text == null) {
            throw new ChatDeliveryException(MALFORMED_FRAME, "Message frame requires 'text'");
        }
        if (frameType == FrameType.READ) {
            frame.getMessageUuid();
        }
        return frame;
    }

    public FrameType getFrameType() {
        return FrameType.fromWireName(type)
                .filter(t -> t != FrameType.ERROR)
                .orElseThrow(() -> new ChatDeliveryException(MALFORMED_FRAME, "Unknown frame type: " + type));
    }

    public UUID getMessageUuid() {
        if (messageId == null || messageId.isBlank()) {
            throw new ChatDeliveryException(MALFORMED_FRAME, "Read frame requires 'message_id'");
        }
        try {
            return UUID.fromString(messageId);
        } catch (IllegalArgumentException e) {
            throw new ChatDeliveryException(MALFORMED_FRAME, "Invalid message_id: " + messageId);
        }
    }
}
