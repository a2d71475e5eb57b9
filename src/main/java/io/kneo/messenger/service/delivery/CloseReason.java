package io.kneo.messenger.service.delivery;

import lombok.Getter;

@Getter
public enum CloseReason {
    NORMAL((short) 1000, "normal"),
    POLICY_VIOLATION((short) 1008, "policy_violation"),
    INTERNAL_ERROR((short) 1011, "internal_error"),
    REPLACED((short) 4000, "replaced"),
    SLOW_CONSUMER((short) 4008, "slow_consumer"),
    INVALID_RECONNECT_STATE((short) 4009, "invalid_reconnect_state");

    private final short code;
    private final String reason;

    CloseReason(short code, String reason) {
        this.code = code;
        this.reason = reason;
    }
}
