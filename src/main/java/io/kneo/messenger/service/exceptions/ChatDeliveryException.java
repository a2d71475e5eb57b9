package io.kneo.messenger.service.exceptions;

import lombok.Getter;

@Getter
public class ChatDeliveryException extends RuntimeException {

    @Getter
    public enum ErrorType {
        AUTHENTICATION_FAILURE("invalid_credential", "Credential is missing, invalid or expired"),
        AUTHORIZATION_FAILURE("not_a_participant", "User is not an active participant of the chat"),
        MALFORMED_FRAME("malformed_frame", "Frame does not match the expected schema"),
        PERSISTENCE_FAILURE("persistence_failed", "Message could not be persisted"),
        INVALID_RECONNECT_STATE("invalid_reconnect_state", "Last seen sequence is ahead of the chat head");

        private final String reason;
        private final String defaultMessage;

        ErrorType(String reason, String defaultMessage) {
            this.reason = reason;
            this.defaultMessage = defaultMessage;
        }
    }

    private final ErrorType errorType;

    public ChatDeliveryException(ErrorType errorType) {
        super(errorType.getDefaultMessage());
        this.errorType = errorType;
    }

    public ChatDeliveryException(ErrorType errorType, String msg) {
        super(msg);
        this.errorType = errorType;
    }

    public ChatDeliveryException(ErrorType errorType, Throwable failure) {
        super(errorType.getDefaultMessage(), failure);
        this.errorType = errorType;
    }

    public String getReason() {
        return errorType.getReason();
    }

    public static boolean is(Throwable failure, ErrorType type) {
        return failure instanceof ChatDeliveryException e && e.getErrorType() == type;
    }
}
