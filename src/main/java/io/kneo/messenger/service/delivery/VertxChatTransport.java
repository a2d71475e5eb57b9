package io.kneo.messenger.service.delivery;

import io.smallrye.mutiny.Uni;
import io.vertx.core.http.ServerWebSocket;

public class VertxChatTransport implements ChatTransport {
    private final ServerWebSocket webSocket;

    public VertxChatTransport(ServerWebSocket webSocket) {
        this.webSocket = webSocket;
    }

    @Override
    public Uni<Void> send(String frame) {
        return Uni.createFrom().completionStage(() -> webSocket.writeTextMessage(frame).toCompletionStage());
    }

    @Override
    public Uni<Void> close(CloseReason reason) {
        if (webSocket.isClosed()) {
            return Uni.createFrom().voidItem();
        }
        return Uni.createFrom().completionStage(() -> webSocket.close(reason.getCode(), reason.getReason()).toCompletionStage());
    }

    @Override
    public boolean isClosed() {
        return webSocket.isClosed();
    }
}
