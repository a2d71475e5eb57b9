package io.kneo.messenger.service.delivery;

import io.smallrye.mutiny.Uni;

public interface ChatTransport {

    Uni<Void> send(String frame);

    Uni<Void> close(CloseReason reason);

    boolean isClosed();
}
