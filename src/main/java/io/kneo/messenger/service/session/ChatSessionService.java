package io.kneo.messenger.service.session;

import io.kneo.messenger.config.MessengerConfig;
import io.kneo.messenger.dto.InboundFrameDTO;
import io.kneo.messenger.dto.OutboundFrameDTO;
import io.kneo.messenger.service.auth.Admission;
import io.kneo.messenger.service.auth.AuthGate;
import io.kneo.messenger.service.delivery.ChatTransport;
import io.kneo.messenger.service.delivery.CloseReason;
import io.kneo.messenger.service.delivery.Connection;
import io.kneo.messenger.service.delivery.Fanout;
import io.kneo.messenger.service.delivery.OutboundQueue;
import io.kneo.messenger.service.exceptions.ChatDeliveryException;
import io.kneo.messenger.service.history.HistoryReconciler;
import io.kneo.messenger.service.ingress.MessageIngress;
import io.kneo.messenger.service.read.ReadTracker;
import io.smallrye.mutiny.Uni;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CancellationException;

import static io.kneo.messenger.service.exceptions.ChatDeliveryException.ErrorType.INVALID_RECONNECT_STATE;

@ApplicationScoped
public class ChatSessionService {
    private static final Logger LOGGER = LoggerFactory.getLogger(ChatSessionService.class);

    private final AuthGate authGate;
    private final HistoryReconciler historyReconciler;
    private final MessageIngress messageIngress;
    private final ReadTracker readTracker;
    private final Fanout fanout;
    private final MessengerConfig config;

    @Inject
    public ChatSessionService(AuthGate authGate, HistoryReconciler historyReconciler, MessageIngress messageIngress,
                              ReadTracker readTracker, Fanout fanout, MessengerConfig config) {
        this.authGate = authGate;
        this.historyReconciler = historyReconciler;
        this.messageIngress = messageIngress;
        this.readTracker = readTracker;
        this.fanout = fanout;
        this.config = config;
    }

    public Uni<Admission> admit(String token, long chatId) {
        return authGate.admit(token, chatId);
    }

    public Connection open(Admission admission, ChatTransport transport, long lastSeen) {
        Connection connection = new Connection(admission.chatId(), admission.userId(), transport,
                new OutboundQueue(config.getOutboundQueueCapacity(), config.getOutboundQueueOverflowLimit(),
                        config.getSlowConsumerGraceMillis()));
        LOGGER.info("Connection {} opened for user {} in chat {}, last seen {}",
                connection.getId(), admission.userId(), admission.chatId(), lastSeen);
        connection.trackReconciliation(historyReconciler.reconcile(connection, lastSeen)
                .subscribe().with(
                        v -> {
                        },
                        failure -> onReconcileFailure(connection, failure)
                ));
        return connection;
    }

    public void onText(Connection connection, String text) {
        if (connection.isClosed()) {
            return;
        }
        InboundFrameDTO frame;
        try {
            frame = InboundFrameDTO.parse(text);
        } catch (ChatDeliveryException e) {
            reportFailure(connection, e);
            return;
        }
        switch (frame.getFrameType()) {
            case MESSAGE -> messageIngress.accept(connection, frame.getText())
                    .subscribe().with(
                            message -> LOGGER.debug("Accepted seq {} from user {} in chat {}",
                                    message.getSeq(), connection.getUserId(), connection.getChatId()),
                            failure -> reportFailure(connection, failure)
                    );
            case READ -> readTracker.acknowledge(connection, frame.getMessageUuid())
                    .subscribe().with(
                            outcome -> {
                            },
                            failure -> reportFailure(connection, failure)
                    );
            default -> reportFailure(connection, new ChatDeliveryException(ChatDeliveryException.ErrorType.MALFORMED_FRAME));
        }
    }

    public void onClosed(Connection connection) {
        connection.close(CloseReason.NORMAL);
    }

    public void onTransportError(Connection connection, Throwable error) {
        LOGGER.warn("Transport error on connection {}: {}", connection.getId(), error.getMessage());
        connection.close(CloseReason.INTERNAL_ERROR);
    }

    private void onReconcileFailure(Connection connection, Throwable failure) {
        if (failure instanceof CancellationException) {
            LOGGER.debug("Reconciliation of connection {} stopped: {}", connection.getId(), failure.getMessage());
            return;
        }
        // the close reason is the only signal; queued frames are discarded on close
        if (ChatDeliveryException.is(failure, INVALID_RECONNECT_STATE)) {
            connection.close(CloseReason.INVALID_RECONNECT_STATE);
            return;
        }
        if (failure instanceof ChatDeliveryException) {
            connection.close(CloseReason.POLICY_VIOLATION);
            return;
        }
        LOGGER.error("Reconciliation of connection {} failed", connection.getId(), failure);
        connection.close(CloseReason.INTERNAL_ERROR);
    }

    private void reportFailure(Connection connection, Throwable failure) {
        if (failure instanceof ChatDeliveryException e) {
            LOGGER.debug("Rejected frame from user {} in chat {}: {}", connection.getUserId(), connection.getChatId(), e.getMessage());
            fanout.send(connection, OutboundFrameDTO.error(e.getReason()));
        } else {
            LOGGER.error("Unexpected failure on connection {}", connection.getId(), failure);
            fanout.send(connection, OutboundFrameDTO.error(CloseReason.INTERNAL_ERROR.getReason()));
        }
    }
}
