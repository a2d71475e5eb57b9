package io.kneo.messenger.controller;

import io.kneo.messenger.service.auth.Admission;
import io.kneo.messenger.service.delivery.Connection;
import io.kneo.messenger.service.delivery.VertxChatTransport;
import io.kneo.messenger.service.exceptions.ChatDeliveryException;
import io.kneo.messenger.service.session.ChatSessionService;
import io.vertx.core.http.ServerWebSocket;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.Router;
import io.vertx.ext.web.RoutingContext;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static io.kneo.messenger.service.exceptions.ChatDeliveryException.ErrorType.AUTHENTICATION_FAILURE;
import static io.kneo.messenger.service.exceptions.ChatDeliveryException.ErrorType.AUTHORIZATION_FAILURE;

@ApplicationScoped
public class ChatWebSocketController {
    private static final Logger LOGGER = LoggerFactory.getLogger(ChatWebSocketController.class);
    private static final String BEARER_PREFIX = "Bearer ";

    private final ChatSessionService chatSessionService;

    @Inject
    public ChatWebSocketController(ChatSessionService chatSessionService) {
        this.chatSessionService = chatSessionService;
    }

    public void setupRoutes(Router router) {
        router.route("/api/ws/chats/:chatId").handler(this::upgrade);
    }

    private void upgrade(RoutingContext rc) {
        if (!"websocket".equalsIgnoreCase(rc.request().getHeader("Upgrade"))) {
            rc.response().setStatusCode(400).end("WebSocket upgrade required");
            return;
        }
        long chatId;
        long lastSeen;
        try {
            chatId = Long.parseLong(rc.pathParam("chatId"));
            String lastSeenParam = rc.request().getParam("last_seen");
            lastSeen = lastSeenParam == null || lastSeenParam.isBlank() ? 0 : Long.parseLong(lastSeenParam);
        } catch (NumberFormatException e) {
            reject(rc, 400, "malformed_request", "chatId and last_seen must be numeric");
            return;
        }
        if (lastSeen < 0) {
            reject(rc, 400, "malformed_request", "last_seen must not be negative");
            return;
        }

        chatSessionService.admit(resolveToken(rc), chatId)
                .subscribe().with(
                        admission -> rc.request().toWebSocket()
                                .onSuccess(ws -> handleChatWebSocket(ws, admission, lastSeen))
                                .onFailure(err -> {
                                    LOGGER.error("WebSocket upgrade failed for chat {}", chatId, err);
                                    if (!rc.response().ended()) {
                                        rc.fail(500, err);
                                    }
                                }),
                        err -> {
                            if (ChatDeliveryException.is(err, AUTHENTICATION_FAILURE)) {
                                LOGGER.warn("Authentication failed for chat {}: {}", chatId, err.getMessage());
                                reject(rc, 401, AUTHENTICATION_FAILURE.getReason(), err.getMessage());
                            } else if (ChatDeliveryException.is(err, AUTHORIZATION_FAILURE)) {
                                reject(rc, 403, AUTHORIZATION_FAILURE.getReason(), err.getMessage());
                            } else {
                                LOGGER.error("Admission check failed for chat {}", chatId, err);
                                reject(rc, 500, "internal_error", "Admission check failed");
                            }
                        }
                );
    }

    private void handleChatWebSocket(ServerWebSocket webSocket, Admission admission, long lastSeen) {
        Connection connection = chatSessionService.open(admission, new VertxChatTransport(webSocket), lastSeen);
        webSocket.textMessageHandler(text -> chatSessionService.onText(connection, text));
        webSocket.closeHandler(v -> chatSessionService.onClosed(connection));
        webSocket.exceptionHandler(err -> chatSessionService.onTransportError(connection, err));
    }

    private String resolveToken(RoutingContext rc) {
        String token = rc.request().getParam("token");
        if (token != null && !token.isBlank()) {
            return token;
        }
        String authorization = rc.request().getHeader("Authorization");
        if (authorization != null && authorization.startsWith(BEARER_PREFIX)) {
            return authorization.substring(BEARER_PREFIX.length()).trim();
        }
        return null;
    }

    private void reject(RoutingContext rc, int status, String reason, String message) {
        rc.response()
                .setStatusCode(status)
                .putHeader("Content-Type", "application/json")
                .end(new JsonObject()
                        .put("error", reason)
                        .put("message", message)
                        .encode());
    }
}
