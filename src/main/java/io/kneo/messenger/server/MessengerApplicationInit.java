package io.kneo.messenger.server;

import io.kneo.messenger.controller.ChatWebSocketController;
import io.kneo.messenger.config.MessengerConfig;
import io.kneo.messenger.controller.HealthController;
import io.kneo.messenger.repository.SchemaRepository;
import io.quarkus.runtime.StartupEvent;
import io.vertx.ext.web.Route;
import io.vertx.ext.web.Router;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

@ApplicationScoped
public class MessengerApplicationInit {
    private static final Logger LOGGER = LoggerFactory.getLogger(MessengerApplicationInit.class);

    @Inject
    ChatWebSocketController chatWebSocketController;

    @Inject
    HealthController healthController;

    @Inject
    SchemaRepository schemaRepository;

    @Inject
    MessengerConfig config;

    void onStart(@Observes StartupEvent ev) {
        if (!config.isSchemaInitEnabled()) {
            LOGGER.info("Schema initialization disabled, tables are expected to exist");
            return;
        }
        schemaRepository.applySchema().await().atMost(Duration.ofSeconds(30));
    }

    public void setupRoutes(@Observes Router router) {
        chatWebSocketController.setupRoutes(router);
        healthController.setupRoutes(router);
        logRegisteredRoutes(router);
    }

    private void logRegisteredRoutes(Router router) {
        for (Route route : router.getRoutes()) {
            if (route.getPath() != null) {
                LOGGER.info("Route registered: {} {}", route.methods() == null ? "*" : route.methods(), route.getPath());
            }
        }
    }
}
