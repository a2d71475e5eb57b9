package io.kneo.messenger.controller;

import io.kneo.messenger.repository.HealthRepository;
import io.kneo.messenger.service.delivery.ConnectionRegistry;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.Router;
import io.vertx.ext.web.RoutingContext;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

@ApplicationScoped
public class HealthController {
    private static final Logger LOGGER = LoggerFactory.getLogger(HealthController.class);

    private final HealthRepository healthRepository;
    private final ConnectionRegistry connectionRegistry;

    @Inject
    public HealthController(HealthRepository healthRepository, ConnectionRegistry connectionRegistry) {
        this.healthRepository = healthRepository;
        this.connectionRegistry = connectionRegistry;
    }

    public void setupRoutes(Router router) {
        router.get("/api/health").handler(this::health);
    }

    private void health(RoutingContext rc) {
        healthRepository.isDatabaseReachable()
                .subscribe().with(
                        reachable -> {
                            if (!reachable) {
                                LOGGER.warn("Health check: database is not reachable");
                            }
                            rc.response()
                                    .setStatusCode(reachable ? 200 : 503)
                                    .putHeader("Content-Type", "application/json")
                                    .end(new JsonObject()
                                            .put("status", reachable ? "UP" : "DOWN")
                                            .put("database", reachable ? "UP" : "DOWN")
                                            .put("connections", connectionRegistry.totalConnections())
                                            .encode());
                        },
                        err -> rc.fail(500, err)
                );
    }
}
