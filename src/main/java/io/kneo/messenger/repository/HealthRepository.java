package io.kneo.messenger.repository;

import io.smallrye.mutiny.Uni;
import io.vertx.mutiny.pgclient.PgPool;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

@ApplicationScoped
public class HealthRepository {

    private final PgPool client;

    @Inject
    public HealthRepository(PgPool client) {
        this.client = client;
    }

    public Uni<Boolean> isDatabaseReachable() {
        return client.query("SELECT 1")
                .execute()
                .replaceWith(true)
                .onFailure().recoverWithItem(false);
    }
}
