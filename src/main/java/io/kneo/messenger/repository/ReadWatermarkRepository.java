package io.kneo.messenger.repository;

import io.kneo.messenger.repository.table.MessengerNameResolver;
import io.kneo.messenger.service.external.WatermarkStore;
import io.smallrye.mutiny.Uni;
import io.vertx.mutiny.pgclient.PgPool;
import io.vertx.mutiny.sqlclient.Tuple;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDateTime;

import static io.kneo.messenger.repository.table.MessengerNameResolver.READ_WATERMARK;

@ApplicationScoped
public class ReadWatermarkRepository implements WatermarkStore {
    private static final Logger LOGGER = LoggerFactory.getLogger(ReadWatermarkRepository.class);
    private static final MessengerNameResolver.EntityData entityData = MessengerNameResolver.create().getEntityNames(READ_WATERMARK);

    private final PgPool client;

    @Inject
    public ReadWatermarkRepository(PgPool client) {
        this.client = client;
    }

    @Override
    public Uni<Long> getWatermark(long chatId, long userId) {
        String sql = "SELECT seq FROM " + entityData.getTableName() + " WHERE chat_id = $1 AND user_id = $2";

        return client.preparedQuery(sql)
                .execute(Tuple.of(chatId, userId))
                .onItem().transform(rows -> rows.iterator().hasNext() ? rows.iterator().next().getLong("seq") : 0L);
    }

    @Override
    public Uni<Boolean> advanceWatermark(long chatId, long userId, long seq) {
        // the WHERE on the conflict branch keeps the watermark monotonic under concurrent receipts
        String sql = "INSERT INTO " + entityData.getTableName() + " AS w (chat_id, user_id, seq, updated_at) " +
                "VALUES ($1, $2, $3, $4) " +
                "ON CONFLICT (chat_id, user_id) DO UPDATE SET seq = EXCLUDED.seq, updated_at = EXCLUDED.updated_at " +
                "WHERE w.seq < EXCLUDED.seq";

        return client.preparedQuery(sql)
                .execute(Tuple.of(chatId, userId, seq, LocalDateTime.now()))
                .onItem().transform(rows -> rows.rowCount() > 0)
                .onFailure().invoke(throwable ->
                        LOGGER.error("Failed to advance watermark of user {} in chat {} to {}", userId, chatId, seq, throwable)
                );
    }
}
