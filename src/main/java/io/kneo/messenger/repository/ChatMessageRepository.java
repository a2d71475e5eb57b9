package io.kneo.messenger.repository;

import io.kneo.messenger.model.ChatMessage;
import io.kneo.messenger.repository.table.MessengerNameResolver;
import io.kneo.messenger.service.external.MessageStore;
import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;
import io.vertx.mutiny.pgclient.PgPool;
import io.vertx.mutiny.sqlclient.Row;
import io.vertx.mutiny.sqlclient.RowSet;
import io.vertx.mutiny.sqlclient.Tuple;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static io.kneo.messenger.repository.table.MessengerNameResolver.CHAT_MESSAGE;

@ApplicationScoped
public class ChatMessageRepository implements MessageStore {
    private static final Logger LOGGER = LoggerFactory.getLogger(ChatMessageRepository.class);
    private static final MessengerNameResolver.EntityData entityData = MessengerNameResolver.create().getEntityNames(CHAT_MESSAGE);

    private final PgPool client;

    @Inject
    public ChatMessageRepository(PgPool client) {
        this.client = client;
    }

    @Override
    public Uni<ChatMessage> append(ChatMessage message) {
        String sql = "INSERT INTO " + entityData.getTableName() +
                " (id, chat_id, sender_id, seq, body, created_at) VALUES ($1, $2, $3, $4, $5, $6)" +
                " ON CONFLICT (id) DO NOTHING";

        return client.preparedQuery(sql)
                .execute(Tuple.of(message.getId(), message.getChatId(), message.getSenderId(), message.getSeq())
                        .addString(message.getBody())
                        .addLocalDateTime(LocalDateTime.ofInstant(message.getCreatedAt(), ZoneOffset.UTC)))
                .onItem().transformToUni(rows -> rows.rowCount() > 0
                        ? Uni.createFrom().item(message)
                        : confirmExisting(message))
                .onFailure().invoke(throwable ->
                        LOGGER.error("Failed to save message seq {} for chat {}", message.getSeq(), message.getChatId(), throwable)
                );
    }

    // a retried insert whose first attempt already landed
    private Uni<ChatMessage> confirmExisting(ChatMessage message) {
        return findById(message.getId())
                .onItem().transform(existing -> existing
                        .filter(stored -> stored.getChatId() == message.getChatId() && stored.getSeq() == message.getSeq())
                        .orElseThrow(() -> new IllegalStateException("Message " + message.getId() +
                                " is already stored under a different sequence number")));
    }

    @Override
    public Uni<List<ChatMessage>> readRange(long chatId, long afterSeq, int limit) {
        String sql = "SELECT * FROM " + entityData.getTableName() +
                " WHERE chat_id = $1 AND seq > $2 ORDER BY seq ASC LIMIT $3";

        return client.preparedQuery(sql)
                .execute(Tuple.of(chatId, afterSeq, limit))
                .onItem().transformToMulti(rows -> Multi.createFrom().iterable(rows))
                .onItem().transform(this::from)
                .collect().asList();
    }

    @Override
    public Uni<Optional<ChatMessage>> findById(UUID messageId) {
        String sql = "SELECT * FROM " + entityData.getTableName() + " WHERE id = $1";

        return client.preparedQuery(sql)
                .execute(Tuple.of(messageId))
                .onItem().transform(RowSet::iterator)
                .onItem().transform(iterator -> iterator.hasNext() ? Optional.of(from(iterator.next())) : Optional.<ChatMessage>empty());
    }

    @Override
    public Uni<Long> maxSequence(long chatId) {
        String sql = "SELECT COALESCE(MAX(seq), 0) AS head FROM " + entityData.getTableName() + " WHERE chat_id = $1";

        return client.preparedQuery(sql)
                .execute(Tuple.of(chatId))
                .onItem().transform(rows -> rows.iterator().next().getLong("head"));
    }

    private ChatMessage from(Row row) {
        return ChatMessage.builder()
                .id(row.getUUID("id"))
                .chatId(row.getLong("chat_id"))
                .senderId(row.getLong("sender_id"))
                .seq(row.getLong("seq"))
                .body(row.getString("body"))
                .createdAt(row.getLocalDateTime("created_at").toInstant(ZoneOffset.UTC))
                .build();
    }
}
