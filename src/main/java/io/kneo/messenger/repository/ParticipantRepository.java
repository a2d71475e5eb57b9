package io.kneo.messenger.repository;

import io.kneo.messenger.model.Participant;
import io.kneo.messenger.model.cnst.ParticipantRole;
import io.kneo.messenger.repository.table.MessengerNameResolver;
import io.kneo.messenger.service.external.ParticipantDirectory;
import io.smallrye.mutiny.Uni;
import io.vertx.mutiny.pgclient.PgPool;
import io.vertx.mutiny.sqlclient.Row;
import io.vertx.mutiny.sqlclient.Tuple;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.util.Optional;

import static io.kneo.messenger.repository.table.MessengerNameResolver.PARTICIPANT;

@ApplicationScoped
public class ParticipantRepository implements ParticipantDirectory {
    private static final MessengerNameResolver.EntityData entityData = MessengerNameResolver.create().getEntityNames(PARTICIPANT);

    private final PgPool client;

    @Inject
    public ParticipantRepository(PgPool client) {
        this.client = client;
    }

    public Uni<Optional<Participant>> findParticipant(long chatId, long userId) {
        String sql = "SELECT * FROM " + entityData.getTableName() + " WHERE chat_id = $1 AND user_id = $2";

        return client.preparedQuery(sql)
                .execute(Tuple.of(chatId, userId))
                .onItem().transform(rows -> rows.iterator().hasNext()
                        ? Optional.of(from(rows.iterator().next()))
                        : Optional.<Participant>empty());
    }

    @Override
    public Uni<Boolean> isParticipant(long chatId, long userId) {
        return findParticipant(chatId, userId)
                .onItem().transform(participant -> participant.map(Participant::isActive).orElse(false));
    }

    private Participant from(Row row) {
        Participant participant = new Participant();
        participant.setChatId(row.getLong("chat_id"));
        participant.setUserId(row.getLong("user_id"));
        participant.setRole(ParticipantRole.valueOf(row.getString("role")));
        participant.setJoinedAt(row.getLocalDateTime("joined_at"));
        participant.setLeftAt(row.getLocalDateTime("left_at"));
        return participant;
    }
}
