package io.kneo.messenger.service.external;

import io.smallrye.mutiny.Uni;

public interface ParticipantDirectory {

    Uni<Boolean> isParticipant(long chatId, long userId);
}
