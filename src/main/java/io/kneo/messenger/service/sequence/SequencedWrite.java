package io.kneo.messenger.service.sequence;

import io.smallrye.mutiny.Uni;

@FunctionalInterface
public interface SequencedWrite<T> {

    Uni<T> write(long seq);
}
