package io.kneo.messenger.service.external;

import io.smallrye.mutiny.Uni;

public interface WatermarkStore {

    Uni<Long> getWatermark(long chatId, long userId);

    /**
     * Moves the watermark to {@code seq} only if it is currently lower.
     *
     * @return true when the stored value changed
     */
    Uni<Boolean> advanceWatermark(long chatId, long userId, long seq);
}
