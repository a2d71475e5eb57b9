package io.kneo.messenger.service.delivery;

import io.kneo.messenger.dto.OutboundFrameDTO;

import java.util.ArrayDeque;
import java.util.Deque;

public class OutboundQueue {

    public enum Offer {
        ACCEPTED,
        // first frame over capacity, the grace period starts now
        SATURATED,
        OVER_CAPACITY,
        EXPIRED,
        CLOSED,
        // message frame does not follow the last one queued for the connection
        OUT_OF_ORDER
    }

    private final int capacity;
    private final int overflowLimit;
    private final long graceMillis;
    private final Deque<OutboundFrameDTO> frames = new ArrayDeque<>();
    private long saturatedSince = -1;
    private boolean closed;

    public OutboundQueue(int capacity, long graceMillis) {
        this(capacity, capacity, graceMillis);
    }

    public OutboundQueue(int capacity, int overflowLimit, long graceMillis) {
        if (capacity < 1 || overflowLimit < 1) {
            throw new IllegalArgumentException("Outbound queue capacity and overflow limit must be positive");
        }
        this.capacity = capacity;
        this.overflowLimit = overflowLimit;
        this.graceMillis = graceMillis;
    }

    public synchronized Offer offer(OutboundFrameDTO frame, long nowMillis) {
        if (closed) {
            return Offer.CLOSED;
        }
        if (isExpired(nowMillis) || frames.size() >= capacity + overflowLimit) {
            return Offer.EXPIRED;
        }
        frames.addLast(frame);
        if (frames.size() <= capacity) {
            return Offer.ACCEPTED;
        }
        if (saturatedSince < 0) {
            saturatedSince = nowMillis;
            return Offer.SATURATED;
        }
        return Offer.OVER_CAPACITY;
    }

    public synchronized OutboundFrameDTO poll() {
        OutboundFrameDTO frame = frames.pollFirst();
        if (frames.size() <= capacity) {
            saturatedSince = -1;
        }
        return frame;
    }

    public synchronized boolean isExpired(long nowMillis) {
        return saturatedSince >= 0 && nowMillis - saturatedSince >= graceMillis;
    }

    public synchronized boolean isSaturated() {
        return saturatedSince >= 0;
    }

    public synchronized boolean isEmpty() {
        return frames.isEmpty();
    }

    public synchronized int size() {
        return frames.size();
    }

    /**
     * Drops every pending frame and refuses further offers.
     *
     * @return number of frames that were discarded
     */
    public synchronized int close() {
        closed = true;
        int dropped = frames.size();
        frames.clear();
        saturatedSince = -1;
        return dropped;
    }

    public long getGraceMillis() {
        return graceMillis;
    }
}
