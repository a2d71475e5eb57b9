package io.kneo.messenger.service.delivery;

import io.kneo.messenger.dto.OutboundFrameDTO;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class OutboundQueueTest {

    @Test
    void saturationStartsWhenCapacityIsExceededAndExpiresAfterGrace() {
        OutboundQueue queue = new OutboundQueue(2, 1000);

        assertEquals(OutboundQueue.Offer.ACCEPTED, queue.offer(frame(1), 0));
        assertEquals(OutboundQueue.Offer.ACCEPTED, queue.offer(frame(2), 0));
        assertEquals(OutboundQueue.Offer.SATURATED, queue.offer(frame(3), 100));
        assertEquals(OutboundQueue.Offer.OVER_CAPACITY, queue.offer(frame(4), 500));

        assertTrue(queue.isSaturated());
        assertFalse(queue.isExpired(1099));
        assertTrue(queue.isExpired(1100));
        assertEquals(OutboundQueue.Offer.EXPIRED, queue.offer(frame(5), 1100));
        assertEquals(4, queue.size());
    }

    @Test
    void overflowIsCappedEvenWithinGrace() {
        OutboundQueue queue = new OutboundQueue(4, 4, 5000);
        for (long seq = 1; seq <= 8; seq++) {
            queue.offer(frame(seq), 0);
        }

        assertEquals(OutboundQueue.Offer.EXPIRED, queue.offer(frame(9), 0));
        assertEquals(8, queue.size());
        assertFalse(queue.isExpired(0));
    }

    @Test
    void drainingBelowCapacityClearsSaturation() {
        OutboundQueue queue = new OutboundQueue(1, 1000);
        queue.offer(frame(1), 0);
        queue.offer(frame(2), 0);
        assertTrue(queue.isSaturated());

        assertEquals(1L, queue.poll().getSeq());

        assertFalse(queue.isSaturated());
        assertFalse(queue.isExpired(5000));
        assertEquals(OutboundQueue.Offer.SATURATED, queue.offer(frame(3), 5000));
    }

    @Test
    void framesLeaveInArrivalOrder() {
        OutboundQueue queue = new OutboundQueue(8, 1000);
        OutboundFrameDTO error = OutboundFrameDTO.error("malformed_frame");
        queue.offer(frame(1), 0);
        queue.offer(error, 0);
        queue.offer(frame(2), 0);

        assertEquals(1L, queue.poll().getSeq());
        assertSame(error, queue.poll());
        assertEquals(2L, queue.poll().getSeq());
        assertNull(queue.poll());
    }

    @Test
    void closedQueueDropsEverythingAndRefusesOffers() {
        OutboundQueue queue = new OutboundQueue(1, 1000);
        queue.offer(frame(1), 0);
        queue.offer(frame(2), 0);

        assertEquals(2, queue.close());
        assertTrue(queue.isEmpty());
        assertFalse(queue.isSaturated());
        assertEquals(OutboundQueue.Offer.CLOSED, queue.offer(frame(3), 0));
    }

    private static OutboundFrameDTO frame(long seq) {
        return OutboundFrameDTO.read(1L, 2L, seq);
    }
}
