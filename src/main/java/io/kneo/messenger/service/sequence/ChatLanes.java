package io.kneo.messenger.service.sequence;

import io.smallrye.mutiny.Uni;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Runs asynchronous tasks one at a time per chat, in submission order. A lane exists only while it has work.
 */
public class ChatLanes {
    private static final Logger LOGGER = LoggerFactory.getLogger(ChatLanes.class);

    private final String name;
    private final ConcurrentHashMap<Long, Lane> lanes = new ConcurrentHashMap<>();

    public ChatLanes(String name) {
        this.name = name;
    }

    public <T> Uni<T> submit(long chatId, Supplier<Uni<T>> task) {
        return Uni.createFrom().emitter(emitter -> enqueue(chatId, () -> {
            Uni<T> work;
            try {
                work = task.get();
            } catch (RuntimeException e) {
                work = Uni.createFrom().failure(e);
            }
            work.subscribe().with(
                    item -> {
                        try {
                            emitter.complete(item);
                        } finally {
                            release(chatId);
                        }
                    },
                    failure -> {
                        try {
                            emitter.fail(failure);
                        } finally {
                            release(chatId);
                        }
                    });
        }));
    }

    public int activeLanes() {
        return lanes.size();
    }

    private void enqueue(long chatId, Runnable job) {
        boolean[] startNow = new boolean[1];
        lanes.compute(chatId, (id, lane) -> {
            Lane current = lane == null ? new Lane() : lane;
            if (current.running) {
                current.pending.addLast(job);
            } else {
                current.running = true;
                startNow[0] = true;
            }
            return current;
        });
        if (startNow[0]) {
            run(chatId, job);
        }
    }

    private void release(long chatId) {
        Runnable[] next = new Runnable[1];
        lanes.compute(chatId, (id, lane) -> {
            if (lane == null) {
                return null;
            }
            next[0] = lane.pending.pollFirst();
            if (next[0] == null) {
                return null;
            }
            return lane;
        });
        if (next[0] != null) {
            run(chatId, next[0]);
        }
    }

    private void run(long chatId, Runnable job) {
        try {
            job.run();
        } catch (RuntimeException e) {
            LOGGER.error("{} lane task for chat {} failed to start", name, chatId, e);
            release(chatId);
        }
    }

    private static final class Lane {
        private final Deque<Runnable> pending = new ArrayDeque<>();
        private boolean running;
    }
}
