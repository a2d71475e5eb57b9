package io.kneo.messenger.service.delivery;

import jakarta.enterprise.context.ApplicationScoped;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

@ApplicationScoped
public class ConnectionRegistry {
    private static final Logger LOGGER = LoggerFactory.getLogger(ConnectionRegistry.class);

    private final ConcurrentHashMap<Long, ChatShard> shards = new ConcurrentHashMap<>();

    /**
     * Registers the connection for fan-out. An older connection of the same user in the same chat is closed
     * before the new one takes its place.
     *
     * @return false when the connection was already closed and has not been registered
     */
    public boolean register(Connection connection) {
        while (true) {
            ChatShard shard = shards.computeIfAbsent(connection.getChatId(), id -> new ChatShard());
            shard.lock.lock();
            try {
                if (shard.retired) {
                    continue;
                }
                if (connection.isClosed()) {
                    return false;
                }
                Connection previous = shard.connections.remove(connection.getUserId());
                if (previous != null && previous != connection) {
                    LOGGER.info("User {} reconnected to chat {}, evicting connection {}",
                            connection.getUserId(), connection.getChatId(), previous.getId());
                    previous.close(CloseReason.REPLACED);
                }
                shard.connections.put(connection.getUserId(), connection);
                connection.onClose(this::deregister);
                return true;
            } finally {
                shard.lock.unlock();
            }
        }
    }

    public void deregister(Connection connection) {
        ChatShard shard = shards.get(connection.getChatId());
        if (shard == null) {
            return;
        }
        shard.lock.lock();
        try {
            if (!shard.connections.remove(connection.getUserId(), connection)) {
                return;
            }
            LOGGER.debug("Connection {} of user {} left chat {}", connection.getId(), connection.getUserId(), connection.getChatId());
            if (shard.connections.isEmpty()) {
                shard.retired = true;
                shards.remove(connection.getChatId(), shard);
            }
        } finally {
            shard.lock.unlock();
        }
    }

    public List<Connection> list(long chatId) {
        ChatShard shard = shards.get(chatId);
        if (shard == null) {
            return List.of();
        }
        shard.lock.lock();
        try {
            return new ArrayList<>(shard.connections.values());
        } finally {
            shard.lock.unlock();
        }
    }

    public int count(long chatId) {
        return list(chatId).size();
    }

    public int totalConnections() {
        return shards.keySet().stream()
                .mapToInt(this::count)
                .sum();
    }

    private static final class ChatShard {
        private final ReentrantLock lock = new ReentrantLock();
        private final Map<Long, Connection> connections = new HashMap<>();
        private boolean retired;
    }
}
