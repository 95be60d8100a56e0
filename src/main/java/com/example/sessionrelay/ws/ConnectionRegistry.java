package com.example.sessionrelay.ws;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ScheduledExecutorService;

/**
 * At most one authoritative connection per user. Holds no per-call state.
 */
@Component
public class ConnectionRegistry {

    private static final Logger log = LoggerFactory.getLogger(ConnectionRegistry.class);

    private final ConcurrentMap<String, RelayConnection> byUser = new ConcurrentHashMap<>();
    private final RelayMessageCodec codec;
    private final ScheduledExecutorService deadlineScheduler;

    public ConnectionRegistry(RelayMessageCodec codec, ScheduledExecutorService deadlineScheduler) {
        this.codec = codec;
        this.deadlineScheduler = deadlineScheduler;
    }

    /**
     * Opens a connection for the user; a connection already registered for that user is superseded.
     */
    public RelayConnection register(String userId, DelegateTransport transport) {
        RelayConnection conn = new RelayConnection(userId, transport, codec, deadlineScheduler,
                c -> deregister(c.getUserId(), c.getTransport()));
        conn.open();
        RelayConnection previous = byUser.put(userId, conn);
        if (previous != null && previous != conn) {
            log.info("Superseding relay connection. userId={} old={} new={}", userId, previous.getId(), conn.getId());
            previous.supersede();
        }
        log.info("Relay connection registered. userId={} connectionId={} total={}", userId, conn.getId(), byUser.size());
        return conn;
    }

    /**
     * Empty unless the user's connection is OPEN.
     */
    public Optional<RelayConnection> lookup(String userId) {
        if (userId == null) return Optional.empty();
        RelayConnection conn = byUser.get(userId);
        return (conn != null && conn.isOpen()) ? Optional.of(conn) : Optional.empty();
    }

    /**
     * Removes the user's entry only if it still belongs to {@code transport}; a stale transport closing late
     * must not evict its replacement.
     *
     * @return the removed connection, if any
     */
    public Optional<RelayConnection> deregister(String userId, DelegateTransport transport) {
        if (userId == null || transport == null) return Optional.empty();
        RelayConnection[] removed = new RelayConnection[1];
        byUser.computeIfPresent(userId, (k, conn) -> {
            if (conn.getTransport() == transport) {
                removed[0] = conn;
                return null;
            }
            return conn;
        });
        if (removed[0] != null) {
            log.info("Relay connection deregistered. userId={} connectionId={} total={}", userId, removed[0].getId(), byUser.size());
        }
        return Optional.ofNullable(removed[0]);
    }

    public List<RelayConnection> openConnections() {
        List<RelayConnection> out = new ArrayList<>();
        for (RelayConnection c : byUser.values()) {
            if (c.isOpen()) out.add(c);
        }
        return out;
    }

    public int size() {
        return byUser.size();
    }
}
