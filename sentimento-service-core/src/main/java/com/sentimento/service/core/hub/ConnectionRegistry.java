package com.sentimento.service.core.hub;

import com.sentimento.service.core.config.SentimentoProperties;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentNavigableMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Live subscriber connections keyed by {@link ConnectionId}, in registration order.
 *
 * <p>Traversal always runs over a point-in-time copy, so connections registered or removed while a
 * broadcast is in progress neither appear nor vanish halfway through it. Unregistration is idempotent
 * and always happens before a failed or closed transport is cleaned up.
 */
@Component
@Slf4j
public class ConnectionRegistry {

    private final ConcurrentNavigableMap<ConnectionId, Connection> connections = new ConcurrentSkipListMap<>();
    private final AtomicLong sequence = new AtomicLong();
    private final AtomicInteger live = new AtomicInteger();
    private final int maxConnections;
    private final Clock clock;

    @Autowired
    public ConnectionRegistry(SentimentoProperties properties, Clock clock) {
        this(properties.getHub().getMaxConnections(), clock);
    }

    public ConnectionRegistry(int maxConnections, Clock clock) {
        if (maxConnections <= 0) {
            throw new IllegalArgumentException("maxConnections must be positive, got " + maxConnections);
        }
        this.maxConnections = maxConnections;
        this.clock = clock;
    }

    /**
     * @throws ResourceExhaustedException when {@code maxConnections} are already registered
     */
    public ConnectionId register(LiveTransport transport) {
        if (live.incrementAndGet() > maxConnections) {
            live.decrementAndGet();
            log.warn("Connection rejected remote={} live={} max={}", transport.remoteAddress(), size(), maxConnections);
            throw new ResourceExhaustedException("connection limit reached (" + maxConnections + ")");
        }
        ConnectionId id = new ConnectionId(sequence.incrementAndGet());
        transport.attach(id);
        connections.put(id, new Connection(id, transport, clock.instant()));
        log.info("Connection registered connection={} remote={} live={}", id, transport.remoteAddress(), size());
        return id;
    }

    /** Removes the connection if present. Returns {@code false} for ids that are already gone or never existed. */
    public boolean unregister(ConnectionId id) {
        if (id == null) {
            return false;
        }
        Connection removed = connections.remove(id);
        if (removed == null) {
            return false;
        }
        removed.markUnregistered();
        live.decrementAndGet();
        log.info("Connection unregistered connection={} live={}", id, size());
        return true;
    }

    /** Client-initiated or transport-reported close. */
    public void transportClosed(ConnectionId id) {
        unregister(id);
    }

    /** Transport failure: unregister first so no further send can target the handle, then close it. */
    public void transportFailed(ConnectionId id, Throwable cause) {
        if (id == null) {
            return;
        }
        Connection connection = connections.get(id);
        boolean removed = unregister(id);
        if (removed) {
            log.warn("Connection failed connection={} cause={}", id, describe(cause));
            connection.close(LiveTransport.CLOSE_SERVER_ERROR, "Transport error");
        }
    }

    public Optional<Connection> find(ConnectionId id) {
        return Optional.ofNullable(connections.get(id));
    }

    public Snapshot snapshot() {
        return new Snapshot(List.copyOf(connections.values()));
    }

    public void forEach(Consumer<Connection> visitor) {
        snapshot().forEach(visitor);
    }

    public int size() {
        return Math.max(0, live.get());
    }

    public boolean hasCapacity() {
        return size() < maxConnections;
    }

    public int maxConnections() {
        return maxConnections;
    }

    /** Unregisters and closes every connection. Used on shutdown. */
    public int closeAll(int code, String reason) {
        List<Connection> closing = new ArrayList<>();
        for (Connection connection : snapshot()) {
            if (unregister(connection.id())) {
                closing.add(connection);
            }
        }
        for (Connection connection : closing) {
            try {
                connection.close(code, reason);
            } catch (RuntimeException ex) {
                log.warn("Close failed connection={} cause={}", connection.id(), describe(ex));
            }
        }
        return closing.size();
    }

    private static String describe(Throwable cause) {
        if (cause == null) {
            return "unknown";
        }
        return cause.getMessage() == null ? cause.getClass().getSimpleName() : cause.getMessage();
    }

    /** Point-in-time view of the registered connections. Iterating it again replays the same connections. */
    public static final class Snapshot implements Iterable<Connection> {
        private final List<Connection> connections;

        private Snapshot(List<Connection> connections) {
            this.connections = connections;
        }

        public int size() {
            return connections.size();
        }

        public List<ConnectionId> ids() {
            return connections.stream().map(Connection::id).toList();
        }

        @Override
        public Iterator<Connection> iterator() {
            return connections.iterator();
        }
    }
}
