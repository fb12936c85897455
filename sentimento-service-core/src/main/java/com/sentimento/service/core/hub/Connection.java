package com.sentimento.service.core.hub;

import java.io.IOException;
import java.time.Instant;

/**
 * A registered subscriber. The transport handle stays private to the hub package so every outbound
 * frame has to pass through {@link BackpressureGate#send}.
 */
public final class Connection {

    private final ConnectionId id;
    private final LiveTransport transport;
    private final Instant connectedAt;
    private volatile boolean registered = true;

    Connection(ConnectionId id, LiveTransport transport, Instant connectedAt) {
        this.id = id;
        this.transport = transport;
        this.connectedAt = connectedAt;
    }

    public ConnectionId id() {
        return id;
    }

    public Instant connectedAt() {
        return connectedAt;
    }

    public String remoteAddress() {
        return transport.remoteAddress();
    }

    /** Bytes enqueued on the transport but not yet flushed. Snapshot read, never blocks. */
    public long bufferedBytes() {
        return transport.bufferedBytes();
    }

    public boolean isRegistered() {
        return registered;
    }

    void markUnregistered() {
        registered = false;
    }

    void enqueue(String payload) throws IOException {
        if (!registered) {
            throw new IOException("connection " + id + " is no longer registered");
        }
        transport.send(payload);
    }

    void close(int code, String reason) {
        if (transport.isOpen()) {
            transport.close(code, reason);
        }
    }

    @Override
    public String toString() {
        return id + "@" + transport.remoteAddress();
    }
}
