package com.sentimento.service.core.hub;

import java.io.IOException;

/**
 * Outbound side of one subscriber connection, as seen by the hub.
 *
 * <p>Implementations must never block in {@link #send}: the payload is enqueued into the transport's
 * own buffer and flushed asynchronously. {@link #bufferedBytes()} reports what has been enqueued but
 * not yet written to the wire.
 */
public interface LiveTransport {

    /** Normal closure. */
    int CLOSE_NORMAL = 1000;

    /** Unexpected server-side condition. */
    int CLOSE_SERVER_ERROR = 1011;

    /** Server overloaded, try again later. */
    int CLOSE_TRY_AGAIN_LATER = 1013;

    /**
     * Called once by the registry with the assigned id, before the connection is visible to any
     * broadcast. Transports that report their own failures use it to name the connection.
     */
    default void attach(ConnectionId id) {}

    boolean isOpen();

    long bufferedBytes();

    /**
     * Enqueues a text frame.
     *
     * @throws IOException if the transport is already closed or rejects the frame
     */
    void send(String payload) throws IOException;

    void close(int code, String reason);

    /** Remote address for logging; may be {@code "unknown"}. */
    String remoteAddress();
}
