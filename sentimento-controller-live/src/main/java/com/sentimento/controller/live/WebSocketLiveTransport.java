package com.sentimento.controller.live;

import com.sentimento.service.core.hub.ConnectionId;
import com.sentimento.service.core.hub.LiveTransport;
import jakarta.websocket.SendResult;
import jakarta.websocket.Session;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.BiConsumer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.adapter.NativeWebSocketSession;

/**
 * {@link LiveTransport} over a Spring {@link WebSocketSession}, written through the container's
 * asynchronous remote endpoint.
 *
 * <p>{@link #send} appends to an in-memory queue and hands the next write to the shared executor. At
 * most one frame per session is in flight; its completion schedules the following one, so frames keep
 * enqueue order and a subscriber that stops reading holds no thread. Bytes stay counted in
 * {@link #bufferedBytes()} until their write completes.
 */
@Slf4j
public class WebSocketLiveTransport implements LiveTransport {

    private final WebSocketSession session;
    private final FrameWriter writer;
    private final Executor executor;
    private final Queue<Frame> pending = new ConcurrentLinkedQueue<>();
    private final AtomicLong buffered = new AtomicLong();
    private final AtomicBoolean writing = new AtomicBoolean();
    private final AtomicBoolean failed = new AtomicBoolean();
    private volatile ConnectionId id;
    private volatile BiConsumer<ConnectionId, Throwable> failureListener = (connection, cause) -> {};

    public WebSocketLiveTransport(WebSocketSession session, Executor executor) {
        this(session, asyncWriter(session), executor);
    }

    WebSocketLiveTransport(WebSocketSession session, FrameWriter writer, Executor executor) {
        this.session = session;
        this.writer = writer;
        this.executor = executor;
    }

    static FrameWriter asyncWriter(WebSocketSession session) {
        Session nativeSession = session instanceof NativeWebSocketSession nativeWs
                ? nativeWs.getNativeSession(Session.class)
                : null;
        if (nativeSession == null) {
            throw new IllegalStateException("session " + session.getId() + " has no jakarta.websocket.Session");
        }
        return nativeSession.getAsyncRemote()::sendText;
    }

    /** Invoked at most once, with the attached connection id, when a write fails. */
    public void onFailure(BiConsumer<ConnectionId, Throwable> listener) {
        this.failureListener = listener;
    }

    @Override
    public void attach(ConnectionId id) {
        this.id = id;
    }

    @Override
    public boolean isOpen() {
        return session.isOpen();
    }

    @Override
    public long bufferedBytes() {
        return buffered.get();
    }

    @Override
    public void send(String payload) throws IOException {
        if (failed.get() || !session.isOpen()) {
            throw new IOException("session " + session.getId() + " is closed");
        }
        Frame frame = new Frame(payload, payload.getBytes(StandardCharsets.UTF_8).length);
        pending.add(frame);
        buffered.addAndGet(frame.bytes());
        if (writing.compareAndSet(false, true)) {
            try {
                executor.execute(this::writeNext);
            } catch (RejectedExecutionException ex) {
                writing.set(false);
                discardPending();
                throw new IOException("send executor unavailable", ex);
            }
        }
    }

    @Override
    public void close(int code, String reason) {
        try {
            session.close(new CloseStatus(code, reason));
        } catch (IOException ex) {
            log.debug("Close failed session={} cause={}", session.getId(), ex.getMessage());
        }
    }

    @Override
    public String remoteAddress() {
        InetSocketAddress address = session.getRemoteAddress();
        return address == null ? "unknown" : address.toString();
    }

    void writeNext() {
        Frame frame = pending.poll();
        while (frame == null) {
            writing.set(false);
            if (pending.isEmpty() || !writing.compareAndSet(false, true)) {
                return;
            }
            frame = pending.poll();
        }
        if (failed.get()) {
            buffered.addAndGet(-frame.bytes());
            writing.set(false);
            return;
        }
        Frame inFlight = frame;
        try {
            writer.write(inFlight.payload(), result -> written(inFlight, result));
        } catch (RuntimeException ex) {
            buffered.addAndGet(-inFlight.bytes());
            writing.set(false);
            fail(ex);
        }
    }

    private void written(Frame frame, SendResult result) {
        buffered.addAndGet(-frame.bytes());
        if (!result.isOK()) {
            writing.set(false);
            fail(result.getException());
            return;
        }
        try {
            executor.execute(this::writeNext);
        } catch (RejectedExecutionException ex) {
            writing.set(false);
            discardPending();
            log.debug("Pending frames discarded session={} cause=executor stopped", session.getId());
        }
    }

    private void fail(Throwable cause) {
        if (failed.compareAndSet(false, true)) {
            discardPending();
            failureListener.accept(id, cause);
        }
    }

    private void discardPending() {
        Frame frame;
        while ((frame = pending.poll()) != null) {
            buffered.addAndGet(-frame.bytes());
        }
    }

    private record Frame(String payload, int bytes) {}
}
