package com.sentimento.controller.live;

import com.sentimento.live.model.IsoTimestamps;
import com.sentimento.live.model.WelcomeFrame;
import com.sentimento.service.core.hub.BroadcastDispatcher;
import com.sentimento.service.core.hub.ConnectionId;
import com.sentimento.service.core.hub.ConnectionRegistry;
import com.sentimento.service.core.hub.LiveTransport;
import com.sentimento.service.core.hub.ResourceExhaustedException;
import jakarta.annotation.PreDestroy;
import java.time.Clock;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

/**
 * Subscriber endpoint. Each accepted session becomes a registered connection that receives a welcome
 * frame followed by every broadcast event. Inbound frames are logged and otherwise ignored.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class LiveFeedHandler extends TextWebSocketHandler {

    static final String CONNECTION_ID = LiveFeedHandler.class.getName() + ".connectionId";

    private final ConnectionRegistry registry;
    private final BroadcastDispatcher dispatcher;
    private final LiveSendExecutor sendExecutor;
    private final Clock clock;

    @Override
    public void afterConnectionEstablished(WebSocketSession session) throws Exception {
        WebSocketLiveTransport transport = new WebSocketLiveTransport(session, sendExecutor);
        transport.onFailure(registry::transportFailed);
        ConnectionId id;
        try {
            id = dispatcher.connect(transport, WelcomeFrame.connected(IsoTimestamps.now(clock)));
        } catch (ResourceExhaustedException ex) {
            session.close(CloseStatus.SERVICE_OVERLOAD.withReason("Server at capacity"));
            return;
        }
        session.getAttributes().put(CONNECTION_ID, id);
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        log.debug("Inbound frame ignored connection={} length={}", connectionId(session), message.getPayloadLength());
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        ConnectionId id = connectionId(session);
        if (id != null) {
            registry.transportFailed(id, exception);
        }
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        ConnectionId id = connectionId(session);
        if (id != null) {
            registry.transportClosed(id);
            log.debug("Connection closed connection={} code={} reason={}", id, status.getCode(), status.getReason());
        }
    }

    @PreDestroy
    void shutdown() {
        int closed = registry.closeAll(LiveTransport.CLOSE_NORMAL, "Server shutdown");
        log.info("Live feed shut down, closed {} connection(s)", closed);
    }

    private static ConnectionId connectionId(WebSocketSession session) {
        Object value = session.getAttributes().get(CONNECTION_ID);
        return value instanceof ConnectionId id ? id : null;
    }
}
