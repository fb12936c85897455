package com.sentimento.controller.live;

import com.sentimento.service.core.hub.ConnectionRegistry;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.server.ServerHttpRequest;
import org.springframework.http.server.ServerHttpResponse;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.WebSocketHandler;
import org.springframework.web.socket.server.HandshakeInterceptor;

/** Refuses the upgrade with 503 while the registry is full. */
@Component
@Slf4j
@RequiredArgsConstructor
public class CapacityHandshakeInterceptor implements HandshakeInterceptor {

    static final String AT_CAPACITY = "{\"error\":\"Server at capacity\"}";

    private final ConnectionRegistry registry;

    @Override
    public boolean beforeHandshake(
            ServerHttpRequest request, ServerHttpResponse response, WebSocketHandler handler, Map<String, Object> attributes)
            throws IOException {
        if (registry.hasCapacity()) {
            return true;
        }
        log.warn(
                "Upgrade refused remote={} live={} max={}",
                request.getRemoteAddress(),
                registry.size(),
                registry.maxConnections());
        response.setStatusCode(HttpStatus.SERVICE_UNAVAILABLE);
        response.getHeaders().setContentType(MediaType.APPLICATION_JSON);
        response.getBody().write(AT_CAPACITY.getBytes(StandardCharsets.UTF_8));
        return false;
    }

    @Override
    public void afterHandshake(
            ServerHttpRequest request, ServerHttpResponse response, WebSocketHandler handler, Exception exception) {
        if (exception != null) {
            log.warn("Upgrade failed remote={} cause={}", request.getRemoteAddress(), exception.getMessage());
        }
    }
}
