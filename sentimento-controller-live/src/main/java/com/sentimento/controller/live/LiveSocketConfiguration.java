package com.sentimento.controller.live;

import com.sentimento.service.core.config.SentimentoProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

@Configuration
@EnableWebSocket
@RequiredArgsConstructor
public class LiveSocketConfiguration implements WebSocketConfigurer {

    private final SentimentoProperties properties;
    private final LiveFeedHandler handler;
    private final CapacityHandshakeInterceptor capacityInterceptor;

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(handler, properties.getHub().getLivePath())
                .addInterceptors(capacityInterceptor)
                .setAllowedOriginPatterns(properties.getCors().getAllowOrigin());
    }
}
